package com.shopcrawl.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcrawl.core.model.CrawlResult;
import com.shopcrawl.core.model.TerminalState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class JsonResultExporterTest {

    @TempDir Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writes_domain_keyed_object_in_insertion_order() throws Exception {
        Map<String, CrawlResult> results = new LinkedHashMap<>();
        results.put("zeta.example", new CrawlResult("zeta.example",
                List.of("https://zeta.example/p/1", "https://zeta.example/p/2"),
                Instant.parse("2024-05-01T10:15:30Z"), TerminalState.COMPLETED, 9));
        results.put("alpha.example", CrawlResult.failed("alpha.example", Instant.parse("2024-05-01T10:16:00Z")));

        Path out = new JsonResultExporter().write(tmp.resolve("nested/product_urls.json"), results);

        assertThat(out).exists();
        JsonNode root = mapper.readTree(out.toFile());
        assertThat(root.fieldNames()).toIterable().containsExactly("zeta.example", "alpha.example");

        JsonNode zeta = root.get("zeta.example");
        assertThat(zeta.get("count").asInt()).isEqualTo(2);
        assertThat(zeta.get("urls")).hasSize(2);
        assertThat(zeta.get("urls").get(0).asText()).isEqualTo("https://zeta.example/p/1");
        assertThat(zeta.get("timestamp").isTextual()).isTrue();
        assertThat(Instant.parse(zeta.get("timestamp").asText())).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));

        JsonNode alpha = root.get("alpha.example");
        assertThat(alpha.get("count").asInt()).isZero();
        assertThat(alpha.get("urls").isArray()).isTrue();
    }

    @Test
    void rewrite_replaces_file_and_leaves_no_temp() throws Exception {
        Path file = tmp.resolve("out.json");
        JsonResultExporter exporter = new JsonResultExporter();
        exporter.write(file, Map.of());
        exporter.write(file, Map.of("a.example",
                new CrawlResult("a.example", List.of("https://a.example/p/1"), Instant.EPOCH,
                        TerminalState.TIMED_OUT, 1)));

        assertThat(mapper.readTree(file.toFile()).get("a.example").get("count").asInt()).isEqualTo(1);
        try (Stream<Path> files = Files.list(tmp)) {
            assertThat(files).containsExactly(file);
        }
    }
}
