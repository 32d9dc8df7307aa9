package com.shopcrawl.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.shopcrawl.core.model.CrawlResult;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;

/**
 * 결과 파일 writer.
 * 형식: { "<domain>": { "urls": [...], "count": n, "timestamp": "ISO-8601" }, ... }
 * 임시 파일에 쓴 뒤 원자적으로 교체하므로 중간에 죽어도 직전 스냅샷이 남는다.
 */
public final class JsonResultExporter {

    private final ObjectMapper mapper;

    public JsonResultExporter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** results 순서(삽입 순서)대로 기록 */
    public synchronized Path write(Path file, Map<String, CrawlResult> results) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(results, "results");

        ObjectNode root = mapper.createObjectNode();
        results.forEach((domain, r) -> root.set(domain, toNode(r)));

        Path abs = file.toAbsolutePath();
        Path dir = abs.getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir != null ? dir : Path.of("."), abs.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        return abs;
    }

    private ObjectNode toNode(CrawlResult r) {
        ObjectNode n = mapper.createObjectNode();
        ArrayNode urls = n.putArray("urls");
        r.getUrls().forEach(urls::add);
        n.put("count", r.getCount());
        n.set("timestamp", mapper.valueToTree(r.getTimestamp()));
        return n;
    }
}
