package com.shopcrawl.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcrawl.core.api.ICrawler;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.CrawlResult;
import com.shopcrawl.core.model.TerminalState;
import com.shopcrawl.core.service.export.JsonResultExporter;
import com.shopcrawl.core.util.CrawlClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlOrchestratorTest {

    @TempDir Path tmp;

    /** 지정한 결과를 돌려주거나 예외를 던지는 가짜 크롤러 */
    private static ICrawler fake(String domain, Runnable body, String... urls) {
        return new ICrawler() {
            @Override public String domain() { return domain; }
            @Override public CrawlResult crawl() {
                body.run();
                List<String> list = new ArrayList<>();
                for (String u : urls) list.add("https://" + domain + u);
                return new CrawlResult(domain, list, Instant.now(), TerminalState.COMPLETED, urls.length);
            }
        };
    }

    private CrawlConfig cfg(String... domains) {
        return CrawlConfig.defaults()
                .setDomains(List.of(domains))
                .setConcurrency(3)
                .setOutputFile(tmp.resolve("product_urls.json"));
    }

    @Test
    @DisplayName("한 도메인이 예외로 죽어도 나머지는 정상 결과, 실패 도메인은 빈 결과")
    void failure_is_isolated() throws Exception {
        CrawlConfig c = cfg("a.example", "boom.example", "c.example");
        CrawlOrchestrator o = new CrawlOrchestrator((d, cfg, deadline, stats) -> {
            if (d.startsWith("boom")) return fake(d, () -> { throw new IllegalStateException("driver crashed"); });
            return fake(d, () -> {}, "/p/1", "/p/2");
        }, new JsonResultExporter());

        Map<String, CrawlResult> out = o.runAll(c.getDomains(), c);

        assertThat(out.keySet()).containsExactly("a.example", "boom.example", "c.example");
        assertThat(out.get("a.example").getCount()).isEqualTo(2);
        assertThat(out.get("c.example").getUrls()).containsExactly("https://c.example/p/1", "https://c.example/p/2");
        assertThat(out.get("boom.example").getTerminalState()).isEqualTo(TerminalState.FAILED);
        assertThat(out.get("boom.example").getUrls()).isEmpty();

        JsonNode written = new ObjectMapper().readTree(c.getOutputFile().toFile());
        assertThat(written.fieldNames()).toIterable().containsExactly("a.example", "boom.example", "c.example");
        assertThat(written.get("boom.example").get("count").asInt()).isZero();
    }

    @Test
    void domains_run_in_parallel_on_named_threads() {
        CrawlConfig c = cfg("a.example", "b.example", "c.example");
        Set<String> threads = ConcurrentHashMap.newKeySet();
        CrawlOrchestrator o = new CrawlOrchestrator((d, cfg, deadline, stats) ->
                fake(d, () -> threads.add(Thread.currentThread().getName())), null);

        o.runAll(c.getDomains(), c);

        assertThat(threads).isNotEmpty().allMatch(n -> n.startsWith("crawl-domain-"));
    }

    @Test
    @DisplayName("중복/공백 도메인은 한 번만, 진행률은 도메인 완료마다 보고")
    void dedup_and_progress() {
        CrawlConfig c = cfg();
        List<Long> done = Collections.synchronizedList(new ArrayList<>());
        CrawlOrchestrator o = new CrawlOrchestrator((d, cfg, deadline, stats) -> fake(d, () -> {}), null,
                (p, phase, n, total) -> { if (!"crawl".equals(phase) && !"export".equals(phase)) done.add(n); },
                CrawlClock.SYSTEM);

        Map<String, CrawlResult> out = o.runAll(List.of("a.example", " a.example ", "", "b.example"), c);

        assertThat(out).containsOnlyKeys("a.example", "b.example");
        assertThat(done).containsExactly(1L, 2L);
    }

    @Test
    void global_deadline_is_passed_to_crawlers() {
        CrawlConfig c = cfg("a.example").setGlobalTimeout(Duration.ofSeconds(60));
        long[] seen = new long[1];
        CrawlOrchestrator o = new CrawlOrchestrator((d, cfg, deadline, stats) -> {
            seen[0] = deadline;
            return fake(d, () -> {});
        }, null, null, () -> 1_000L);

        o.runAll(c.getDomains(), c);

        assertThat(seen[0]).isEqualTo(61_000L);
    }

    @Test
    void invalid_domain_lists_fail_before_crawling() {
        CrawlConfig c = cfg();
        CrawlOrchestrator o = new CrawlOrchestrator((d, cfg, deadline, stats) -> {
            throw new AssertionError("must not create crawler");
        }, null);

        assertThatThrownBy(() -> o.runAll(List.of(), c)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> o.runAll(List.of("a.example", "https://"), c))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("https://");
    }
}
