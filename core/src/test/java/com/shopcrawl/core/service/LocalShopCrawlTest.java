package com.shopcrawl.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcrawl.core.http.DefaultRetryPolicy;
import com.shopcrawl.core.http.HttpPageFetcher;
import com.shopcrawl.core.http.RetryingFetcher;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.CrawlResult;
import com.shopcrawl.core.model.CrawlStats;
import com.shopcrawl.core.model.TerminalState;
import com.shopcrawl.core.service.export.JsonResultExporter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/** 로컬 HttpServer 로 띄운 작은 상점을 실제 HTTP 스택으로 끝까지 크롤한다. */
class LocalShopCrawlTest {

    static HttpServer s;
    static int port;
    static final AtomicInteger flakyHits = new AtomicInteger();

    @TempDir Path tmp;

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        port = s.getAddress().getPort();
        s.createContext("/", ex -> {
            String path = ex.getRequestURI().getPath();
            switch (path) {
                case "/":
                    respond(ex, 200, "text/html; charset=utf-8", page(
                            "<a href='/product/alpha'>Alpha</a><a href='/c/shoes'>Shoes</a>"
                            + "<a href='/flaky'>Sale</a><a href='/login'>Login</a>"));
                    break;
                case "/product/alpha":
                    respond(ex, 200, "text/html", "<html><head><script type='application/ld+json'>"
                            + "{\"@type\":\"Product\",\"name\":\"Alpha\"}</script></head><body>Alpha</body></html>");
                    break;
                case "/c/shoes":
                    respond(ex, 200, "text/html", page("<a href='/product/beta?utm_source=nav'>Beta</a>"));
                    break;
                case "/product/beta":
                    respond(ex, 200, "text/html", page("<p>$19.99</p><button>Add to cart</button>"));
                    break;
                case "/flaky":
                    if (flakyHits.incrementAndGet() == 1) {
                        respond(ex, 503, "text/plain", "busy");
                    } else {
                        respond(ex, 200, "text/html", page("<a href='/product/gamma'>Gamma</a>"));
                    }
                    break;
                case "/logo.png":
                    respond(ex, 200, "image/png", "png");
                    break;
                default:
                    respond(ex, 404, "text/plain", "nope");
            }
        });
        s.start();
    }

    @AfterAll
    static void down() { s.stop(0); }

    private static String page(String body) { return "<html><body>" + body + "</body></html>"; }

    private static void respond(HttpExchange ex, int code, String type, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", type);
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }

    @Test
    void crawls_local_shop_end_to_end() throws Exception {
        String domain = "http://localhost:" + port;
        CrawlConfig cfg = CrawlConfig.defaults()
                .setDomains(List.of(domain))
                .setMaxDepth(2)
                .setRetryDelay(Duration.ZERO)
                .setRequestsPerSecond(0)
                .setRequestTimeout(Duration.ofSeconds(5))
                .setOutputFile(tmp.resolve("product_urls.json"));
        cfg.dynamic().setEnabled(false);
        cfg.validate();

        CrawlStats fetchStats = new CrawlStats();
        RetryingFetcher fetcher = new RetryingFetcher(List.of(new HttpPageFetcher(cfg)),
                DefaultRetryPolicy.from(cfg), d -> {}, fetchStats);
        CrawlOrchestrator o = new CrawlOrchestrator(CrawlOrchestrator.domainCrawlers(fetcher, null),
                new JsonResultExporter());

        Map<String, CrawlResult> out = o.runAll(cfg.getDomains(), cfg);

        CrawlResult r = out.get(domain);
        assertThat(r.getTerminalState()).isEqualTo(TerminalState.COMPLETED);
        assertThat(r.getUrls()).containsExactly(
                domain + "/product/alpha",
                domain + "/product/beta");
        // /flaky 는 한 번 503 후 재시도로 성공, /product/gamma 는 404 로 건너뜀
        assertThat(flakyHits.get()).isEqualTo(2);
        assertThat(fetchStats.snapshot().retriesTotal).isEqualTo(1);
        assertThat(o.getStats().fetchFailures).isEqualTo(1);

        JsonNode json = new ObjectMapper().readTree(cfg.getOutputFile().toFile());
        assertThat(json.get(domain).get("count").asInt()).isEqualTo(2);
    }
}
