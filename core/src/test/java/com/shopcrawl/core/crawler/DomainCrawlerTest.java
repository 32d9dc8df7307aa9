package com.shopcrawl.core.crawler;

import com.shopcrawl.core.api.PageFetcher;
import com.shopcrawl.core.http.DefaultRetryPolicy;
import com.shopcrawl.core.http.FetchException;
import com.shopcrawl.core.http.PermanentFetchException;
import com.shopcrawl.core.http.RetryingFetcher;
import com.shopcrawl.core.http.TransientFetchException;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.CrawlResult;
import com.shopcrawl.core.model.CrawlStats;
import com.shopcrawl.core.model.FetchMode;
import com.shopcrawl.core.model.FetchedPage;
import com.shopcrawl.core.model.PageContent;
import com.shopcrawl.core.model.TerminalState;
import com.shopcrawl.core.render.DynamicContentResolver;
import com.shopcrawl.core.render.ScriptedRenderHandle;
import com.shopcrawl.core.util.FrozenClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainCrawlerTest {

    private static final String HOME = "https://shop.example";

    private static final String PRODUCT_LD =
            "<script type='application/ld+json'>{\"@context\":\"https://schema.org\",\"@type\":\"Product\"}</script>";

    /** URL → HTML 그래프 기반 가짜 STATIC 페처. 없는 URL 은 404, flaky 는 항상 503 */
    static final class GraphFetcher implements PageFetcher {
        final Map<String, String> pages = new HashMap<>();
        final Set<String> flaky = new HashSet<>();
        final List<String> calls = new ArrayList<>();
        Runnable onFetch = () -> {};

        GraphFetcher page(String url, String html) { pages.put(url, html); return this; }

        @Override public FetchMode mode() { return FetchMode.STATIC; }

        @Override public FetchedPage fetch(URI url) throws FetchException {
            calls.add(url.toString());
            onFetch.run();
            if (flaky.contains(url.toString())) throw new TransientFetchException(url, 503, "HTTP 503");
            String html = pages.get(url.toString());
            if (html == null) throw new PermanentFetchException(url, 404, "HTTP 404");
            return FetchedPage.ofStatic(PageContent.of(url, html));
        }
    }

    /** 항상 같은 렌더 핸들을 내주는 가짜 DYNAMIC 페처 */
    static final class RenderingFetcher implements PageFetcher {
        final ScriptedRenderHandle handle;
        int calls;

        RenderingFetcher(ScriptedRenderHandle handle) { this.handle = handle; }

        @Override public FetchMode mode() { return FetchMode.DYNAMIC; }

        @Override public FetchedPage fetch(URI url) {
            calls++;
            return FetchedPage.rendered(PageContent.of(url, "<html><body></body></html>"), handle);
        }
    }

    private static String html(String body) { return "<html><body>" + body + "</body></html>"; }

    private static String a(String href) { return "<a href='" + href + "'>link</a>"; }

    private static CrawlConfig cfg() {
        CrawlConfig c = CrawlConfig.defaults()
                .setDomains(List.of("shop.example"))
                .setMaxDepth(2)
                .setRequestsPerSecond(0)
                .setRetryDelay(Duration.ZERO);
        c.dynamic().setEnabled(false);
        return c;
    }

    private static RetryingFetcher retrying(CrawlConfig cfg, PageFetcher... fetchers) {
        return new RetryingFetcher(List.of(fetchers), DefaultRetryPolicy.from(cfg), d -> {}, null);
    }

    private static DomainCrawler.Builder crawler(CrawlConfig cfg, RetryingFetcher f) {
        return DomainCrawler.builder("shop.example", cfg).fetcher(f).clock(new FrozenClock(1_000));
    }

    @Test
    @DisplayName("E2E: 홈 → 상품 1 + 카테고리 → 상품 2, maxDepth=2 → BFS 순서로 3개")
    void end_to_end_breadth_first_products() {
        GraphFetcher g = new GraphFetcher()
                .page(HOME, html(a("/product/alpha") + a("/c/shoes") + a("/about")
                        + a("https://other.example/product/zzz")))
                .page(HOME + "/product/alpha", "<html><head>" + PRODUCT_LD + "</head><body>"
                        + "<h1>Alpha</h1><p>$49.99</p><button>Add to Cart</button>" + a("/") + "</body></html>")
                .page(HOME + "/c/shoes", html("<h2>Shoes</h2>" + a("/product/beta") + a("/p/gamma-1")))
                .page(HOME + "/product/beta", html("<p>Price $19.99</p><button>Add to cart</button>" + a("/c/deep")))
                .page(HOME + "/p/gamma-1", html("<button>Buy now</button>"));
        CrawlConfig c = cfg();
        CrawlStats stats = new CrawlStats();

        CrawlResult r = crawler(c, retrying(c, g)).stats(stats).build().crawl();

        assertThat(r.getTerminalState()).isEqualTo(TerminalState.COMPLETED);
        assertThat(r.getUrls()).containsExactly(
                HOME + "/product/alpha",
                HOME + "/product/beta",
                HOME + "/p/gamma-1");
        assertThat(r.getCount()).isEqualTo(3);
        assertThat(r.getPagesVisited()).isEqualTo(5);
        // 제외 경로, 타 도메인, 깊이 3 링크는 요청조차 하지 않는다
        assertThat(g.calls).doesNotContain(HOME + "/about", HOME + "/c/deep",
                "https://other.example/product/zzz");
        assertThat(stats.snapshot().productsFound).isEqualTo(3);
    }

    @Test
    @DisplayName("항상 일시 오류인 URL 은 재시도 소진 후 건너뛰고 크롤은 계속")
    void exhausted_url_is_skipped() {
        GraphFetcher g = new GraphFetcher()
                .page(HOME, html(a("/product/a") + a("/product/b")))
                .page(HOME + "/product/b", "<html><head>" + PRODUCT_LD + "</head><body></body></html>");
        g.flaky.add(HOME + "/product/a");
        CrawlConfig c = cfg();
        CrawlStats stats = new CrawlStats();

        CrawlResult r = crawler(c, retrying(c, g)).stats(stats).build().crawl();

        assertThat(r.getTerminalState()).isEqualTo(TerminalState.COMPLETED);
        assertThat(r.getUrls()).containsExactly(HOME + "/product/b");
        assertThat(g.calls.stream().filter(u -> u.endsWith("/product/a")).count()).isEqualTo(3);
        assertThat(stats.snapshot().fetchFailures).isEqualTo(1);
    }

    @Test
    @DisplayName("발견 URL 수가 maxUrlsPerDomain 에 닿으면 LIMIT_REACHED, 큐에 남은 URL 은 요청하지 않는다")
    void discovered_limit_reached() {
        GraphFetcher g = new GraphFetcher()
                .page(HOME, html(a("/product/1") + a("/product/2") + a("/product/3") + a("/product/4")));
        for (int i = 1; i <= 4; i++) {
            g.page(HOME + "/product/" + i, "<html><head>" + PRODUCT_LD + "</head><body></body></html>");
        }
        CrawlConfig c = cfg().setMaxUrlsPerDomain(3);

        DomainCrawler dc = crawler(c, retrying(c, g)).build();
        CrawlResult r = dc.crawl();

        assertThat(r.getTerminalState()).isEqualTo(TerminalState.LIMIT_REACHED);
        assertThat(r.getUrls()).isEmpty();
        assertThat(dc.discoveredCount()).isEqualTo(3);
        assertThat(g.calls).containsExactly(HOME);
    }

    @Test
    void limit_hit_on_seed_page_stops_before_next_fetch() {
        StringBuilder body = new StringBuilder();
        for (int i = 1; i <= 20; i++) body.append(a("/c/" + i));
        GraphFetcher g = new GraphFetcher().page(HOME, html(body.toString()));
        for (int i = 1; i <= 20; i++) g.page(HOME + "/c/" + i, html(a("/product/" + i)));
        CrawlConfig c = cfg().setMaxUrlsPerDomain(10);
        CrawlStats stats = new CrawlStats();

        DomainCrawler dc = crawler(c, retrying(c, g)).stats(stats).build();
        CrawlResult r = dc.crawl();

        assertThat(r.getTerminalState()).isEqualTo(TerminalState.LIMIT_REACHED);
        assertThat(g.calls).hasSize(1);
        assertThat(r.getPagesVisited()).isEqualTo(1);
        assertThat(dc.discoveredCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("도메인 예산 초과 → TIMED_OUT, 그때까지의 부분 결과 유지")
    void timed_out_keeps_partial_result() {
        FrozenClock clock = new FrozenClock(1_000);
        GraphFetcher g = new GraphFetcher()
                .page(HOME, html(a("/product/a") + a("/product/b")))
                .page(HOME + "/product/a", "<html><head>" + PRODUCT_LD + "</head><body></body></html>")
                .page(HOME + "/product/b", "<html><head>" + PRODUCT_LD + "</head><body></body></html>");
        // 상품 a 를 받는 동안 한 시간이 흐른다
        g.onFetch = () -> {
            if (g.calls.get(g.calls.size() - 1).endsWith("/product/a")) clock.plusMillis(3_600_000);
        };
        CrawlConfig c = cfg();

        CrawlResult r = crawler(c, retrying(c, g)).clock(clock).build().crawl();

        assertThat(r.getTerminalState()).isEqualTo(TerminalState.TIMED_OUT);
        assertThat(r.getUrls()).containsExactly(HOME + "/product/a");
        assertThat(g.calls).doesNotContain(HOME + "/product/b");
    }

    @Test
    void global_deadline_wins_over_domain_budget() {
        GraphFetcher g = new GraphFetcher().page(HOME, html(a("/product/a")));
        CrawlConfig c = cfg();

        CrawlResult r = crawler(c, retrying(c, g)).globalDeadlineMs(1_000).build().crawl();

        assertThat(r.getTerminalState()).isEqualTo(TerminalState.TIMED_OUT);
        assertThat(r.getUrls()).isEmpty();
        assertThat(g.calls).isEmpty();
    }

    @Test
    @DisplayName("정적 HTML 이 빈약하면 렌더링으로 링크를 보충한다")
    void under_rendered_page_is_resolved_dynamically() {
        GraphFetcher g = new GraphFetcher()
                .page(HOME, html("<div id='app'></div>"))
                .page(HOME + "/product/a", "<html><head>" + PRODUCT_LD + "</head><body></body></html>")
                .page(HOME + "/product/b", "<html><head>" + PRODUCT_LD + "</head><body></body></html>");
        ScriptedRenderHandle handle = new ScriptedRenderHandle(URI.create(HOME),
                ScriptedRenderHandle.linksPage("/product/a"),
                ScriptedRenderHandle.linksPage("/product/a", "/product/b"),
                ScriptedRenderHandle.linksPage("/product/a", "/product/b"));
        RenderingFetcher dyn = new RenderingFetcher(handle);
        CrawlConfig c = cfg();
        c.dynamic().setEnabled(true);
        FrozenClock clock = new FrozenClock(1_000);
        DynamicContentResolver resolver = new DynamicContentResolver(10, Duration.ofSeconds(30), Duration.ZERO,
                new ContentSignalExtractor(), clock);
        CrawlStats stats = new CrawlStats();

        CrawlResult r = crawler(c, retrying(c, g, dyn)).clock(clock).resolver(resolver).stats(stats)
                .build().crawl();

        assertThat(r.getUrls()).containsExactly(HOME + "/product/a", HOME + "/product/b");
        // 상품 페이지는 정적 단계에서 확정되므로 렌더링은 홈 한 번뿐
        assertThat(dyn.calls).isEqualTo(1);
        assertThat(stats.snapshot().dynamicRuns).isEqualTo(1);
        assertThat(handle.closeCount).isEqualTo(1);
    }

    @Test
    @DisplayName("정적 fetch 중 마감이 지나면 렌더링 재취득을 시작하지 않는다")
    void deadline_passed_during_static_fetch_skips_rendering() {
        FrozenClock clock = new FrozenClock(1_000);
        GraphFetcher g = new GraphFetcher().page(HOME, html("<div id='app'></div>"));
        g.onFetch = () -> clock.plusMillis(3_600_000);
        ScriptedRenderHandle handle = new ScriptedRenderHandle(URI.create(HOME),
                ScriptedRenderHandle.linksPage("/product/a"));
        RenderingFetcher dyn = new RenderingFetcher(handle);
        CrawlConfig c = cfg();
        c.dynamic().setEnabled(true);
        DynamicContentResolver resolver = new DynamicContentResolver(10, Duration.ofSeconds(30), Duration.ZERO,
                new ContentSignalExtractor(), clock);

        CrawlResult r = crawler(c, retrying(c, g, dyn)).clock(clock).resolver(resolver).build().crawl();

        assertThat(r.getTerminalState()).isEqualTo(TerminalState.TIMED_OUT);
        assertThat(dyn.calls).isZero();
        assertThat(handle.scrolls).isZero();
    }

    @Test
    void dynamic_disabled_never_renders() {
        GraphFetcher g = new GraphFetcher().page(HOME, html("<div id='app'></div>"));
        RenderingFetcher dyn = new RenderingFetcher(new ScriptedRenderHandle(URI.create(HOME),
                ScriptedRenderHandle.linksPage("/product/a")));
        CrawlConfig c = cfg();   // dynamic.enabled=false
        DynamicContentResolver resolver = new DynamicContentResolver(c, new ContentSignalExtractor(),
                new FrozenClock(0));

        CrawlResult r = crawler(c, retrying(c, g, dyn)).resolver(resolver).build().crawl();

        assertThat(r.getUrls()).isEmpty();
        assertThat(dyn.calls).isZero();
    }

    @Test
    void crawl_runs_only_once() {
        GraphFetcher g = new GraphFetcher().page(HOME, html(""));
        CrawlConfig c = cfg();
        DomainCrawler dc = crawler(c, retrying(c, g)).build();

        dc.crawl();
        assertThatThrownBy(dc::crawl).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unparseable_seed_is_rejected() {
        CrawlConfig c = cfg();
        GraphFetcher g = new GraphFetcher();
        assertThatThrownBy(() -> DomainCrawler.builder("mailto:x", c).fetcher(retrying(c, g)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
