package com.shopcrawl.core.crawler;

import com.shopcrawl.core.api.ICrawler;
import com.shopcrawl.core.api.RenderHandle;
import com.shopcrawl.core.classify.ProductClassifier;
import com.shopcrawl.core.http.FetchException;
import com.shopcrawl.core.http.RetryingFetcher;
import com.shopcrawl.core.model.ClassificationResult;
import com.shopcrawl.core.model.ContentSignals;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.CrawlResult;
import com.shopcrawl.core.model.CrawlStats;
import com.shopcrawl.core.model.FetchMode;
import com.shopcrawl.core.model.FetchedPage;
import com.shopcrawl.core.model.FrontierEntry;
import com.shopcrawl.core.model.TerminalState;
import com.shopcrawl.core.render.DynamicContentResolver;
import com.shopcrawl.core.render.ResolutionResult;
import com.shopcrawl.core.util.CrawlClock;
import com.shopcrawl.core.util.RateLimiter;
import com.shopcrawl.core.util.StructuredLog;
import com.shopcrawl.core.util.UrlExclusion;
import com.shopcrawl.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 도메인 하나를 BFS 로 훑어 상품 URL 을 모은다.
 * 상태: IDLE → RUNNING → 종료(COMPLETED | TIMED_OUT | LIMIT_REACHED | FAILED), crawl() 은 한 번만.
 * Frontier/방문 집합/결과는 이 인스턴스만 만진다. 페이지 처리는 순차(호스트당 동시 연결 1).
 * 종료 조건은 페이지 사이에서만 검사한다. 진행 중인 fetch(재시도 포함)는 끝까지 간다.
 * 단, 마감이 지났으면 렌더링 재취득은 시작하지 않는다.
 */
public final class DomainCrawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(DomainCrawler.class);

    private enum Phase { IDLE, RUNNING, DONE }

    private final String domain;
    private final URI seed;
    private final CrawlConfig config;
    private final RetryingFetcher fetcher;
    private final ContentSignalExtractor extractor;
    private final ProductClassifier classifier;
    private final DynamicContentResolver resolver;       // null 이면 동적 해석 안 함
    private final UnderRenderedHeuristic heuristic;
    private final CrawlClock clock;
    private final long globalDeadlineMs;
    private final CrawlStats stats;
    private final RateLimiter limiter;
    private final StructuredLog slog;

    private final Frontier frontier;
    private final LinkedHashSet<String> products = new LinkedHashSet<>();
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.IDLE);
    private int pagesVisited;
    private long deadlineMs = Long.MAX_VALUE;

    private DomainCrawler(Builder b) {
        this.domain = b.domain;
        this.config = b.config;
        this.seed = UrlUtils.seedOf(b.domain);
        if (seed == null) throw new IllegalArgumentException("unparseable seed domain: " + b.domain);
        this.fetcher = Objects.requireNonNull(b.fetcher, "fetcher");
        this.extractor = (b.extractor != null) ? b.extractor : new ContentSignalExtractor();
        this.classifier = (b.classifier != null) ? b.classifier : new ProductClassifier();
        this.resolver = (config.dynamic().isEnabled() && fetcher.supports(FetchMode.DYNAMIC)) ? b.resolver : null;
        this.heuristic = UnderRenderedHeuristic.from(config);
        this.clock = (b.clock != null) ? b.clock : CrawlClock.SYSTEM;
        this.globalDeadlineMs = b.globalDeadlineMs;
        this.stats = (b.stats != null) ? b.stats : new CrawlStats();
        this.limiter = (b.limiter != null) ? b.limiter : RateLimiter.perSecond(config.getRequestsPerSecond());
        this.slog = StructuredLog.get(DomainCrawler.class).with("domain", domain);
        this.frontier = new Frontier(config.getMaxDepth(), config.getMaxUrlsPerDomain());
    }

    @Override public String domain() { return domain; }

    @Override
    public CrawlResult crawl() {
        if (!phase.compareAndSet(Phase.IDLE, Phase.RUNNING)) {
            throw new IllegalStateException("crawl() already started for " + domain);
        }
        final long startMs = clock.nowMillis();
        final long ownDeadline = startMs + config.getTimeout().toMillis();
        final long deadline = Math.min(ownDeadline, globalDeadlineMs);
        this.deadlineMs = deadline;

        LOG.info("Crawl start: domain={}, seed={}, maxDepth={}, maxUrls={}",
                domain, seed, config.getMaxDepth(), config.getMaxUrlsPerDomain());
        slog.info("domain-start", "seed", seed.toString(), "maxDepth", config.getMaxDepth(),
                "dynamic", resolver != null);

        TerminalState terminal;
        try {
            terminal = runLoop(deadline);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            terminal = TerminalState.TIMED_OUT;
        } catch (RuntimeException e) {
            LOG.error("Crawl of {} aborted: {}", domain, e.toString(), e);
            slog.error("domain-failed", e, "pages", pagesVisited, "count", products.size());
            terminal = TerminalState.FAILED;
        } finally {
            phase.set(Phase.DONE);
        }

        long endMs = clock.nowMillis();
        CrawlResult result = new CrawlResult(domain, new ArrayList<>(products),
                Instant.ofEpochMilli(endMs), terminal, pagesVisited);
        LOG.info("Crawl done: domain={}, state={}, products={}, pages={}",
                domain, terminal, result.getCount(), pagesVisited);
        slog.info("domain-done", "state", terminal.name(), "count", result.getCount(),
                "pages", pagesVisited, "discovered", frontier.discoveredCount(),
                "elapsedMs", endMs - startMs);
        return result;
    }

    private TerminalState runLoop(long deadline) throws InterruptedException {
        frontier.enqueue(seed, 0);
        while (true) {
            if (products.size() >= config.getMaxUrlsPerDomain()) return TerminalState.LIMIT_REACHED;
            if (clock.nowMillis() >= deadline) return TerminalState.TIMED_OUT;
            if (Thread.currentThread().isInterrupted()) throw new InterruptedException("crawl interrupted");

            Optional<FrontierEntry> next = frontier.dequeue();
            if (next.isEmpty()) {
                return frontier.isSaturated() ? TerminalState.LIMIT_REACHED : TerminalState.COMPLETED;
            }
            visit(next.get());
            // 발견 상한 도달: 큐에 남은 항목도 더 요청하지 않는다
            if (frontier.isSaturated()) return TerminalState.LIMIT_REACHED;
        }
    }

    private void visit(FrontierEntry entry) throws InterruptedException {
        final URI url = entry.url();
        ContentSignals signals;

        limiter.acquire();
        try (FetchedPage page = fetcher.fetch(url, FetchMode.STATIC)) {
            pagesVisited++;
            stats.pageFetched();
            signals = extractor.extract(page.content());
        } catch (FetchException e) {
            // 소진/영구 실패: 이 URL 만 건너뛴다
            stats.fetchFailed();
            LOG.debug("Skip {}: {}", url, e.getMessage());
            return;
        }

        ClassificationResult cr = classifier.classify(url, signals);
        if (cr.isProduct()) {
            addProduct(url, cr);
        } else if (resolver != null && heuristic.isUnderRendered(signals)) {
            if (clock.nowMillis() >= deadlineMs) {
                // 마감 이후엔 렌더링을 시작하지 않는다
                LOG.debug("Deadline passed, skipping dynamic resolution of {}", url);
                return;
            }
            signals = resolveDynamic(url, signals);
            cr = classifier.classify(url, signals);
            if (cr.isProduct()) addProduct(url, cr);
        }

        enqueueLinks(signals.getLinks(), entry.depth() + 1);
    }

    /** 렌더링 재취득. 실패하면 정적 신호를 그대로 쓴다. */
    private ContentSignals resolveDynamic(URI url, ContentSignals staticSignals) throws InterruptedException {
        limiter.acquire();
        try (FetchedPage page = fetcher.fetch(url, FetchMode.DYNAMIC)) {
            ContentSignals initial = extractor.extract(page.content());
            Optional<RenderHandle> handle = page.renderHandle();
            if (handle.isEmpty()) return staticSignals.merge(initial);

            ResolutionResult rr = resolver.resolve(handle.get(), initial);
            stats.dynamicResolved();
            slog.debug("dynamic-resolved", "url", url.toString(), "outcome", rr.getOutcome().name(),
                    "iterations", rr.getIterations(), "links", rr.getSignals().getLinks().size());
            return staticSignals.merge(rr.getSignals());
        } catch (FetchException e) {
            LOG.debug("Dynamic fetch of {} failed, keeping static signals: {}", url, e.getMessage());
            return staticSignals;
        }
    }

    private void addProduct(URI url, ClassificationResult cr) {
        if (!products.add(url.toString())) return;
        stats.productFound();
        LOG.debug("Product: {} ({})", url, cr.getConfidence());
        slog.info("product-found", "url", url.toString(), "confidence", cr.getConfidence(),
                "signals", String.join(",", cr.getMatchedSignals()));
    }

    private void enqueueLinks(List<URI> links, int depth) {
        if (depth > config.getMaxDepth()) return;
        List<String> excludes = config.crawler().getExcludePaths();
        Map<String, List<String>> perDomain = config.crawler().getDomainExcludes();
        for (URI link : links) {
            URI n = UrlUtils.normalize(link);
            if (n == null) continue;
            if (!UrlUtils.sameRegistrableDomain(seed, n)) continue;
            if (UrlExclusion.isExcluded(n, excludes, perDomain)) continue;
            frontier.enqueue(n, depth);
        }
    }

    /** 테스트/진단용 */
    int discoveredCount() { return frontier.discoveredCount(); }

    // ----- 빌더 -----
    public static Builder builder(String domain, CrawlConfig config) { return new Builder(domain, config); }

    public static final class Builder {
        private final String domain;
        private final CrawlConfig config;
        private RetryingFetcher fetcher;
        private ContentSignalExtractor extractor;
        private ProductClassifier classifier;
        private DynamicContentResolver resolver;
        private CrawlClock clock;
        private long globalDeadlineMs = Long.MAX_VALUE;
        private CrawlStats stats;
        private RateLimiter limiter;

        private Builder(String domain, CrawlConfig config) {
            this.domain = Objects.requireNonNull(domain, "domain");
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder fetcher(RetryingFetcher v) { this.fetcher = v; return this; }
        public Builder extractor(ContentSignalExtractor v) { this.extractor = v; return this; }
        public Builder classifier(ProductClassifier v) { this.classifier = v; return this; }
        public Builder resolver(DynamicContentResolver v) { this.resolver = v; return this; }
        public Builder clock(CrawlClock v) { this.clock = v; return this; }
        /** 전역 마감 시각(epoch ms). 도메인 자체 예산과 둘 중 이른 쪽이 적용된다 */
        public Builder globalDeadlineMs(long v) { this.globalDeadlineMs = v; return this; }
        public Builder stats(CrawlStats v) { this.stats = v; return this; }
        public Builder limiter(RateLimiter v) { this.limiter = v; return this; }

        public DomainCrawler build() { return new DomainCrawler(this); }
    }
}
