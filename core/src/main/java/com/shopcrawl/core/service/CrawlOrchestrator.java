package com.shopcrawl.core.service;

import com.shopcrawl.core.api.ICrawler;
import com.shopcrawl.core.classify.ClassifierWeights;
import com.shopcrawl.core.classify.ProductClassifier;
import com.shopcrawl.core.crawler.ContentSignalExtractor;
import com.shopcrawl.core.crawler.DomainCrawler;
import com.shopcrawl.core.http.RetryingFetcher;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.CrawlResult;
import com.shopcrawl.core.model.CrawlStats;
import com.shopcrawl.core.render.DynamicContentResolver;
import com.shopcrawl.core.service.export.JsonResultExporter;
import com.shopcrawl.core.util.CrawlClock;
import com.shopcrawl.core.util.ProgressListener;
import com.shopcrawl.core.util.StructuredLog;
import com.shopcrawl.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 도메인별 DomainCrawler 를 병렬로 돌리고 결과를 모은다.
 * - 도메인 하나의 실패/시간초과는 다른 도메인에 영향 없음(실패는 FAILED 결과로 대체)
 * - 도메인이 끝날 때마다 결과 파일을 통째로 다시 쓴다(입력 순서 유지)
 * - 전역 예산(globalTimeout)이 있으면 각 크롤러의 마감과 겹쳐 적용
 */
public final class CrawlOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlOrchestrator.class);

    /** 도메인 하나에 대한 크롤러 생성기(테스트에서 가짜 크롤러 주입용) */
    @FunctionalInterface
    public interface CrawlerFactory {
        ICrawler create(String domain, CrawlConfig config, long globalDeadlineMs, CrawlStats stats);
    }

    private final CrawlerFactory factory;
    private final JsonResultExporter exporter;   // null 이면 파일 기록 안 함
    private final ProgressListener progress;
    private final CrawlClock clock;
    private final CrawlStats stats = new CrawlStats();

    public CrawlOrchestrator(CrawlerFactory factory, JsonResultExporter exporter) {
        this(factory, exporter, ProgressListener.NONE, CrawlClock.SYSTEM);
    }

    public CrawlOrchestrator(CrawlerFactory factory, JsonResultExporter exporter,
                             ProgressListener progress, CrawlClock clock) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.exporter = exporter;
        this.progress = (progress != null) ? progress : ProgressListener.NONE;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 실제 DomainCrawler 를 만드는 기본 팩토리. resolver 는 null 가능(동적 해석 끔). */
    public static CrawlerFactory domainCrawlers(RetryingFetcher fetcher, DynamicContentResolver resolver) {
        Objects.requireNonNull(fetcher, "fetcher");
        ContentSignalExtractor extractor = new ContentSignalExtractor();
        return (domain, cfg, deadline, stats) -> DomainCrawler.builder(domain, cfg)
                .fetcher(fetcher)
                .extractor(extractor)
                .classifier(new ProductClassifier(
                        ClassifierWeights.defaults().withThreshold(cfg.getClassifierThreshold())))
                .resolver(resolver)
                .globalDeadlineMs(deadline)
                .stats(stats)
                .build();
    }

    /**
     * 모든 도메인이 종료 상태에 도달할 때까지 블록.
     * @return domain → 결과 (입력 순서, 중복 도메인은 한 번만)
     * @throws IllegalArgumentException 도메인 목록이 비었거나 시드를 만들 수 없을 때(크롤 시작 전)
     */
    public Map<String, CrawlResult> runAll(List<String> domains, CrawlConfig config) {
        Objects.requireNonNull(config, "config");
        List<String> order = distinct(domains);
        if (order.isEmpty()) throw new IllegalArgumentException("domains must not be empty");
        for (String d : order) {
            if (UrlUtils.seedOf(d) == null) throw new IllegalArgumentException("unparseable seed domain: " + d);
        }

        final int total = order.size();
        final int cc = Math.max(1, Math.min(config.getConcurrency(), total));
        final long globalDeadline = config.getGlobalTimeout().isZero()
                ? Long.MAX_VALUE
                : clock.nowMillis() + config.getGlobalTimeout().toMillis();

        LOG.info("Crawl start: domains={}, concurrency={}, maxDepth={}, maxUrlsPerDomain={}",
                total, cc, config.getMaxDepth(), config.getMaxUrlsPerDomain());
        SLOG.info("crawl-start", "domains", total, "concurrency", cc,
                "globalTimeoutMs", config.getGlobalTimeout().toMillis());
        progress.onProgress(0.0, "crawl", 0, total);

        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("crawl-domain"));
        CompletionService<CrawlResult> ecs = new ExecutorCompletionService<>(exec);
        Map<Future<CrawlResult>, String> domainOf = new HashMap<>();
        Map<String, CrawlResult> done = new HashMap<>();

        try {
            for (String d : order) {
                domainOf.put(ecs.submit(() -> factory.create(d, config, globalDeadline, stats).crawl()), d);
            }
            for (int i = 0; i < total; i++) {
                Future<CrawlResult> f = ecs.take();
                String d = domainOf.get(f);
                done.put(d, collect(d, f));
                snapshot(order, done, config.getOutputFile());
                progress.onProgress((double) done.size() / total, d, done.size(), total);
            }
        } catch (InterruptedException ie) {
            LOG.warn("Crawl interrupted; stopping {} running domain(s)", total - done.size());
            exec.shutdownNow();
            awaitQuietly(exec);
            for (Map.Entry<Future<CrawlResult>, String> e : domainOf.entrySet()) {
                if (!done.containsKey(e.getValue()) && e.getKey().isDone()) {
                    done.put(e.getValue(), collect(e.getValue(), e.getKey()));
                }
            }
            Thread.currentThread().interrupt();
        } finally {
            exec.shutdownNow();
        }

        Map<String, CrawlResult> out = ordered(order, done);
        if (exporter != null) {
            try {
                Path p = exporter.write(config.getOutputFile(), out);
                LOG.info("Results saved to {}", p);
            } catch (IOException e) {
                throw new UncheckedIOException("cannot write " + config.getOutputFile(), e);
            }
        }
        progress.onProgress(1.0, "export", out.size(), total);

        int urls = out.values().stream().mapToInt(CrawlResult::getCount).sum();
        CrawlStats.Snapshot s = stats.snapshot();
        LOG.info("Crawl done. domains={}, products={}, pages={}, retries={}, failures={}",
                out.size(), urls, s.pagesFetched, s.retriesTotal, s.fetchFailures);
        SLOG.info("crawl-done", "domains", out.size(), "products", urls, "pages", s.pagesFetched,
                "attempts", s.attemptsTotal, "retries", s.retriesTotal,
                "failures", s.fetchFailures, "dynamic", s.dynamicRuns);
        return out;
    }

    public CrawlStats.Snapshot getStats() { return stats.snapshot(); }

    private CrawlResult collect(String domain, Future<CrawlResult> f) {
        try {
            return f.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return CrawlResult.failed(domain, Instant.ofEpochMilli(clock.nowMillis()));
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            LOG.warn("Domain {} failed: {}", domain, cause.toString());
            SLOG.error("domain-failed", cause, "domain", domain);
            return CrawlResult.failed(domain, Instant.ofEpochMilli(clock.nowMillis()));
        }
    }

    /** 중간 스냅샷 기록 실패는 경고만. 최종 기록에서 다시 시도한다 */
    private void snapshot(List<String> order, Map<String, CrawlResult> done, Path file) {
        if (exporter == null) return;
        try {
            exporter.write(file, ordered(order, done));
        } catch (IOException e) {
            LOG.warn("Intermediate result write failed: {}", e.toString());
        }
    }

    private static Map<String, CrawlResult> ordered(List<String> order, Map<String, CrawlResult> done) {
        Map<String, CrawlResult> m = new LinkedHashMap<>();
        for (String d : order) {
            CrawlResult r = done.get(d);
            if (r != null) m.put(d, r);
        }
        return m;
    }

    private static List<String> distinct(List<String> domains) {
        if (domains == null) return List.of();
        LinkedHashSet<String> s = new LinkedHashSet<>();
        for (String d : domains) if (d != null && !d.isBlank()) s.add(d.trim());
        return new ArrayList<>(s);
    }

    private static void awaitQuietly(ExecutorService exec) {
        try {
            if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Some domain crawlers did not stop within 30s");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
