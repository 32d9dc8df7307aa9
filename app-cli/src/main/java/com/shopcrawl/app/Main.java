package com.shopcrawl.app;

import com.shopcrawl.app.logging.LogSetup;
import com.shopcrawl.core.api.PageFetcher;
import com.shopcrawl.core.crawler.ContentSignalExtractor;
import com.shopcrawl.core.http.DefaultRetryPolicy;
import com.shopcrawl.core.http.HttpPageFetcher;
import com.shopcrawl.core.http.RetryingFetcher;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.CrawlResult;
import com.shopcrawl.core.model.CrawlStats;
import com.shopcrawl.core.render.DynamicContentResolver;
import com.shopcrawl.core.render.PlaywrightPageFetcher;
import com.shopcrawl.core.service.CrawlOrchestrator;
import com.shopcrawl.core.service.export.JsonResultExporter;
import com.shopcrawl.core.util.CrawlClock;
import com.shopcrawl.core.util.DefaultSleeper;
import com.shopcrawl.core.util.ProgressListener;
import com.shopcrawl.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI 진입점.
 * 사용법: java -jar shopcrawl-app-cli.jar [crawl.yml] [domain ...]
 * - 첫 인자가 .yml/.yaml 이면 설정 파일, 나머지는 도메인(설정의 domains 를 대체)
 * - 설정 파일을 안 주면 ./crawl.yml 이 있을 때만 읽는다
 * System props: -Dsc.out.dir=out (로그 위치), -Dsc.log.level=INFO
 * 종료 코드: 0 정상, 2 설정 오류, 1 그 밖의 실패
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;

    private Main() {}

    public static void main(String[] args) {
        LogSetup.configure(Path.of(System.getProperty("sc.out.dir", "out")));
        System.exit(run(args));
    }

    static int run(String[] args) {
        CrawlConfig cfg;
        try {
            cfg = resolveConfig(args);
            cfg.validate();
        } catch (IllegalArgumentException | NullPointerException | IOException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            System.err.println("shopcrawl: configuration error: " + e.getMessage());
            System.err.println("usage: shopcrawl [crawl.yml] [domain ...]");
            return EXIT_CONFIG;
        }

        List<PageFetcher> fetchers = new ArrayList<>();
        fetchers.add(new HttpPageFetcher(cfg));
        if (cfg.dynamic().isEnabled()) fetchers.add(new PlaywrightPageFetcher(cfg));

        try {
            CrawlStats fetchStats = new CrawlStats();
            RetryingFetcher fetcher = new RetryingFetcher(fetchers, DefaultRetryPolicy.from(cfg),
                    new DefaultSleeper(), fetchStats);
            DynamicContentResolver resolver = cfg.dynamic().isEnabled()
                    ? new DynamicContentResolver(cfg, new ContentSignalExtractor(), CrawlClock.SYSTEM)
                    : null;

            ProgressListener progress = (p, phase, done, total) -> {
                if (done >= 0 && total > 0 && !"crawl".equals(phase) && !"export".equals(phase)) {
                    LOG.info("[{}/{}] {} finished", done, total, phase);
                }
            };
            CrawlOrchestrator orchestrator = new CrawlOrchestrator(
                    CrawlOrchestrator.domainCrawlers(fetcher, resolver),
                    new JsonResultExporter(), progress, CrawlClock.SYSTEM);

            Map<String, CrawlResult> results = orchestrator.runAll(cfg.getDomains(), cfg);
            CrawlStats.Snapshot s = fetchStats.snapshot();
            results.values().forEach(r -> System.out.printf("%-30s %-14s %6d urls  %6d pages%n",
                    r.getDomain(), r.getTerminalState(), r.getCount(), r.getPagesVisited()));
            System.out.printf("fetch attempts=%d retries=%d -> %s%n",
                    s.attemptsTotal, s.retriesTotal, cfg.getOutputFile().toAbsolutePath());
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOG.error("Crawl failed: {}", e.toString(), e);
            return EXIT_FAILURE;
        } finally {
            for (PageFetcher f : fetchers) closeQuietly(f);
        }
    }

    /** [yml] [domain ...] 해석. 위치 인자 도메인이 있으면 설정의 domains 를 대체 */
    static CrawlConfig resolveConfig(String[] args) throws IOException {
        List<String> rest = new ArrayList<>(List.of(args == null ? new String[0] : args));
        CrawlConfig cfg;
        if (!rest.isEmpty() && isYaml(rest.get(0))) {
            cfg = YamlConfigLoader.load(Path.of(rest.remove(0)));
        } else if (Files.exists(YamlConfigLoader.DEFAULT_PATH)) {
            cfg = YamlConfigLoader.load(YamlConfigLoader.DEFAULT_PATH);
        } else {
            cfg = CrawlConfig.defaults();
        }
        if (!rest.isEmpty()) cfg.setDomains(rest);
        return cfg;
    }

    private static boolean isYaml(String arg) {
        String a = arg.toLowerCase(java.util.Locale.ROOT);
        return a.endsWith(".yml") || a.endsWith(".yaml");
    }

    private static void closeQuietly(PageFetcher f) {
        try {
            f.close();
        } catch (Exception e) {
            LOG.warn("Fetcher close failed ({}): {}", f.mode(), e.toString());
        }
    }
}
