package com.shopcrawl.core.model;

import com.shopcrawl.core.util.UrlExclusion;
import com.shopcrawl.core.util.UrlUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * 검증 실패(validate)만이 크롤 시작 전 치명 오류다.
 */
public final class CrawlConfig {

    /** 재시도 간격 증가 방식 */
    public enum Backoff { FIXED, LINEAR, EXPONENTIAL }

    /** 동적 렌더링 관련 하위 설정: YAML의 `dynamic:` 섹션 */
    public static final class DynamicCfg {
        private boolean enabled = true;
        /** 도메인 간 공유하는 브라우저 인스턴스 상한 */
        private int poolSize = 2;
        private boolean headless = true;
        /** 링크 수가 이보다 적으면 JS 렌더링 의심 */
        private int minLinks = 5;
        /** KB 당 기대 링크 수. links < pageKb * linksPerKb 이면 렌더링 의심 */
        private double linksPerKb = 0.1;

        public boolean isEnabled() { return enabled; }
        public DynamicCfg setEnabled(boolean v) { this.enabled = v; return this; }

        public int getPoolSize() { return poolSize; }
        public DynamicCfg setPoolSize(int v) { this.poolSize = v; return this; }

        public boolean isHeadless() { return headless; }
        public DynamicCfg setHeadless(boolean v) { this.headless = v; return this; }

        public int getMinLinks() { return minLinks; }
        public DynamicCfg setMinLinks(int v) { this.minLinks = v; return this; }

        public double getLinksPerKb() { return linksPerKb; }
        public DynamicCfg setLinksPerKb(double v) { this.linksPerKb = v; return this; }
    }

    /** 링크 필터 하위 설정: YAML의 `crawler:` 섹션 */
    public static final class CrawlerCfg {
        private List<String> excludePaths = UrlExclusion.DEFAULT_EXCLUDES;
        /** 등록 도메인 → 추가 제외 패턴 (예: amazon.in → ["/gp/", "re:/s\\?"]) */
        private Map<String, List<String>> domainExcludes = Map.of();

        public List<String> getExcludePaths() { return excludePaths; }
        public CrawlerCfg setExcludePaths(List<String> v) {
            this.excludePaths = (v == null ? List.of() : List.copyOf(v));
            return this;
        }
        /** 기본 제외 목록 뒤에 덧붙인다 */
        public CrawlerCfg addExcludePaths(List<String> v) {
            if (v == null || v.isEmpty()) return this;
            List<String> merged = new ArrayList<>(excludePaths);
            for (String s : v) if (!merged.contains(s)) merged.add(s);
            this.excludePaths = List.copyOf(merged);
            return this;
        }

        public Map<String, List<String>> getDomainExcludes() { return domainExcludes; }
        public CrawlerCfg setDomainExcludes(Map<String, List<String>> v) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            if (v != null) v.forEach((k, list) -> copy.put(k.toLowerCase(Locale.ROOT), List.copyOf(list)));
            this.domainExcludes = Map.copyOf(copy);
            return this;
        }
    }

    // ---------- 기본 필드 ----------
    private List<String> domains = List.of();
    private int maxRetries = 3;
    private Duration retryDelay = Duration.ofSeconds(5);
    private Backoff retryBackoff = Backoff.LINEAR;
    private Duration scrollTimeout = Duration.ofSeconds(30);
    private int maxScrollAttempts = 10;
    private Duration dynamicWait = Duration.ofSeconds(5);
    private int maxDepth = 10;
    private int maxUrlsPerDomain = 10_000;
    private Duration timeout = Duration.ofSeconds(3600);         // 도메인별 벽시계 예산
    private Duration globalTimeout = Duration.ZERO;              // 0 이면 전역 예산 없음

    private Duration requestTimeout = Duration.ofSeconds(30);
    private double requestsPerSecond = 2.0;
    private int concurrency = 4;                                 // 동시 도메인 수
    private String userAgent =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) shopcrawl/0.3";
    private double classifierThreshold = 0.5;
    private Path outputFile = Path.of("product_urls.json");

    private final DynamicCfg dynamic = new DynamicCfg();
    private final CrawlerCfg crawler = new CrawlerCfg();

    // ---------- getters ----------
    public List<String> getDomains() { return domains; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryDelay() { return retryDelay; }
    public Backoff getRetryBackoff() { return retryBackoff; }
    public Duration getScrollTimeout() { return scrollTimeout; }
    public int getMaxScrollAttempts() { return maxScrollAttempts; }
    public Duration getDynamicWait() { return dynamicWait; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxUrlsPerDomain() { return maxUrlsPerDomain; }
    public Duration getTimeout() { return timeout; }
    public Duration getGlobalTimeout() { return globalTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public double getRequestsPerSecond() { return requestsPerSecond; }
    public int getConcurrency() { return concurrency; }
    public String getUserAgent() { return userAgent; }
    public double getClassifierThreshold() { return classifierThreshold; }
    public Path getOutputFile() { return outputFile; }
    public DynamicCfg dynamic() { return dynamic; }
    public CrawlerCfg crawler() { return crawler; }

    // ---------- fluent setters ----------
    public CrawlConfig setDomains(List<String> domains) {
        this.domains = (domains == null ? List.of() : List.copyOf(domains));
        return this;
    }
    public CrawlConfig setMaxRetries(int v) { this.maxRetries = v; return this; }
    public CrawlConfig setRetryDelay(Duration v) { this.retryDelay = v; return this; }
    public CrawlConfig setRetryBackoff(Backoff v) { this.retryBackoff = (v != null ? v : Backoff.LINEAR); return this; }
    public CrawlConfig setScrollTimeout(Duration v) { this.scrollTimeout = v; return this; }
    public CrawlConfig setMaxScrollAttempts(int v) { this.maxScrollAttempts = v; return this; }
    public CrawlConfig setDynamicWait(Duration v) { this.dynamicWait = v; return this; }
    public CrawlConfig setMaxDepth(int v) { this.maxDepth = v; return this; }
    public CrawlConfig setMaxUrlsPerDomain(int v) { this.maxUrlsPerDomain = v; return this; }
    public CrawlConfig setTimeout(Duration v) { this.timeout = v; return this; }
    public CrawlConfig setGlobalTimeout(Duration v) { this.globalTimeout = (v != null ? v : Duration.ZERO); return this; }
    public CrawlConfig setRequestTimeout(Duration v) { this.requestTimeout = v; return this; }
    public CrawlConfig setRequestsPerSecond(double v) { this.requestsPerSecond = v; return this; }
    public CrawlConfig setConcurrency(int v) { this.concurrency = Math.max(1, v); return this; }
    public CrawlConfig setUserAgent(String v) { if (v != null && !v.isBlank()) this.userAgent = v; return this; }
    public CrawlConfig setClassifierThreshold(double v) { this.classifierThreshold = v; return this; }
    public CrawlConfig setOutputFile(Path v) { this.outputFile = v; return this; }

    /** 초 단위(소수 허용) 편의 세터: YAML/CLI 에서 사용 */
    public CrawlConfig setRetryDelaySeconds(double s) { return setRetryDelay(seconds(s)); }
    public CrawlConfig setScrollTimeoutSeconds(double s) { return setScrollTimeout(seconds(s)); }
    public CrawlConfig setDynamicWaitSeconds(double s) { return setDynamicWait(seconds(s)); }
    public CrawlConfig setTimeoutSeconds(double s) { return setTimeout(seconds(s)); }
    public CrawlConfig setGlobalTimeoutSeconds(double s) { return setGlobalTimeout(seconds(s)); }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(domains, "domains");
        if (domains.isEmpty()) throw new IllegalArgumentException("domains must not be empty");
        for (String d : domains) {
            if (UrlUtils.seedOf(d) == null)
                throw new IllegalArgumentException("unparseable seed domain: " + d);
        }
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        requireNonNegative(retryDelay, "retryDelay");
        requirePositive(scrollTimeout, "scrollTimeout");
        if (maxScrollAttempts < 1) throw new IllegalArgumentException("maxScrollAttempts must be >= 1");
        requireNonNegative(dynamicWait, "dynamicWait");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxUrlsPerDomain < 1) throw new IllegalArgumentException("maxUrlsPerDomain must be >= 1");
        requirePositive(timeout, "timeout");
        requireNonNegative(globalTimeout, "globalTimeout");
        requirePositive(requestTimeout, "requestTimeout");
        if (requestsPerSecond < 0) throw new IllegalArgumentException("requestsPerSecond must be >= 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (classifierThreshold <= 0 || classifierThreshold > 1)
            throw new IllegalArgumentException("classifierThreshold must be in (0, 1]");
        Objects.requireNonNull(outputFile, "outputFile");

        if (dynamic.getPoolSize() < 1) throw new IllegalArgumentException("dynamic.poolSize must be >= 1");
        if (dynamic.getMinLinks() < 0) throw new IllegalArgumentException("dynamic.minLinks must be >= 0");
        if (dynamic.getLinksPerKb() < 0) throw new IllegalArgumentException("dynamic.linksPerKb must be >= 0");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    private static void requireNonNegative(Duration d, String name) {
        if (d == null || d.isNegative())
            throw new IllegalArgumentException(name + " must be >= 0");
    }

    private static Duration seconds(double s) {
        return Duration.ofMillis(Math.round(s * 1000.0));
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }
}
