package com.shopcrawl.core.util;

import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.CrawlConfig.Backoff;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 로 변환. 검증(validate)은 호출자 몫이다
 * (CLI 가 위치 인자로 도메인을 덮어쓴 뒤 검증).
 *
 * 예상 YAML 키:
 * domains: ["shop.example", "https://store.example"]
 * maxRetries: 3
 * retryDelaySeconds: 5
 * retryBackoff: LINEAR | FIXED | EXPONENTIAL
 * scrollTimeoutSeconds: 30
 * maxScrollAttempts: 10
 * dynamicWaitSeconds: 5
 * maxDepth: 10
 * maxUrlsPerDomain: 10000
 * timeoutSeconds: 3600
 * globalTimeoutSeconds: 0
 * requestTimeoutMs: 30000
 * requestsPerSecond: 2
 * concurrency: 4
 * userAgent: "..."
 *
 * dynamic:
 *   enabled: true
 *   poolSize: 2
 *   headless: true
 *   minLinks: 5
 *   linksPerKb: 0.1
 *
 * crawler:
 *   excludeDefaults: true          # false 면 기본 제외 목록을 버린다
 *   excludePaths: ["/gift-card", "re:/s\\?k="]
 *   domainExcludes:
 *     amazon.in: ["/gp/", "/prime"]
 *
 * classifier:
 *   threshold: 0.5
 *
 * output:
 *   file: "product_urls.json"
 */
public final class YamlConfigLoader {

    public static final Path DEFAULT_PATH = Path.of("crawl.yml");

    private YamlConfigLoader() {}

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** @throws IllegalArgumentException YAML 문법 오류 또는 값 형식이 틀린 경우(숫자 자리에 문자 등) */
    public static CrawlConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("malformed YAML: " + e.getMessage(), e);
        }

        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setStringList(map, "domains", cfg::setDomains);
        setInt(map, "maxRetries", cfg::setMaxRetries);
        setDouble(map, "retryDelaySeconds", cfg::setRetryDelaySeconds);
        setEnum(map, "retryBackoff", Backoff.class, cfg::setRetryBackoff);
        setDouble(map, "scrollTimeoutSeconds", cfg::setScrollTimeoutSeconds);
        setInt(map, "maxScrollAttempts", cfg::setMaxScrollAttempts);
        setDouble(map, "dynamicWaitSeconds", cfg::setDynamicWaitSeconds);
        setInt(map, "maxDepth", cfg::setMaxDepth);
        setInt(map, "maxUrlsPerDomain", cfg::setMaxUrlsPerDomain);
        setDouble(map, "timeoutSeconds", cfg::setTimeoutSeconds);
        setDouble(map, "globalTimeoutSeconds", cfg::setGlobalTimeoutSeconds);
        setIntAsDurationMs(map, "requestTimeoutMs", cfg::setRequestTimeout);
        setDouble(map, "requestsPerSecond", cfg::setRequestsPerSecond);
        setInt(map, "concurrency", cfg::setConcurrency);
        setString(map, "userAgent", cfg::setUserAgent);

        // 2) dynamic.*
        Map<String, Object> dyn = getMap(map, "dynamic");
        if (dyn != null) {
            var d = cfg.dynamic();
            setBoolean(dyn, "enabled", d::setEnabled);
            setInt(dyn, "poolSize", d::setPoolSize);
            setBoolean(dyn, "headless", d::setHeadless);
            setInt(dyn, "minLinks", d::setMinLinks);
            setDouble(dyn, "linksPerKb", d::setLinksPerKb);
        }

        // 3) crawler.*
        Map<String, Object> crawler = getMap(map, "crawler");
        if (crawler != null) {
            var c = cfg.crawler();
            setBoolean(crawler, "excludeDefaults", keep -> { if (!keep) c.setExcludePaths(List.of()); });
            setStringList(crawler, "excludePaths", c::addExcludePaths);
            Map<String, Object> per = getMap(crawler, "domainExcludes");
            if (per != null) {
                Map<String, List<String>> out = new LinkedHashMap<>();
                per.forEach((host, v) -> out.put(UrlUtils.registrableDomain(host), toStringList(v)));
                c.setDomainExcludes(out);
            }
        }

        // 4) classifier.threshold
        Map<String, Object> cls = getMap(map, "classifier");
        if (cls != null) setDouble(cls, "threshold", cfg::setClassifierThreshold);

        // 5) output.file
        Map<String, Object> output = getMap(map, "output");
        if (output != null) setPath(output, "file", cfg::setOutputFile);

        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(toStringList(v));
    }

    private static List<String> toStringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
            return out;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) {
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().toUpperCase(Locale.ROOT);
        for (E e : type.getEnumConstants()) {
            if (e.name().equals(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("unknown " + key + ": " + v);
    }
}
