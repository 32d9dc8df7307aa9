package com.shopcrawl.core.http;

import com.shopcrawl.core.api.PageFetcher;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.FetchMode;
import com.shopcrawl.core.model.FetchedPage;
import com.shopcrawl.core.model.PageContent;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * STATIC 모드 구현: HttpClient GET 1회.
 * 2xx → 본문, 429/5xx/IO 오류 → 일시 오류, 그 밖의 4xx·잘못된 URL → 영구 오류.
 */
public class HttpPageFetcher implements PageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final Duration timeout;
    private final String userAgent;
    private final HttpSender sender;

    public HttpPageFetcher(CrawlConfig config) {
        this(config, defaultSender(config));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig config, HttpSender sender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getRequestTimeout();
        this.userAgent = config.getUserAgent();
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender defaultSender(CrawlConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getRequestTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Override public FetchMode mode() { return FetchMode.STATIC; }

    @Override
    public FetchedPage fetch(URI url) throws FetchException, InterruptedException {
        Objects.requireNonNull(url, "url");
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new PermanentFetchException(url, "malformed url", e);
        }

        long start = System.nanoTime();
        HttpResponse<String> resp;
        try {
            resp = sender.send(req);
        } catch (IOException e) {
            throw new TransientFetchException(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        int status = resp.statusCode();
        HttpHeaders hh = resp.headers();
        if (status == 429 || status >= 500) {
            throw new TransientFetchException(url, status, "HTTP " + status,
                    parseRetryAfter(hh.firstValue("Retry-After").orElse(null)), null);
        }
        if (status < 200 || status >= 300) {
            throw new PermanentFetchException(url, status, "HTTP " + status);
        }

        String contentType = hh.firstValue("Content-Type").orElse(null);
        if (contentType != null && !isHtml(contentType)) {
            throw new PermanentFetchException(url, status, "not html: " + contentType);
        }

        URI finalUri = (resp.uri() != null) ? resp.uri() : url;
        return FetchedPage.ofStatic(PageContent.builder()
                .url(finalUri)
                .statusCode(status)
                .body(resp.body() == null ? "" : resp.body())
                .contentType(contentType)
                .responseTimeMs(elapsedMs)
                .build());
    }

    private static boolean isHtml(String contentType) {
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("html") || ct.startsWith("text/plain");
    }

    /** seconds 형태만 해석. HTTP-date 는 무시하고 정책 지연을 쓴다. */
    static Duration parseRetryAfter(String v) {
        if (v == null || v.isBlank()) return null;
        try {
            long sec = Long.parseLong(v.trim());
            return sec >= 0 ? Duration.ofSeconds(sec) : null;
        } catch (NumberFormatException ignore) {
            return null;
        }
    }
}
