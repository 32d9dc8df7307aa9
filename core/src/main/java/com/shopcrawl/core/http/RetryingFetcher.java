package com.shopcrawl.core.http;

import com.shopcrawl.core.api.PageFetcher;
import com.shopcrawl.core.model.CrawlStats;
import com.shopcrawl.core.model.FetchMode;
import com.shopcrawl.core.model.FetchedPage;
import com.shopcrawl.core.util.DefaultSleeper;
import com.shopcrawl.core.util.Sleeper;
import com.shopcrawl.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 모드별 PageFetcher 에 재시도/백오프를 씌운다.
 * - TRANSIENT: 정책이 허락하는 동안 대기 후 재시도(Retry-After 우선, 상한 30s)
 * - PERMANENT: 즉시 전파
 * - 소진: FetchExhaustedException(마지막 오류 포함)
 * 스레드 세이프: 상태는 호출마다 새로 만든다.
 */
public final class RetryingFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(RetryingFetcher.class);
    static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    private final Map<FetchMode, PageFetcher> fetchers = new EnumMap<>(FetchMode.class);
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final CrawlStats stats;

    public RetryingFetcher(Collection<? extends PageFetcher> fetchers, RetryPolicy policy) {
        this(fetchers, policy, new DefaultSleeper(), null);
    }

    public RetryingFetcher(Collection<? extends PageFetcher> fetchers, RetryPolicy policy,
                           Sleeper sleeper, CrawlStats stats) {
        Objects.requireNonNull(fetchers, "fetchers");
        for (PageFetcher f : fetchers) {
            PageFetcher prev = this.fetchers.put(f.mode(), f);
            if (prev != null) throw new IllegalArgumentException("duplicate fetcher for mode " + f.mode());
        }
        if (!this.fetchers.containsKey(FetchMode.STATIC)) {
            throw new IllegalArgumentException("a STATIC fetcher is required");
        }
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stats = stats;
    }

    public boolean supports(FetchMode mode) {
        return fetchers.containsKey(mode);
    }

    /**
     * url 을 mode 로 취득한다. 반환된 페이지는 호출자가 닫아야 한다.
     *
     * @throws FetchExhaustedException 일시 오류가 maxAttempts 번 이어진 경우
     * @throws PermanentFetchException 재시도 무의미한 오류
     */
    public FetchedPage fetch(URI url, FetchMode mode)
            throws FetchExhaustedException, PermanentFetchException, InterruptedException {
        Objects.requireNonNull(url, "url");
        PageFetcher fetcher = fetchers.get(mode);
        if (fetcher == null) throw new IllegalStateException("no fetcher registered for mode " + mode);

        CountingRetryPolicy counting = new CountingRetryPolicy(policy);
        RetryState state = new RetryState();

        while (true) {
            int attempt = state.nextAttempt();
            try {
                FetchedPage page = fetcher.fetch(url);
                record(attempt, counting);
                return page;
            } catch (FetchException e) {
                state.failed(e);
                if (e.kind() == FetchException.Kind.PERMANENT) {
                    record(attempt, counting);
                    SLOG.warn("fetch-failed", "url", url.toString(), "mode", mode.name(),
                            "attempts", attempt, "kind", e.kind().name(), "status", e.getStatusCode());
                    throw (e instanceof PermanentFetchException p)
                            ? p : new PermanentFetchException(url, e.getMessage(), e);
                }
                if (!counting.shouldRetry(e, attempt)) {
                    record(attempt, counting);
                    LOG.warn("Fetch exhausted: {} ({} attempts, last={})", url, attempt, e.getMessage());
                    SLOG.warn("fetch-failed", "url", url.toString(), "mode", mode.name(),
                            "attempts", attempt, "kind", FetchException.Kind.EXHAUSTED.name(),
                            "status", e.getStatusCode());
                    throw new FetchExhaustedException(state.lastError(), attempt);
                }
                Duration delay = resolveDelay(counting.nextDelay(attempt), e);
                SLOG.debug("fetch-retry", "url", url.toString(), "attempt", attempt,
                        "delayMs", delay.toMillis(), "status", e.getStatusCode());
                sleeper.sleep(delay);
            }
        }
    }

    /** Retry-After 를 존중하되 과도한 대기는 30초로 상한 */
    static Duration resolveDelay(Duration fallback, FetchException e) {
        if (e instanceof TransientFetchException t) {
            Duration ra = t.getRetryAfter().orElse(null);
            if (ra != null && !ra.isNegative()) {
                return ra.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : ra;
            }
        }
        return fallback;
    }

    private void record(int attempts, CountingRetryPolicy counting) {
        if (stats == null) return;
        stats.addAttempts(attempts);
        stats.addRetries(counting.getRetryCount());
    }
}
