package com.shopcrawl.core.http;

import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.CrawlConfig.Backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * 일시 오류(TRANSIENT)에서만 재시도.
 * FIXED: d, d, d / LINEAR: d, 2d, 3d / EXPONENTIAL: d, 2d, 4d
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Backoff backoff;

    public DefaultRetryPolicy() { this(3, Duration.ofSeconds(5), Backoff.LINEAR); }

    public DefaultRetryPolicy(int maxAttempts, Duration baseDelay, Backoff backoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = (baseDelay == null || baseDelay.isNegative()) ? Duration.ZERO : baseDelay;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    public static DefaultRetryPolicy from(CrawlConfig cfg) {
        return new DefaultRetryPolicy(cfg.getMaxRetries(), cfg.getRetryDelay(), cfg.getRetryBackoff());
    }

    @Override public boolean shouldRetry(FetchException error, int attempt) {
        if (attempt >= maxAttempts) return false;
        return error != null && error.kind() == FetchException.Kind.TRANSIENT;
    }

    @Override public Duration nextDelay(int attempt) {
        int n = Math.max(1, attempt);
        return switch (backoff) {
            case FIXED -> baseDelay;
            case LINEAR -> baseDelay.multipliedBy(n);
            case EXPONENTIAL -> baseDelay.multipliedBy(1L << Math.min(n - 1, 20));
        };
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
