package com.shopcrawl.core.http;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/** 네트워크 타임아웃, 5xx, 429, 렌더 드라이버 일시 오류. 재시도 대상. */
public class TransientFetchException extends FetchException {
    private final Duration retryAfter;

    public TransientFetchException(URI url, int statusCode, String message) {
        this(url, statusCode, message, null, null);
    }

    public TransientFetchException(URI url, String message, Throwable cause) {
        this(url, -1, message, null, cause);
    }

    public TransientFetchException(URI url, int statusCode, String message, Duration retryAfter, Throwable cause) {
        super(url, statusCode, message, cause);
        this.retryAfter = retryAfter;
    }

    /** 서버가 Retry-After 를 준 경우 */
    public Optional<Duration> getRetryAfter() { return Optional.ofNullable(retryAfter); }

    @Override public Kind kind() { return Kind.TRANSIENT; }
}
