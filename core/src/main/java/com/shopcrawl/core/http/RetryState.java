package com.shopcrawl.core.http;

/** fetch 한 번 동안만 사는 재시도 상태. 성공/소진 후 버린다. */
final class RetryState {
    private int attempt = 0;
    private FetchException lastError;

    int nextAttempt() { return ++attempt; }
    int attempt() { return attempt; }

    void failed(FetchException e) { this.lastError = e; }
    FetchException lastError() { return lastError; }
}
