package com.shopcrawl.core.http;

/** 재시도 예산 소진. 마지막 오류를 cause 로 들고 있다. 호출자는 URL 을 건너뛰고 계속 진행. */
public class FetchExhaustedException extends FetchException {
    private final int attempts;

    public FetchExhaustedException(FetchException lastError, int attempts) {
        super(lastError.getUrl(), lastError.getStatusCode(),
                "gave up after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() { return attempts; }

    public FetchException getLastError() { return (FetchException) getCause(); }

    @Override public Kind kind() { return Kind.EXHAUSTED; }
}
