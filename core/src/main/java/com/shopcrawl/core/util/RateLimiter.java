package com.shopcrawl.core.util;

/**
 * 토큰 버킷. 도메인 크롤러 하나가 소유하며 같은 호스트로의 요청 간격을 보장한다.
 * permitsPerSecond 가 0 이하이면 제한 없음.
 */
public final class RateLimiter {
    private final double capacity;
    private final double refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(double capacity, double refillPerSecond) {
        this.capacity = Math.max(1.0, capacity);
        this.refillPerSecond = refillPerSecond;
        this.tokens = this.capacity;
        this.lastNs = System.nanoTime();
    }

    /** 버스트 1, 초당 permitsPerSecond */
    public static RateLimiter perSecond(double permitsPerSecond) {
        return new RateLimiter(1.0, permitsPerSecond);
    }

    public synchronized void acquire() throws InterruptedException {
        if (refillPerSecond <= 0) return;
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            long waitMs = (long) Math.ceil((1.0 - tokens) / refillPerSecond * 1000.0);
            this.wait(Math.max(1, Math.min(waitMs, 50)));
        }
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
