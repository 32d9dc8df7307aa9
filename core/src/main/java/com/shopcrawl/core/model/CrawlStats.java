package com.shopcrawl.core.model;

import java.util.concurrent.atomic.AtomicLong;

/** 크롤 텔레메트리 누적기 (스레드 세이프). 오케스트레이터가 전 도메인 합계를 보관한다. */
public final class CrawlStats {
    private final AtomicLong pagesFetched   = new AtomicLong(0);  // 성공한 정적 취득
    private final AtomicLong attemptsTotal  = new AtomicLong(0);  // 재시도 포함 시도 수
    private final AtomicLong retriesTotal   = new AtomicLong(0);
    private final AtomicLong fetchFailures  = new AtomicLong(0);  // 소진/영구 실패로 건너뛴 URL
    private final AtomicLong dynamicRuns    = new AtomicLong(0);  // 동적 해석 실행 수
    private final AtomicLong productsFound  = new AtomicLong(0);

    public void pageFetched()          { pagesFetched.incrementAndGet(); }
    public void addAttempts(long n)    { attemptsTotal.addAndGet(n); }
    public void addRetries(long n)     { retriesTotal.addAndGet(n); }
    public void fetchFailed()          { fetchFailures.incrementAndGet(); }
    public void dynamicResolved()      { dynamicRuns.incrementAndGet(); }
    public void productFound()         { productsFound.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(pagesFetched.get(), attemptsTotal.get(), retriesTotal.get(),
                fetchFailures.get(), dynamicRuns.get(), productsFound.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long pagesFetched;
        public final long attemptsTotal;
        public final long retriesTotal;
        public final long fetchFailures;
        public final long dynamicRuns;
        public final long productsFound;
        public Snapshot(long pages, long attempts, long retries, long failures, long dynamic, long products) {
            this.pagesFetched = pages;
            this.attemptsTotal = attempts;
            this.retriesTotal = retries;
            this.fetchFailures = failures;
            this.dynamicRuns = dynamic;
            this.productsFound = products;
        }
    }
}
