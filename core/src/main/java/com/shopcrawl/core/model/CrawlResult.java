package com.shopcrawl.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 도메인별 최종 결과. urls 는 발견 순서(BFS) 그대로이며 count == urls.size() 를 항상 만족한다.
 * 종료 시점(또는 강제 종료 시점)에 한 번만 만들어진다.
 */
public final class CrawlResult {
    private final String domain;
    private final List<String> urls;
    private final Instant timestamp;
    private final TerminalState terminalState;
    private final int pagesVisited;

    public CrawlResult(String domain, List<String> urls, Instant timestamp,
                       TerminalState terminalState, int pagesVisited) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.urls = List.copyOf(Objects.requireNonNull(urls, "urls"));
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.terminalState = Objects.requireNonNull(terminalState, "terminalState");
        this.pagesVisited = Math.max(0, pagesVisited);
    }

    public static CrawlResult failed(String domain, Instant at) {
        return new CrawlResult(domain, List.of(), at, TerminalState.FAILED, 0);
    }

    public String getDomain() { return domain; }
    public List<String> getUrls() { return urls; }
    public int getCount() { return urls.size(); }
    public Instant getTimestamp() { return timestamp; }
    public TerminalState getTerminalState() { return terminalState; }
    public int getPagesVisited() { return pagesVisited; }

    @Override public String toString() {
        return "CrawlResult{domain=" + domain + ", count=" + getCount() + ", state=" + terminalState
                + ", pages=" + pagesVisited + ", at=" + timestamp + '}';
    }
}
