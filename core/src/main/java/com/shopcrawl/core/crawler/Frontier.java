package com.shopcrawl.core.crawler;

import com.shopcrawl.core.model.FrontierEntry;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 도메인 하나의 BFS 대기열 + 방문 집합.
 * enqueue 시점에 방문 처리하므로 같은 URL 은 평생 한 번만 큐에 들어간다.
 * 소유 크롤러 스레드만 만진다(동기화 없음).
 */
public final class Frontier {
    private final int maxDepth;
    private final int maxDiscovered;
    private final Deque<FrontierEntry> queue = new ArrayDeque<>();
    private final Set<URI> visited = new HashSet<>();

    public Frontier(int maxDepth, int maxDiscovered) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxDiscovered < 1) throw new IllegalArgumentException("maxDiscovered must be >= 1");
        this.maxDepth = maxDepth;
        this.maxDiscovered = maxDiscovered;
    }

    /**
     * url 은 이미 정규화되어 있어야 한다.
     * @return 실제로 큐에 들어갔으면 true (중복/깊이 초과/상한 도달이면 false)
     */
    public boolean enqueue(URI url, int depth) {
        if (url == null || depth < 0 || depth > maxDepth) return false;
        if (visited.contains(url)) return false;
        if (visited.size() >= maxDiscovered) return false;
        visited.add(url);
        queue.addLast(new FrontierEntry(url, depth));
        return true;
    }

    public Optional<FrontierEntry> dequeue() {
        return Optional.ofNullable(queue.pollFirst());
    }

    public boolean isEmpty() { return queue.isEmpty(); }

    public int pendingCount() { return queue.size(); }

    public int discoveredCount() { return visited.size(); }

    public boolean isSaturated() { return visited.size() >= maxDiscovered; }

    public boolean isVisited(URI url) { return visited.contains(url); }
}
