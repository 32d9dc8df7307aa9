package com.shopcrawl.core.render;

import com.shopcrawl.core.api.Affordance;
import com.shopcrawl.core.api.RenderHandle;
import com.shopcrawl.core.crawler.ContentSignalExtractor;
import com.shopcrawl.core.model.ContentSignals;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.util.CrawlClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 렌더 핸들을 (더보기 클릭 → 스크롤 → 대기 → 재추출) 로 반복 구동해
 * 내용이 안정될 때까지 링크/신호를 모은다.
 * 종료: 안정화 | maxScrollAttempts | scrollTimeout | 드라이버 오류. 어떤 경우든 예외 없이 부분 결과를 돌려준다.
 */
public final class DynamicContentResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DynamicContentResolver.class);

    private final int maxScrollAttempts;
    private final Duration scrollTimeout;
    private final Duration dynamicWait;
    private final ContentSignalExtractor extractor;
    private final CrawlClock clock;

    public DynamicContentResolver(CrawlConfig cfg, ContentSignalExtractor extractor, CrawlClock clock) {
        this(cfg.getMaxScrollAttempts(), cfg.getScrollTimeout(), cfg.getDynamicWait(), extractor, clock);
    }

    public DynamicContentResolver(int maxScrollAttempts, Duration scrollTimeout, Duration dynamicWait,
                                  ContentSignalExtractor extractor, CrawlClock clock) {
        if (maxScrollAttempts < 1) throw new IllegalArgumentException("maxScrollAttempts must be >= 1");
        this.maxScrollAttempts = maxScrollAttempts;
        this.scrollTimeout = Objects.requireNonNull(scrollTimeout, "scrollTimeout");
        this.dynamicWait = Objects.requireNonNull(dynamicWait, "dynamicWait");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param initial 핸들을 연 직후의 신호(없으면 핸들에서 새로 뽑는다)
     */
    public ResolutionResult resolve(RenderHandle handle, ContentSignals initial) {
        Objects.requireNonNull(handle, "handle");
        final long deadline = clock.nowMillis() + scrollTimeout.toMillis();

        ContentSignals best;
        if (initial != null) {
            best = initial;
        } else {
            try {
                best = extractor.extract(handle.extractContent());
            } catch (RenderException e) {
                LOG.debug("Initial snapshot failed: {}", e.getMessage());
                return new ResolutionResult(ContentSignals.empty(), 0, outcomeOf(e));
            }
        }

        Set<URI> seen = new HashSet<>(best.getLinks());
        int lastSize = best.getContentSize();
        int iterations = 0;

        while (iterations < maxScrollAttempts) {
            if (Thread.currentThread().isInterrupted()) {
                return new ResolutionResult(best, iterations, ResolutionResult.Outcome.INTERRUPTED);
            }
            long remaining = deadline - clock.nowMillis();
            if (remaining <= 0) {
                return new ResolutionResult(best, iterations, ResolutionResult.Outcome.TIMED_OUT);
            }
            iterations++;

            try {
                clickLoadMore(handle);
                handle.scrollToBottom();
                handle.waitMillis(Math.min(dynamicWait.toMillis(), remaining));
                ContentSignals now = extractor.extract(handle.extractContent());

                boolean newLinks = false;
                for (URI u : now.getLinks()) {
                    if (seen.add(u)) newLinks = true;
                }
                boolean grew = now.getContentSize() > lastSize;
                lastSize = Math.max(lastSize, now.getContentSize());
                best = best.merge(now);

                if (!newLinks && !grew) {
                    return new ResolutionResult(best, iterations, ResolutionResult.Outcome.STABILIZED);
                }
            } catch (RenderException e) {
                LOG.debug("Render step {} stopped: {}", iterations, e.getMessage());
                return new ResolutionResult(best, iterations, outcomeOf(e));
            }
        }
        return new ResolutionResult(best, iterations, ResolutionResult.Outcome.MAX_ATTEMPTS);
    }

    /** 더보기 클릭 실패는 치명적이지 않다. 스크롤은 계속 진행 */
    private static void clickLoadMore(RenderHandle handle) {
        Optional<Affordance> more = handle.findLoadMoreAffordance();
        if (more.isEmpty()) return;
        try {
            handle.click(more.get());
        } catch (RenderException e) {
            LOG.debug("Load-more click '{}' failed: {}", more.get().label(), e.getMessage());
        }
    }

    private static ResolutionResult.Outcome outcomeOf(RenderException e) {
        return (e instanceof RenderTimeoutException)
                ? ResolutionResult.Outcome.TIMED_OUT
                : ResolutionResult.Outcome.DRIVER_ERROR;
    }
}
