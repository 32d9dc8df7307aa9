package com.shopcrawl.core.render;

import com.shopcrawl.core.crawler.ContentSignalExtractor;
import com.shopcrawl.core.model.ContentSignals;
import com.shopcrawl.core.util.FrozenClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static com.shopcrawl.core.render.ScriptedRenderHandle.linksPage;
import static org.assertj.core.api.Assertions.assertThat;

class DynamicContentResolverTest {

    private static final URI PAGE = URI.create("https://shop.example/c/all");

    private final FrozenClock clock = new FrozenClock(0);

    private DynamicContentResolver resolver(int maxAttempts) {
        return new DynamicContentResolver(maxAttempts, Duration.ofSeconds(30), Duration.ofSeconds(5),
                new ContentSignalExtractor(), clock);
    }

    @Test
    @DisplayName("첫 반복에 새 링크가 없으면 바로 안정화(maxScrollAttempts=10)")
    void stabilizes_within_two_iterations() {
        ScriptedRenderHandle h = new ScriptedRenderHandle(PAGE,
                linksPage("/p/1", "/p/2"),
                linksPage("/p/1", "/p/2"));

        ResolutionResult r = resolver(10).resolve(h, null);

        assertThat(r.getOutcome()).isEqualTo(ResolutionResult.Outcome.STABILIZED);
        assertThat(r.getIterations()).isLessThanOrEqualTo(2);
        assertThat(r.getOutcome().isPartial()).isFalse();
        assertThat(r.getSignals().getLinks()).extracting(URI::getPath).containsExactly("/p/1", "/p/2");
    }

    @Test
    @DisplayName("계속 늘어나는 무한 스크롤은 maxScrollAttempts 에서 멈춘다")
    void stops_at_max_attempts() {
        ScriptedRenderHandle h = new ScriptedRenderHandle(PAGE,
                linksPage("/p/1"),
                linksPage("/p/1", "/p/2"),
                linksPage("/p/1", "/p/2", "/p/3"),
                linksPage("/p/1", "/p/2", "/p/3", "/p/4"));

        ResolutionResult r = resolver(3).resolve(h, ContentSignals.empty());

        assertThat(r.getOutcome()).isEqualTo(ResolutionResult.Outcome.MAX_ATTEMPTS);
        assertThat(r.getIterations()).isEqualTo(3);
        assertThat(h.scrolls).isEqualTo(3);
        assertThat(r.getSignals().getLinks()).hasSize(3);
        assertThat(h.waits).containsOnly(5_000L);
    }

    @Test
    @DisplayName("scrollTimeout 을 넘기면 지금까지 모은 신호로 TIMED_OUT")
    void times_out_with_partial_signals() {
        ScriptedRenderHandle h = new ScriptedRenderHandle(PAGE,
                linksPage("/p/1"),
                linksPage("/p/1", "/p/2"),
                linksPage("/p/1", "/p/2", "/p/3"));
        h.onScroll = () -> clock.plusMillis(20_000);

        ResolutionResult r = resolver(10).resolve(h, ContentSignals.empty());

        assertThat(r.getOutcome()).isEqualTo(ResolutionResult.Outcome.TIMED_OUT);
        assertThat(r.getIterations()).isEqualTo(2);
        assertThat(r.getSignals().getLinks()).hasSize(2);
        assertThat(h.waits).containsExactly(5_000L, 5_000L);
    }

    @Test
    void wait_is_clamped_to_remaining_budget() {
        ScriptedRenderHandle h = new ScriptedRenderHandle(PAGE, linksPage("/p/1"), linksPage("/p/1", "/p/2"),
                linksPage("/p/1", "/p/2"));
        h.onScroll = () -> clock.plusMillis(28_000);

        resolver(10).resolve(h, ContentSignals.empty());

        // 첫 스크롤에 28s 소모 → 두 번째 대기는 남은 2s 로 잘린다
        assertThat(h.waits).containsExactly(5_000L, 2_000L);
    }

    @Test
    @DisplayName("더보기 버튼은 반복마다 한 번씩 누른다")
    void load_more_clicked_once_per_iteration() {
        ScriptedRenderHandle h = new ScriptedRenderHandle(PAGE,
                linksPage("/p/1"),
                linksPage("/p/1", "/p/2"),
                linksPage("/p/1", "/p/2"));
        h.loadMoreLabel = "Load more";

        ResolutionResult r = resolver(10).resolve(h, ContentSignals.empty());

        assertThat(r.getIterations()).isEqualTo(3);
        assertThat(h.clicks).hasSize(r.getIterations()).containsOnly("Load more");
    }

    @Test
    @DisplayName("드라이버 오류는 예외 대신 부분 결과")
    void driver_error_yields_partial_result() {
        ScriptedRenderHandle h = new ScriptedRenderHandle(PAGE,
                linksPage("/p/1"),
                linksPage("/p/1", "/p/2"));
        h.failOnExtract = 2;

        ResolutionResult r = resolver(10).resolve(h, ContentSignals.empty());

        assertThat(r.getOutcome()).isEqualTo(ResolutionResult.Outcome.DRIVER_ERROR);
        assertThat(r.getOutcome().isPartial()).isTrue();
        assertThat(r.getSignals().getLinks()).extracting(URI::getPath).containsExactly("/p/1");
    }

    @Test
    void render_timeout_maps_to_timed_out() {
        ScriptedRenderHandle h = new ScriptedRenderHandle(PAGE, linksPage("/p/1"));
        h.failOnExtract = 1;
        h.failure = new RenderTimeoutException("navigation timeout");

        ResolutionResult r = resolver(10).resolve(h, ContentSignals.empty());

        assertThat(r.getOutcome()).isEqualTo(ResolutionResult.Outcome.TIMED_OUT);
        assertThat(r.getSignals().getLinks()).isEmpty();
    }
}
