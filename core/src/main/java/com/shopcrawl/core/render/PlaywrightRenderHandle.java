package com.shopcrawl.core.render;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.shopcrawl.core.api.Affordance;
import com.shopcrawl.core.api.RenderHandle;
import com.shopcrawl.core.model.PageContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Playwright Page 위의 RenderHandle.
 * close() 는 컨텍스트를 닫고 빌린 브라우저를 풀에 돌려준다.
 */
final class PlaywrightRenderHandle implements RenderHandle {

    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightRenderHandle.class);

    /** "더 보기" 버튼 문구(대소문자 무시) */
    static final List<String> LOAD_MORE_TEXTS = List.of(
            "load more", "show more", "view more", "load products",
            "next page", "more items", "more products");

    private static final String LOAD_MORE_SELECTOR = buildSelector();
    private static final double CLICK_TIMEOUT_MS = 5_000;

    private final Page page;
    private final BrowserContext context;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    PlaywrightRenderHandle(Page page, BrowserContext context, Runnable onClose) {
        this.page = page;
        this.context = context;
        this.onClose = onClose;
    }

    @Override
    public void scrollToBottom() {
        try {
            page.evaluate("() => window.scrollTo(0, document.body.scrollHeight)");
        } catch (PlaywrightException e) {
            throw translate("scroll", e);
        }
    }

    @Override
    public void waitMillis(long millis) {
        if (millis <= 0) return;
        try {
            page.waitForTimeout(millis);
        } catch (PlaywrightException e) {
            throw translate("wait", e);
        }
    }

    @Override
    public PageContent extractContent() {
        try {
            String html = page.content();
            return PageContent.builder()
                    .url(URI.create(page.url()))
                    .statusCode(200)
                    .body(html)
                    .contentType("text/html")
                    .build();
        } catch (PlaywrightException e) {
            throw translate("extract", e);
        } catch (IllegalArgumentException e) {
            throw new RenderException("unparseable page url: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Affordance> findLoadMoreAffordance() {
        try {
            Locator first = page.locator(LOAD_MORE_SELECTOR).first();
            if (first.count() == 0 || !first.isVisible()) return Optional.empty();
            String label = first.innerText().trim();
            return Optional.of(new PlaywrightAffordance(first, label));
        } catch (PlaywrightException e) {
            throw translate("find load-more", e);
        }
    }

    @Override
    public void click(Affordance affordance) {
        if (!(affordance instanceof PlaywrightAffordance pa)) {
            throw new IllegalArgumentException("foreign affordance: " + affordance);
        }
        try {
            pa.locator.click(new Locator.ClickOptions().setTimeout(CLICK_TIMEOUT_MS));
        } catch (PlaywrightException e) {
            throw translate("click '" + pa.label + "'", e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            context.close();
        } catch (PlaywrightException e) {
            LOG.debug("Context close failed: {}", e.getMessage());
        } finally {
            onClose.run();
        }
    }

    private static RenderException translate(String op, PlaywrightException e) {
        if (e instanceof TimeoutError) return new RenderTimeoutException(op + " timed out", e);
        return new RenderException(op + " failed: " + e.getMessage(), e);
    }

    private static String buildSelector() {
        return LOAD_MORE_TEXTS.stream()
                .flatMap(t -> java.util.stream.Stream.of(
                        "button:text-matches(\"" + t + "\", \"i\")",
                        "a:text-matches(\"" + t + "\", \"i\")"))
                .collect(Collectors.joining(", "));
    }

    private static final class PlaywrightAffordance implements Affordance {
        final Locator locator;
        final String label;

        PlaywrightAffordance(Locator locator, String label) {
            this.locator = locator;
            this.label = label;
        }

        @Override public String label() { return label; }

        @Override public String toString() { return "Affordance[" + label + "]"; }
    }
}
