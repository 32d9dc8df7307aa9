package com.shopcrawl.core.render;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.shopcrawl.core.api.PageFetcher;
import com.shopcrawl.core.http.FetchException;
import com.shopcrawl.core.http.PermanentFetchException;
import com.shopcrawl.core.http.TransientFetchException;
import com.shopcrawl.core.model.CrawlConfig;
import com.shopcrawl.core.model.FetchMode;
import com.shopcrawl.core.model.FetchedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;

/**
 * DYNAMIC 모드 구현. 풀에서 브라우저를 빌려 새 컨텍스트로 페이지를 연다.
 * 성공하면 핸들이 반납 책임을 넘겨받고, 실패하면 여기서 바로 반납한다.
 */
public final class PlaywrightPageFetcher implements PageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightPageFetcher.class);

    private final RenderDriverPool<PlaywrightDriver> pool;
    private final boolean ownsPool;
    private final String userAgent;
    private final double timeoutMs;

    /** 설정의 poolSize/headless 로 자체 풀을 만든다. close() 가 풀까지 닫는다. */
    public PlaywrightPageFetcher(CrawlConfig config) {
        this(new RenderDriverPool<>(config.dynamic().getPoolSize(),
                        () -> PlaywrightDriver.launch(config.dynamic().isHeadless()),
                        PlaywrightDriver::isAlive),
                config, true);
    }

    public PlaywrightPageFetcher(RenderDriverPool<PlaywrightDriver> pool, CrawlConfig config) {
        this(pool, config, false);
    }

    private PlaywrightPageFetcher(RenderDriverPool<PlaywrightDriver> pool, CrawlConfig config, boolean ownsPool) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.ownsPool = ownsPool;
        this.userAgent = config.getUserAgent();
        this.timeoutMs = config.getRequestTimeout().toMillis();
    }

    @Override public FetchMode mode() { return FetchMode.DYNAMIC; }

    @Override
    public FetchedPage fetch(URI url) throws FetchException, InterruptedException {
        Objects.requireNonNull(url, "url");
        final RenderDriverPool<PlaywrightDriver>.Lease lease;
        try {
            lease = pool.acquire();
        } catch (RenderException e) {
            throw new TransientFetchException(url, "render driver unavailable: " + e.getMessage(), e);
        }

        BrowserContext ctx = null;
        boolean handedOver = false;
        try {
            Browser browser = lease.driver().browser();
            ctx = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(userAgent)
                    .setViewportSize(1920, 1080));
            Page page = ctx.newPage();
            page.setDefaultTimeout(timeoutMs);

            Response resp = page.navigate(url.toString(), new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(timeoutMs));
            int status = (resp == null) ? 200 : resp.status();
            if (status == 429 || status >= 500) {
                throw new TransientFetchException(url, status, "HTTP " + status);
            }
            if (status >= 400) {
                throw new PermanentFetchException(url, status, "HTTP " + status);
            }
            waitForNetworkIdle(page);

            PlaywrightRenderHandle handle = new PlaywrightRenderHandle(page, ctx, lease::release);
            handedOver = true;
            try {
                return FetchedPage.rendered(handle.extractContent(), handle);
            } catch (RenderException e) {
                handle.close();
                throw new TransientFetchException(url, "content snapshot failed: " + e.getMessage(), e);
            }
        } catch (PlaywrightException e) {
            throw new TransientFetchException(url, "render failed: " + e.getMessage(), e);
        } finally {
            if (!handedOver) {
                closeContext(ctx);
                lease.release();
            }
        }
    }

    /** 네트워크 유휴 대기는 최선 노력. 분석 광고 스크립트 때문에 안 오는 경우가 많다. */
    private void waitForNetworkIdle(Page page) {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE,
                    new Page.WaitForLoadStateOptions().setTimeout(timeoutMs));
        } catch (TimeoutError e) {
            LOG.debug("Network idle not reached on {}; using current DOM", page.url());
        }
    }

    private static void closeContext(BrowserContext ctx) {
        if (ctx == null) return;
        try {
            ctx.close();
        } catch (PlaywrightException e) {
            LOG.debug("Context close failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        if (ownsPool) pool.close();
    }
}
