package com.shopcrawl.core.render;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;

/** Playwright 런타임 + Chromium 한 개. 풀 슬롯 하나에 대응한다. */
public final class PlaywrightDriver implements AutoCloseable {
    private final Playwright playwright;
    private final Browser browser;

    private PlaywrightDriver(Playwright playwright, Browser browser) {
        this.playwright = playwright;
        this.browser = browser;
    }

    public static PlaywrightDriver launch(boolean headless) {
        Playwright pw = null;
        try {
            pw = Playwright.create();
            Browser b = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            return new PlaywrightDriver(pw, b);
        } catch (PlaywrightException e) {
            if (pw != null) pw.close();
            throw new RenderException("chromium launch failed: " + e.getMessage(), e);
        }
    }

    public Browser browser() { return browser; }

    public boolean isAlive() { return browser.isConnected(); }

    @Override
    public void close() {
        try {
            browser.close();
        } finally {
            playwright.close();
        }
    }
}
