package com.delta.autoapply.run.browser.playwright;

import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.browser.BrowserSession;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

class PlaywrightBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
    }

    @Override
    public BrowserPage newPage() {
        return new PlaywrightBrowserPage(context.newPage());
    }

    @Override
    public void saveStorageState(Path file) {
        context.storageState(new BrowserContext.StorageStateOptions().setPath(file));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            context.close();
        } catch (Exception e) {
            log.debug("Error closing browser context: {}", e.getMessage());
        }
        try {
            if (browser.isConnected()) {
                browser.close();
            }
        } catch (Exception e) {
            log.debug("Error closing browser: {}", e.getMessage());
        }
        try {
            playwright.close();
        } catch (Exception e) {
            log.warn("Error closing playwright driver", e);
        }
    }
}
