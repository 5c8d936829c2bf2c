package com.delta.autoapply.run.browser.playwright;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.browser.BrowserDriver;
import com.delta.autoapply.run.browser.BrowserOperationException;
import com.delta.autoapply.run.browser.BrowserSession;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Launches one Chromium per session. Playwright objects are not thread safe, so every run
 * thread gets its own driver instance and closes it with the session.
 */
@Component
public class PlaywrightBrowserDriver implements BrowserDriver {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserDriver.class);

    private final AutoApplyProperties.Browser properties;

    public PlaywrightBrowserDriver(AutoApplyProperties properties) {
        this.properties = properties.getBrowser();
    }

    @Override
    public BrowserSession open(Path storageState) {
        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Unable to start Playwright", e);
        }
        try {
            log.info("Launching Chromium (headless={}, storageState={})", properties.isHeadless(), storageState);
            Browser browser = playwright.chromium().launch(
                new BrowserType.LaunchOptions()
                    .setHeadless(properties.isHeadless())
                    .setArgs(List.of("--no-first-run", "--no-default-browser-check")));
            Browser.NewContextOptions options = new Browser.NewContextOptions()
                .setViewportSize(properties.getViewportWidth(), properties.getViewportHeight());
            if (storageState != null) {
                options.setStorageStatePath(storageState);
            }
            BrowserContext context = browser.newContext(options);
            context.setDefaultNavigationTimeout(properties.getNavigationTimeoutMs());
            context.setDefaultTimeout(properties.getActionTimeoutMs());
            return new PlaywrightBrowserSession(playwright, browser, context);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new BrowserOperationException("Unable to launch browser", e);
        }
    }
}
