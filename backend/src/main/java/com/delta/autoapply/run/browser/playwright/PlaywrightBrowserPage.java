package com.delta.autoapply.run.browser.playwright;

import com.delta.autoapply.run.browser.BrowserOperationException;
import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.browser.ElementRole;
import com.delta.autoapply.run.browser.PageElements;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.AriaRole;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;

import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;

class PlaywrightBrowserPage implements BrowserPage {
    private final Page page;

    PlaywrightBrowserPage(Page page) {
        this.page = page;
    }

    @Override
    public void navigate(String url) {
        try {
            page.navigate(url, new Page.NavigateOptions().setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Navigation to " + url + " failed", e);
        }
    }

    @Override
    public String url() {
        return page.url();
    }

    @Override
    public PageElements locate(String selector) {
        return new PlaywrightElements(page.locator(selector));
    }

    @Override
    public PageElements byLabel(Pattern pattern) {
        return new PlaywrightElements(page.getByLabel(pattern));
    }

    @Override
    public PageElements byText(Pattern pattern) {
        return new PlaywrightElements(page.getByText(pattern));
    }

    @Override
    public PageElements byRole(ElementRole role, Pattern name) {
        AriaRole ariaRole = role == ElementRole.LINK ? AriaRole.LINK : AriaRole.BUTTON;
        if (name == null) {
            return new PlaywrightElements(page.getByRole(ariaRole));
        }
        return new PlaywrightElements(page.getByRole(ariaRole, new Page.GetByRoleOptions().setName(name)));
    }

    @Override
    public void screenshot(Path file) {
        try {
            page.screenshot(new Page.ScreenshotOptions().setPath(file).setFullPage(true));
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Screenshot " + file.getFileName() + " failed", e);
        }
    }

    @Override
    public void pause(Duration duration) {
        page.waitForTimeout(Math.max(0, duration.toMillis()));
    }

    @Override
    public void waitForLoad() {
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);
    }
}
