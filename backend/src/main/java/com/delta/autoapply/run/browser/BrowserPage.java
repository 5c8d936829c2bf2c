package com.delta.autoapply.run.browser;

import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Capabilities the run needs from one browser tab.
 */
public interface BrowserPage {

    /**
     * @throws BrowserOperationException when the page cannot be loaded
     */
    void navigate(String url);

    String url();

    PageElements locate(String selector);

    PageElements byLabel(Pattern pattern);

    PageElements byText(Pattern pattern);

    /**
     * @param name accessible-name filter, or {@code null} for any element of the role
     */
    PageElements byRole(ElementRole role, Pattern name);

    /**
     * @throws BrowserOperationException when the screenshot cannot be written
     */
    void screenshot(Path file);

    void pause(Duration duration);

    void waitForLoad();
}
