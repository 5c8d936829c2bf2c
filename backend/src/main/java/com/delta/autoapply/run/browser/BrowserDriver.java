package com.delta.autoapply.run.browser;

import java.nio.file.Path;

public interface BrowserDriver {

    /**
     * @param storageState saved session to seed the context with, or {@code null} for a fresh one
     * @throws BrowserOperationException when no browser can be started
     */
    BrowserSession open(Path storageState);
}
