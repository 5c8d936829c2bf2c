package com.delta.autoapply.run.browser;

import java.nio.file.Path;

/**
 * One isolated browser context owned by a single run.
 */
public interface BrowserSession extends AutoCloseable {

    BrowserPage newPage();

    /**
     * Writes cookies and local storage so a later session can resume without signing in.
     */
    void saveStorageState(Path file);

    @Override
    void close();
}
