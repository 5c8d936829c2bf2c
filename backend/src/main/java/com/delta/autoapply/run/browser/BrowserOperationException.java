package com.delta.autoapply.run.browser;

/**
 * A browser step the run cannot continue without (launch, navigation, screenshot) failed.
 */
public class BrowserOperationException extends RuntimeException {
    public BrowserOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
