package org.netpreserve.printroo.cdp;

/**
 * The browser failed to start, exited unexpectedly or could not be stopped.
 */
public class BrowserProcessException extends RuntimeException {
    public BrowserProcessException(String message) {
        super(message);
    }

    public BrowserProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}
