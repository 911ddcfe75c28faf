package org.netpreserve.printroo.cdp;

public class BrowserStartupTimeoutException extends BrowserProcessException {
    public BrowserStartupTimeoutException(String message) {
        super(message);
    }

    public BrowserStartupTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
