package org.netpreserve.printroo.cdp;

import org.netpreserve.printroo.util.Url;

public class NavigationException extends Exception {
    protected final Url url;

    public NavigationException(Url url, String message) {
        super(message + " for " + url);
        this.url = url;
    }

    public NavigationException(Url url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url;
    }

    public Url url() {
        return url;
    }
}
