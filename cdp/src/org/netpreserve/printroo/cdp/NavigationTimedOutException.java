package org.netpreserve.printroo.cdp;

import org.netpreserve.printroo.util.Url;

public class NavigationTimedOutException extends NavigationException {
    public NavigationTimedOutException(Url url, String message) {
        super(url, message);
    }

    public NavigationTimedOutException(Url url, String message, Throwable cause) {
        super(url, message, cause);
    }
}
