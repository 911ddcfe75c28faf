package org.netpreserve.printroo.cdp;

import org.netpreserve.printroo.util.Url;

/**
 * The browser reported an error loading the page, e.g. {@code net::ERR_NAME_NOT_RESOLVED}.
 */
public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(Url url, String errorText) {
        super(url, errorText);
        this.errorText = errorText;
    }

    public String errorText() {
        return errorText;
    }
}
