package org.netpreserve.printroo.cdp.protocol;

/**
 * The connection to the browser closed while a command or event wait was outstanding.
 */
public class CDPClosedException extends CDPException {
    public CDPClosedException() {
        super(-1, "Connection to browser closed");
    }
}
