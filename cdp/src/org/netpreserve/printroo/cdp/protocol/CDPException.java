package org.netpreserve.printroo.cdp.protocol;

/**
 * An error reply from the browser, or a failure of the protocol connection itself.
 * <p>
 * Created on the dispatcher thread without a stack trace; {@link #actuallyFillInStackTrace()} is called when the
 * exception is rethrown on the thread that sent the command.
 */
public class CDPException extends RuntimeException {
    private final int code;

    public CDPException(int code, String message) {
        super(message + " [" + code + "]");
        this.code = code;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    public void actuallyFillInStackTrace() {
        super.fillInStackTrace();
    }

    public int getCode() {
        return code;
    }
}
