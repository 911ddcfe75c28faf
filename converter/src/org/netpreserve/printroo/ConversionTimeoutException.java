package org.netpreserve.printroo;

/**
 * The conversion timeout ran out. The cause is the wait that was cut short.
 */
public class ConversionTimeoutException extends ConversionException {
    public ConversionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
