package org.netpreserve.printroo.cdp.protocol;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Makes a domain method return one field of the command's result instead of the whole result object, e.g. the
 * base64 {@code data} of {@code Page.printToPDF} decoded straight into a {@code byte[]}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Unwrap {
    /**
     * Result field to return. Defaults to the return type's simple name with a lowercase first letter.
     */
    String value() default "";
}
