package org.netpreserve.printroo.preprocess;

import org.netpreserve.printroo.util.Url;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Removes unsafe markup such as scripts from a page before it is rendered.
 */
@FunctionalInterface
public interface Sanitizer {
    /**
     * @param tempDirectory where to write the sanitized copy
     * @return the page to render instead, or the input itself if nothing needed changing
     */
    Url sanitize(Url input, Path tempDirectory) throws IOException;
}
