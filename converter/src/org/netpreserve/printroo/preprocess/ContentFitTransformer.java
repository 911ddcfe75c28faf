package org.netpreserve.printroo.preprocess;

import org.netpreserve.printroo.util.Url;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Rewrites a page so that the printed page size matches the size of its content.
 */
@FunctionalInterface
public interface ContentFitTransformer {
    Url fitPageToContent(Url input, Path tempDirectory) throws IOException;
}
