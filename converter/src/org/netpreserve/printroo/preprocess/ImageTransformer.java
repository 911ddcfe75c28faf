package org.netpreserve.printroo.preprocess;

import org.netpreserve.printroo.ImageOptions;
import org.netpreserve.printroo.PageSettings;
import org.netpreserve.printroo.cdp.UrlBlacklist;
import org.netpreserve.printroo.util.Url;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Resizes and rotates the images of a page so that they fit on the printed page.
 */
@FunctionalInterface
public interface ImageTransformer {
    /**
     * @param blacklist images the transformer must not download
     * @return the rewritten page, or the input if no image needed changing
     */
    Url transformImages(Url input, Path tempDirectory, ImageOptions options, PageSettings pageSettings,
                        UrlBlacklist blacklist) throws IOException;
}
