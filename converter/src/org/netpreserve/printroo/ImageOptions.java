package org.netpreserve.printroo;

import java.time.Duration;

/**
 * What the image preprocessor should do with the images of a page.
 *
 * @param resize    shrink images wider than the printable page width
 * @param rotate    rotate images according to their EXIF orientation
 * @param loadTimeout how long to wait for a single image to download
 */
public record ImageOptions(boolean resize, boolean rotate, Duration loadTimeout) {
}
