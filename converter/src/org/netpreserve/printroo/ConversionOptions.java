package org.netpreserve.printroo;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.printroo.util.DurationDeserializer;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * How a single conversion is carried out.
 *
 * @param timeout             overall budget for the conversion, null for none. Time spent waiting for the window
 *                            status is not counted.
 * @param mediaLoadTimeout    if set, stop loading the page after this long and render what has loaded so far
 * @param windowStatus        wait until JavaScript sets {@code window.status} to this value before rendering
 * @param windowStatusTimeout how long to wait for the window status
 * @param runJavascript       script to run in the page after it has loaded
 * @param logNetworkTraffic   log every request and response the page makes
 * @param urlBlacklist        {@code *} wildcard patterns of URLs the page may not load
 * @param preWrapExtensions   file extensions (e.g. {@code .txt}) of plain-text files that get wrapped in
 *                            {@code <pre>} before rendering
 * @param sanitizeHtml        run the page through the sanitizer first
 * @param imageResize         shrink images to fit the page width
 * @param imageRotate         rotate images according to their EXIF orientation
 * @param imageLoadTimeout    how long the image preprocessor waits for each image
 * @param captureSnapshot     also save an MHTML snapshot of the loaded page
 * @param tempDirectory       where working files are written, null for the system default
 * @param keepTempDirectory   don't delete working files afterwards, for debugging
 */
public record ConversionOptions(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration mediaLoadTimeout,
        String windowStatus,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration windowStatusTimeout,
        String runJavascript,
        boolean logNetworkTraffic,
        List<String> urlBlacklist,
        List<String> preWrapExtensions,
        boolean sanitizeHtml,
        boolean imageResize,
        boolean imageRotate,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration imageLoadTimeout,
        boolean captureSnapshot,
        Path tempDirectory,
        boolean keepTempDirectory) {
    public static final Duration DEFAULT_WINDOW_STATUS_TIMEOUT = Duration.ofMillis(60000);
    public static final Duration DEFAULT_IMAGE_LOAD_TIMEOUT = Duration.ofMillis(30000);

    public ConversionOptions {
        if (windowStatusTimeout == null) windowStatusTimeout = DEFAULT_WINDOW_STATUS_TIMEOUT;
        if (imageLoadTimeout == null) imageLoadTimeout = DEFAULT_IMAGE_LOAD_TIMEOUT;
        urlBlacklist = urlBlacklist == null ? List.of() : List.copyOf(urlBlacklist);
        preWrapExtensions = preWrapExtensions == null ? List.of() : List.copyOf(preWrapExtensions);
    }

    public static ConversionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public ImageOptions imageOptions() {
        return new ImageOptions(imageResize, imageRotate, imageLoadTimeout);
    }

    public static class Builder {
        private Duration timeout;
        private Duration mediaLoadTimeout;
        private String windowStatus;
        private Duration windowStatusTimeout;
        private String runJavascript;
        private boolean logNetworkTraffic;
        private List<String> urlBlacklist;
        private List<String> preWrapExtensions;
        private boolean sanitizeHtml;
        private boolean imageResize;
        private boolean imageRotate;
        private Duration imageLoadTimeout;
        private boolean captureSnapshot;
        private Path tempDirectory;
        private boolean keepTempDirectory;

        private Builder() {
        }

        private Builder(ConversionOptions options) {
            timeout = options.timeout;
            mediaLoadTimeout = options.mediaLoadTimeout;
            windowStatus = options.windowStatus;
            windowStatusTimeout = options.windowStatusTimeout;
            runJavascript = options.runJavascript;
            logNetworkTraffic = options.logNetworkTraffic;
            urlBlacklist = options.urlBlacklist;
            preWrapExtensions = options.preWrapExtensions;
            sanitizeHtml = options.sanitizeHtml;
            imageResize = options.imageResize;
            imageRotate = options.imageRotate;
            imageLoadTimeout = options.imageLoadTimeout;
            captureSnapshot = options.captureSnapshot;
            tempDirectory = options.tempDirectory;
            keepTempDirectory = options.keepTempDirectory;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder mediaLoadTimeout(Duration mediaLoadTimeout) {
            this.mediaLoadTimeout = mediaLoadTimeout;
            return this;
        }

        public Builder windowStatus(String windowStatus, Duration timeout) {
            this.windowStatus = windowStatus;
            this.windowStatusTimeout = timeout;
            return this;
        }

        public Builder runJavascript(String runJavascript) {
            this.runJavascript = runJavascript;
            return this;
        }

        public Builder logNetworkTraffic(boolean logNetworkTraffic) {
            this.logNetworkTraffic = logNetworkTraffic;
            return this;
        }

        public Builder urlBlacklist(List<String> urlBlacklist) {
            this.urlBlacklist = urlBlacklist;
            return this;
        }

        public Builder preWrapExtensions(List<String> preWrapExtensions) {
            this.preWrapExtensions = preWrapExtensions;
            return this;
        }

        public Builder sanitizeHtml(boolean sanitizeHtml) {
            this.sanitizeHtml = sanitizeHtml;
            return this;
        }

        public Builder imageResize(boolean imageResize) {
            this.imageResize = imageResize;
            return this;
        }

        public Builder imageRotate(boolean imageRotate) {
            this.imageRotate = imageRotate;
            return this;
        }

        public Builder imageLoadTimeout(Duration imageLoadTimeout) {
            this.imageLoadTimeout = imageLoadTimeout;
            return this;
        }

        public Builder captureSnapshot(boolean captureSnapshot) {
            this.captureSnapshot = captureSnapshot;
            return this;
        }

        public Builder tempDirectory(Path tempDirectory) {
            this.tempDirectory = tempDirectory;
            return this;
        }

        public Builder keepTempDirectory(boolean keepTempDirectory) {
            this.keepTempDirectory = keepTempDirectory;
            return this;
        }

        public ConversionOptions build() {
            return new ConversionOptions(timeout, mediaLoadTimeout, windowStatus, windowStatusTimeout, runJavascript,
                    logNetworkTraffic, urlBlacklist, preWrapExtensions, sanitizeHtml, imageResize, imageRotate,
                    imageLoadTimeout, captureSnapshot, tempDirectory, keepTempDirectory);
        }
    }
}
