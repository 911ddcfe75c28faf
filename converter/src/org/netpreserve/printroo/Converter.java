package org.netpreserve.printroo;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.printroo.cdp.*;
import org.netpreserve.printroo.preprocess.ContentFitTransformer;
import org.netpreserve.printroo.preprocess.ImageTransformer;
import org.netpreserve.printroo.preprocess.PreWrapper;
import org.netpreserve.printroo.preprocess.Sanitizer;
import org.netpreserve.printroo.util.CountdownTimer;
import org.netpreserve.printroo.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Converts web pages and HTML to PDF or PNG with a headless browser.
 * <p>
 * The browser is started by the first conversion and reused by the following ones until {@link #close()}.
 * Conversions on one converter run one at a time.
 */
public class Converter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Converter.class);
    static final Set<String> RENDERABLE_EXTENSIONS = Set.of(".htm", ".html", ".mht", ".mhtml", ".svg", ".xml");
    public static final String MDC_INSTANCE = "instance";
    private final BrowserSupervisor supervisor;
    private final PreWrapper preWrapper = new PreWrapper();
    private Sanitizer sanitizer;
    private ContentFitTransformer contentFitTransformer;
    private ImageTransformer imageTransformer;
    private OutputStream snapshotStream;
    private Charset preWrapCharset = UTF_8;
    private String instanceId;
    private boolean useCache;
    private ConversionState state = ConversionState.INIT;

    public Converter() {
        this(new ChromeArguments());
    }

    public Converter(ChromeArguments arguments) {
        this(new BrowserSupervisor(arguments));
    }

    public Converter(BrowserSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    public void convertToPdf(Url input, OutputStream output, PageSettings pageSettings, ConversionOptions options) {
        convert(OutputFormat.PDF, input, null, output, pageSettings, options);
    }

    public void convertToPdf(String html, OutputStream output, PageSettings pageSettings, ConversionOptions options) {
        convert(OutputFormat.PDF, null, html, output, pageSettings, options);
    }

    /**
     * Converts to a PDF file. The file is only written once the conversion has succeeded.
     *
     * @throws ConfigurationException if the output directory doesn't exist
     */
    public void convertToPdf(Url input, Path output, PageSettings pageSettings, ConversionOptions options) {
        convertToFile(OutputFormat.PDF, input, null, output, pageSettings, options);
    }

    public void convertToPdf(String html, Path output, PageSettings pageSettings, ConversionOptions options) {
        convertToFile(OutputFormat.PDF, null, html, output, pageSettings, options);
    }

    public void convertToImage(Url input, OutputStream output, PageSettings pageSettings, ConversionOptions options) {
        convert(OutputFormat.IMAGE, input, null, output, pageSettings, options);
    }

    public void convertToImage(String html, OutputStream output, PageSettings pageSettings,
                               ConversionOptions options) {
        convert(OutputFormat.IMAGE, null, html, output, pageSettings, options);
    }

    public void convertToImage(Url input, Path output, PageSettings pageSettings, ConversionOptions options) {
        convertToFile(OutputFormat.IMAGE, input, null, output, pageSettings, options);
    }

    public void convertToImage(String html, Path output, PageSettings pageSettings, ConversionOptions options) {
        convertToFile(OutputFormat.IMAGE, null, html, output, pageSettings, options);
    }

    private synchronized void convertToFile(OutputFormat format, @Nullable Url input, @Nullable String html,
                                            Path output, PageSettings pageSettings, ConversionOptions options) {
        Path directory = output.toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            throw new ConfigurationException("The output folder '" + directory + "' does not exist");
        }
        var buffer = new ByteArrayOutputStream();
        ByteArrayOutputStream snapshotBuffer = null;
        OutputStream previousSnapshotStream = snapshotStream;
        if (options.captureSnapshot() && snapshotStream == null) {
            snapshotBuffer = new ByteArrayOutputStream();
            snapshotStream = snapshotBuffer;
        }
        try {
            convert(format, input, html, buffer, pageSettings, options);
        } finally {
            snapshotStream = previousSnapshotStream;
        }
        try {
            Files.write(output, buffer.toByteArray());
            if (snapshotBuffer != null) {
                Path snapshotFile = snapshotPath(output);
                Files.write(snapshotFile, snapshotBuffer.toByteArray());
                log.info("Page snapshot written to output file '{}'", snapshotFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + output, e);
        }
    }

    static Path snapshotPath(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        return output.resolveSibling(name + ".mhtml");
    }

    private synchronized void convert(OutputFormat format, @Nullable Url input, @Nullable String html,
                                      OutputStream output, PageSettings pageSettings, ConversionOptions options) {
        if (instanceId != null) MDC.put(MDC_INSTANCE, instanceId);
        try {
            enter(ConversionState.INIT);
            if (options.timeout() != null && (options.timeout().isZero() || options.timeout().isNegative())) {
                throw new ConfigurationException("The conversion timeout has to be greater than zero: "
                                                 + options.timeout().toMillis() + " milliseconds");
            }
            if (input != null) validateInput(input, options);
            new Conversion(format, pageSettings, options).run(input, html, output);
        } catch (RuntimeException e) {
            enter(ConversionState.FAILED);
            throw e;
        } finally {
            if (instanceId != null) MDC.remove(MDC_INSTANCE);
        }
    }

    private void validateInput(Url input, ConversionOptions options) {
        if (!input.isFile()) return;
        Path file;
        try {
            file = input.toPath();
        } catch (IllegalStateException e) {
            throw new ConversionException(e.getMessage(), e);
        }
        if (!Files.exists(file)) {
            throw new ConversionException("The file '" + file + "' does not exist");
        }
        String extension = input.extension();
        if (!RENDERABLE_EXTENSIONS.contains(extension) && !isPreWrapExtension(extension, options)) {
            throw new ConversionException("The file '" + file + "' with extension '" + extension + "' is not valid. " +
                                          "If this is a text based file then add the extension to the preWrapExtensions");
        }
    }

    private static boolean isPreWrapExtension(String extension, ConversionOptions options) {
        if (extension.isEmpty()) return false;
        for (String preWrapExtension : options.preWrapExtensions()) {
            if (preWrapExtension.equalsIgnoreCase(extension)) return true;
        }
        return false;
    }

    private void enter(ConversionState state) {
        log.debug("Conversion state {} -> {}", this.state, state);
        this.state = state;
    }

    /**
     * State of the last or current conversion.
     */
    public synchronized ConversionState state() {
        return state;
    }

    /**
     * One run through the pipeline and the resources it holds until cleanup.
     */
    private class Conversion {
        private final OutputFormat format;
        private final PageSettings pageSettings;
        private final ConversionOptions options;
        private final Set<Url> safeUrls = new HashSet<>();
        private final UrlBlacklist blacklist;
        private CountdownTimer countdown;
        private Path tempDirectory;
        private BrowserProcess browser;
        private Navigator navigator;

        Conversion(OutputFormat format, PageSettings pageSettings, ConversionOptions options) {
            this.format = format;
            this.pageSettings = pageSettings;
            this.options = options;
            this.blacklist = new UrlBlacklist(options.urlBlacklist());
        }

        void run(@Nullable Url input, @Nullable String html, OutputStream output) {
            try {
                if (input != null) {
                    input = preProcess(input);
                }

                if (options.timeout() != null) {
                    log.info("Conversion timeout set to {} milliseconds", options.timeout().toMillis());
                    countdown = CountdownTimer.started(options.timeout());
                }

                enter(ConversionState.ENSURE_PROCESS_RUNNING);
                browser = supervisor.ensureRunning(countdown);
                browser.setCountdown(countdown);
                navigator = browser.newWindow();
                navigator.setCountdown(countdown);
                var networkManager = navigator.networkManager();
                networkManager.setCacheDisabled(!useCache);
                networkManager.logTraffic(options.logNetworkTraffic());
                networkManager.block(blacklist, safeUrls);

                enter(ConversionState.NAVIGATE);
                if (input != null) {
                    log.info("Loading {}", input.isFile() ? "file " + input.toPath() : "url " + input);
                    navigator.navigateTo(input, options.mediaLoadTimeout());
                } else {
                    navigator.setDocumentContent(html);
                }

                if (options.windowStatus() != null && !options.windowStatus().isBlank()) {
                    enter(ConversionState.WAIT_WINDOW_STATUS);
                    log.info("Waiting for window.status '{}' or a timeout of {} milliseconds",
                            options.windowStatus(), options.windowStatusTimeout().toMillis());
                    boolean matched = navigator.waitForWindowStatus(options.windowStatus(),
                            options.windowStatusTimeout(), countdown);
                    if (matched) {
                        log.info("Window status equaled {}", options.windowStatus());
                    } else {
                        log.info("Waiting for window status timed out");
                    }
                }

                if (options.runJavascript() != null && !options.runJavascript().isBlank()) {
                    enter(ConversionState.RUN_SCRIPT);
                    log.debug("Running javascript: {}", options.runJavascript());
                    navigator.runJavascript(options.runJavascript());
                }

                if (options.captureSnapshot()) {
                    enter(ConversionState.CAPTURE_SNAPSHOT);
                    if (snapshotStream == null) {
                        throw new ConversionException("Snapshot capture was requested but there is no snapshot stream set");
                    }
                    log.info("Taking snapshot of the page");
                    snapshotStream.write(navigator.captureSnapshot());
                }

                enter(ConversionState.RENDER);
                byte[] result;
                if (format == OutputFormat.PDF) {
                    log.info("Converting to PDF");
                    result = navigator.printToPdf(pageSettings.toPrintOptions());
                } else {
                    log.info("Converting to image");
                    result = navigator.captureScreenshot();
                }
                output.write(result);
                log.info("Converted");
            } catch (NavigationException e) {
                throw timeoutOr(new ConversionException(e.getMessage(), e));
            } catch (IOException e) {
                throw timeoutOr(new ConversionException("Conversion failed: " + e.getMessage(), e));
            } catch (ConversionTimeoutException e) {
                throw e;
            } catch (RuntimeException e) {
                throw timeoutOr(e);
            } finally {
                cleanup();
            }
            enter(ConversionState.DONE);
        }

        /**
         * Rethrows the failure as a timeout if the countdown has run out, since the failure is then most likely a
         * consequence of it.
         */
        private RuntimeException timeoutOr(RuntimeException e) {
            if (countdown != null && countdown.isExpired()) {
                return new ConversionTimeoutException("The conversion timeout of " + countdown.budget().toMillis() +
                                                      " milliseconds exceeded", e);
            }
            return e;
        }

        private Url preProcess(Url input) throws IOException {
            enter(ConversionState.PRE_PROCESS);
            if (input.isFile() && isPreWrapExtension(input.extension(), options)) {
                Path wrapped = preWrapper.wrapFile(input.toPath(), preWrapCharset, tempDirectory());
                input = Url.of(wrapped);
                allow(input);
            }
            if (options.sanitizeHtml()) {
                if (sanitizer == null) {
                    throw new ConfigurationException("sanitizeHtml is enabled but no sanitizer was set");
                }
                input = sanitizer.sanitize(input, tempDirectory());
                allow(input);
            }
            if (pageSettings.paperFormat() == PaperFormat.FIT_PAGE_TO_CONTENT) {
                if (contentFitTransformer == null) {
                    throw new ConfigurationException("Paper format FIT_PAGE_TO_CONTENT requires a content fit transformer");
                }
                log.info("The paper format FIT_PAGE_TO_CONTENT is set, modifying html so that the PDF fits the content");
                input = contentFitTransformer.fitPageToContent(input, tempDirectory());
                allow(input);
            }
            if (options.imageResize() || options.imageRotate()) {
                if (imageTransformer == null) {
                    throw new ConfigurationException("imageResize or imageRotate is enabled but no image transformer was set");
                }
                input = imageTransformer.transformImages(input, tempDirectory(), options.imageOptions(), pageSettings,
                        blacklist);
                allow(input);
            }
            return input;
        }

        private void allow(Url url) {
            log.debug("Adding url '{}' to the safe url list", url);
            safeUrls.add(url);
        }

        private Path tempDirectory() throws IOException {
            if (tempDirectory == null) {
                if (options.tempDirectory() != null) {
                    Files.createDirectories(options.tempDirectory());
                    tempDirectory = Files.createTempDirectory(options.tempDirectory(), "printroo");
                } else {
                    tempDirectory = Files.createTempDirectory("printroo");
                }
                log.debug("Created temporary folder '{}'", tempDirectory);
            }
            return tempDirectory;
        }

        private void cleanup() {
            enter(ConversionState.CLEANUP);
            if (browser != null) {
                try {
                    browser.setCountdown(null);
                } catch (RuntimeException e) {
                    log.warn("Error resetting browser countdown", e);
                }
            }
            if (navigator != null) {
                try {
                    navigator.close();
                } catch (RuntimeException e) {
                    log.warn("Error closing page", e);
                }
            }
            if (tempDirectory != null && !options.keepTempDirectory()) {
                log.debug("Deleting temporary folder '{}'", tempDirectory);
                try {
                    deleteRecursively(tempDirectory);
                } catch (IOException | UncheckedIOException e) {
                    log.warn("Error deleting temporary folder '{}'", tempDirectory, e);
                }
            }
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) return;
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }

    public void setSanitizer(@Nullable Sanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public void setContentFitTransformer(@Nullable ContentFitTransformer contentFitTransformer) {
        this.contentFitTransformer = contentFitTransformer;
    }

    public void setImageTransformer(@Nullable ImageTransformer imageTransformer) {
        this.imageTransformer = imageTransformer;
    }

    /**
     * Where MHTML snapshots go when {@link ConversionOptions#captureSnapshot()} is set. Conversions to a file write
     * the snapshot next to the output file when this is null.
     */
    public synchronized void setSnapshotStream(@Nullable OutputStream snapshotStream) {
        this.snapshotStream = snapshotStream;
    }

    /**
     * Encoding of the plain-text files that get pre-wrapped.
     */
    public void setPreWrapCharset(Charset preWrapCharset) {
        this.preWrapCharset = Objects.requireNonNull(preWrapCharset);
    }

    /**
     * Identifies this converter in log lines through the {@value #MDC_INSTANCE} MDC key.
     */
    public void setInstanceId(@Nullable String instanceId) {
        this.instanceId = instanceId;
    }

    public String instanceId() {
        return instanceId;
    }

    public void addChromeArgument(String argument) {
        supervisor.modifyArguments(arguments -> arguments.add(argument));
    }

    public void addChromeArgument(String argument, String value) {
        supervisor.modifyArguments(arguments -> arguments.add(argument, value));
    }

    public void removeChromeArgument(String argument) {
        supervisor.modifyArguments(arguments -> arguments.remove(argument));
    }

    public void resetChromeArguments() {
        supervisor.modifyArguments(ChromeArguments::reset);
    }

    public List<String> chromeArguments() {
        return supervisor.arguments();
    }

    public void setWindowSize(WindowSize windowSize) {
        supervisor.modifyArguments(arguments -> arguments.setWindowSize(windowSize));
    }

    public void setWindowSize(int width, int height) {
        supervisor.modifyArguments(arguments -> arguments.setWindowSize(width, height));
    }

    public void setProxyServer(String proxyServer) {
        supervisor.modifyArguments(arguments -> arguments.setProxyServer(proxyServer));
    }

    public void setProxyBypassList(String bypassList) {
        supervisor.modifyArguments(arguments -> arguments.setProxyBypassList(bypassList));
    }

    public void setProxyPacUrl(String pacUrl) {
        supervisor.modifyArguments(arguments -> arguments.setProxyPacUrl(pacUrl));
    }

    public void setUserAgent(String userAgent) {
        supervisor.modifyArguments(arguments -> arguments.setUserAgent(userAgent));
    }

    public void setUserProfile(Path directory) {
        supervisor.modifyArguments(arguments -> arguments.setUserProfile(directory));
    }

    /**
     * Lets the browser cache to disk. Two converters running at the same time must not share a cache directory.
     *
     * @param sizeMegabytes maximum cache size, or null to let the browser decide
     */
    public void setDiskCache(Path directory, @Nullable Long sizeMegabytes) {
        supervisor.modifyArguments(arguments -> arguments.setDiskCache(directory, sizeMegabytes));
        useCache = true;
    }

    public void setUser(String userName, @Nullable String password) {
        supervisor.setUser(userName, password);
    }

    public void setExecutable(@Nullable String executable) {
        supervisor.setExecutable(executable);
    }

    public void setStartupTimeout(@Nullable Duration startupTimeout) {
        supervisor.setStartupTimeout(startupTimeout);
    }

    /**
     * Stops the browser.
     */
    @Override
    public synchronized void close() {
        supervisor.close();
    }
}
