package org.netpreserve.printroo.cdp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.intellij.lang.annotations.Language;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.printroo.cdp.domains.Page;
import org.netpreserve.printroo.cdp.domains.Runtime;
import org.netpreserve.printroo.cdp.protocol.CDPSession;
import org.netpreserve.printroo.cdp.protocol.CDPTimeoutException;
import org.netpreserve.printroo.cdp.protocol.RPC;
import org.netpreserve.printroo.util.CountdownTimer;
import org.netpreserve.printroo.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Drives a single page: loads content into it and renders it.
 */
public class Navigator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Navigator.class);
    static final Duration WINDOW_STATUS_POLL_INTERVAL = Duration.ofMillis(100);
    private final CDPSession cdpSession;
    private final Page page;
    private final Runtime runtime;
    private final NetworkManager networkManager;
    private volatile Duration pageLoadTimeout = Duration.ofSeconds(120);

    public Navigator(CDPSession cdpSession) {
        this.cdpSession = cdpSession;
        this.page = cdpSession.domain(Page.class);
        this.runtime = cdpSession.domain(Runtime.class);
        this.networkManager = new NetworkManager(cdpSession);

        runtime.onConsoleAPICalled(event -> log.debug("Console: {} {}", event.type(), event.args()));
        page.enable();
        runtime.enable();
    }

    /**
     * Bounds every following call on this page by the countdown.
     */
    public void setCountdown(@Nullable CountdownTimer countdown) {
        cdpSession.setCountdown(countdown);
    }

    public void setPageLoadTimeout(Duration pageLoadTimeout) {
        this.pageLoadTimeout = Objects.requireNonNull(pageLoadTimeout);
    }

    public NetworkManager networkManager() {
        return networkManager;
    }

    /**
     * Replaces the document of the main frame with the given markup without navigating.
     */
    public void setDocumentContent(String html) {
        var frameTree = page.getFrameTree();
        page.setDocumentContent(frameTree.frame().id(), html);
    }

    /**
     * Navigates to the URL and waits for the load event.
     *
     * @param mediaLoadTimeout if set, how long to wait for the page's media to load before stopping the page and
     *                         carrying on with whatever has loaded. If null the full page load timeout applies and
     *                         exceeding it is an error.
     * @throws NavigationFailedException   if the browser reports an error loading the page
     * @throws NavigationTimedOutException if the page didn't load in time
     * @throws CDPTimeoutException         if the countdown ran out
     */
    public void navigateTo(Url url, @Nullable Duration mediaLoadTimeout) throws NavigationException {
        var countdown = cdpSession.countdown();
        var loadEvent = cdpSession.subscribe(Page.LoadEventFired.class, event -> true);
        try {
            Page.Navigate result;
            try {
                result = page.navigate(url.toString());
            } catch (CDPTimeoutException e) {
                if (countdown != null && countdown.isExpired()) throw e;
                throw new NavigationTimedOutException(url, "Timed out waiting for Page.navigate", e);
            }
            if (result.errorText() != null) {
                throw new NavigationFailedException(url, result.errorText());
            }

            if (mediaLoadTimeout != null) {
                try {
                    loadEvent.await(mediaLoadTimeout, countdown);
                } catch (CDPTimeoutException e) {
                    if (countdown != null && countdown.isExpired()) throw e;
                    log.info("Media load timeout of {} ms exceeded for {}, stopping the page",
                            mediaLoadTimeout.toMillis(), url);
                    page.stopLoading();
                }
            } else {
                try {
                    loadEvent.await(pageLoadTimeout, countdown);
                } catch (CDPTimeoutException e) {
                    if (countdown != null && countdown.isExpired()) throw e;
                    throw new NavigationTimedOutException(url, "Timed out waiting for load event", e);
                }
            }
        } finally {
            loadEvent.cancel();
        }
    }

    /**
     * Polls {@code window.status} until it equals the expected value. The countdown is paused while waiting, and
     * each poll is bounded by the time left until the timeout.
     *
     * @return true if the status was seen before the timeout
     */
    public boolean waitForWindowStatus(String status, Duration timeout, @Nullable CountdownTimer countdown) {
        if (countdown != null) countdown.stop();
        try {
            long deadline = System.nanoTime() + timeout.toNanos();
            while (true) {
                long left = deadline - System.nanoTime();
                Object value;
                try {
                    value = windowStatus(Duration.ofNanos(Math.max(left, TimeUnit.MILLISECONDS.toNanos(1))));
                } catch (CDPTimeoutException e) {
                    log.debug("Reading window.status timed out");
                    return false;
                }
                if (status.equals(value)) {
                    return true;
                }
                if (System.nanoTime() - deadline >= 0) {
                    return false;
                }
                try {
                    Thread.sleep(WINDOW_STATUS_POLL_INTERVAL.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        } finally {
            if (countdown != null) countdown.start();
        }
    }

    private Object windowStatus(Duration timeout) {
        JsonNode reply = cdpSession.sendCommand("Runtime.evaluate",
                Map.<String, Object>of("expression", "window.status", "returnByValue", true), timeout, null);
        Runtime.Evaluate evaluate;
        try {
            evaluate = RPC.JSON.treeToValue(reply, Runtime.Evaluate.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        if (evaluate == null || evaluate.result() == null) return null;
        if (evaluate.exceptionDetails() != null) {
            throw new RuntimeException(evaluate.exceptionDetails().toString());
        }
        return evaluate.result().toJavaObject();
    }

    /**
     * Runs a script in the page, waiting for it if it returns a promise. The result is discarded and script errors
     * are only logged.
     */
    public void runJavascript(@Language("JavaScript") String script) {
        var evaluate = runtime.evaluate(script, null, true, true);
        if (evaluate.exceptionDetails() != null) {
            log.atWarn().addKeyValue("text", evaluate.exceptionDetails().text())
                    .addKeyValue("line", evaluate.exceptionDetails().lineNumber())
                    .log("Script threw an exception");
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T eval(@Language("JavaScript") String script) {
        var evaluate = runtime.evaluate(script, null, true, false);
        if (evaluate.exceptionDetails() != null) {
            throw new RuntimeException(evaluate.exceptionDetails().toString());
        }
        return (T) evaluate.result().toJavaObject();
    }

    /**
     * Captures the page and its resources as MHTML.
     */
    public byte[] captureSnapshot() {
        return page.captureSnapshot("mhtml").getBytes(UTF_8);
    }

    public byte[] printToPdf(PrintOptions options) {
        return page.printToPDF(options.landscape(), options.displayHeaderFooter(), options.printBackground(),
                options.scale(), options.paperWidth(), options.paperHeight(), options.marginTop(),
                options.marginBottom(), options.marginLeft(), options.marginRight(),
                options.pageRanges(), options.headerTemplate(), options.footerTemplate(),
                options.preferCSSPageSize());
    }

    /**
     * Captures the visible viewport as PNG.
     */
    public byte[] captureScreenshot() {
        return page.captureScreenshot("png", null);
    }

    /**
     * Closes the page target.
     */
    @Override
    public void close() {
        cdpSession.close();
    }
}
