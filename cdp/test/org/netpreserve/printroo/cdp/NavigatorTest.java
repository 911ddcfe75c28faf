package org.netpreserve.printroo.cdp;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.printroo.util.CountdownTimer;
import org.netpreserve.printroo.util.Url;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class NavigatorTest {
    private static final Map<String, String> PAGES = Map.of(
            "/", "<html><body><h1>Hello</h1><img src=/allowed.png><img src=/blocked.png></body></html>",
            "/status", "<html><body><script>setTimeout(() => window.status = 'ready', 300)</script></body></html>",
            "/allowed.png", "",
            "/blocked.png", "");
    private static HttpServer httpServer;
    private static BrowserProcess browser;
    private static final List<String> requests = new CopyOnWriteArrayList<>();
    private Navigator navigator;

    @BeforeAll
    static void startBrowser() throws IOException {
        var executable = BrowserProcess.findExecutable();
        assumeTrue(executable.isPresent(), "no browser installed");

        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            requests.add(path);
            String body = PAGES.get(path);
            if (body == null) {
                exchange.sendResponseHeaders(404, -1);
            } else {
                byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().add("Content-Type", path.endsWith(".png") ? "image/png" : "text/html");
                exchange.sendResponseHeaders(200, bytes.length == 0 ? -1 : bytes.length);
                exchange.getResponseBody().write(bytes);
            }
            exchange.close();
        });
        httpServer.start();

        var arguments = new ChromeArguments();
        arguments.add("--no-sandbox");
        browser = BrowserProcess.start(executable.get(), arguments);
    }

    @AfterAll
    static void stopBrowser() {
        if (browser != null) browser.close();
        if (httpServer != null) httpServer.stop(0);
    }

    @BeforeEach
    void openWindow() {
        requests.clear();
        navigator = browser.newWindow();
    }

    @AfterEach
    void closeWindow() {
        navigator.close();
    }

    private Url url(String path) {
        return new Url("http://127.0.0.1:" + httpServer.getAddress().getPort() + path);
    }

    @Test
    void setDocumentContent() {
        navigator.setDocumentContent("<html><body><p id=x>inline</p></body></html>");
        assertEquals("inline", navigator.eval("document.getElementById('x').textContent"));
        assertTrue(requests.isEmpty());
    }

    @Test
    void navigateAndRender() throws Exception {
        navigator.navigateTo(url("/"), null);
        assertEquals("Hello", navigator.eval("document.querySelector('h1').textContent"));

        byte[] pdf = navigator.printToPdf(PrintOptions.defaults());
        assertEquals("%PDF", new String(pdf, 0, 4, StandardCharsets.US_ASCII));

        byte[] png = navigator.captureScreenshot();
        assertEquals("PNG", new String(png, 1, 3, StandardCharsets.US_ASCII));

        String mhtml = new String(navigator.captureSnapshot(), StandardCharsets.UTF_8);
        assertTrue(mhtml.contains("MIME-Version"), mhtml);
    }

    @Test
    void blacklistedResourcesAreNotFetched() throws Exception {
        navigator.networkManager().block(new UrlBlacklist(List.of("*/blocked.png")), Set.of());
        navigator.navigateTo(url("/"), null);
        assertTrue(requests.contains("/allowed.png"), requests.toString());
        assertFalse(requests.contains("/blocked.png"), requests.toString());
    }

    @Test
    void safeUrlsBypassTheBlacklist() throws Exception {
        var page = url("/");
        navigator.networkManager().block(new UrlBlacklist(List.of("http://127.0.0.1*")), Set.of(page));
        navigator.navigateTo(page, null);
        assertTrue(requests.contains("/"));
        assertFalse(requests.contains("/allowed.png"), requests.toString());
    }

    @Test
    void navigationErrorsAreReported() {
        var e = assertThrows(NavigationFailedException.class,
                () -> navigator.navigateTo(new Url("http://127.0.0.1:1/"), null));
        assertTrue(e.getMessage().contains("net::ERR"), e.getMessage());
    }

    @Test
    void waitsForWindowStatusWithCountdownPaused() throws Exception {
        var countdown = CountdownTimer.started(Duration.ofSeconds(30));
        navigator.setCountdown(countdown);
        navigator.navigateTo(url("/status"), null);
        assertTrue(navigator.waitForWindowStatus("ready", Duration.ofSeconds(10), countdown));
        assertEquals(CountdownTimer.State.RUNNING, countdown.state());
        assertFalse(navigator.waitForWindowStatus("never", Duration.ofMillis(300), countdown));
    }

    @Test
    void scriptErrorsAreNotFatal() {
        navigator.setDocumentContent("<html><body></body></html>");
        navigator.runJavascript("throw new Error('boom')");
        navigator.runJavascript("document.body.dataset.done = 'yes'");
        assertEquals("yes", navigator.eval("document.body.dataset.done"));
    }
}
