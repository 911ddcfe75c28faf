package org.netpreserve.printroo.cdp;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.printroo.cdp.domains.Fetch;
import org.netpreserve.printroo.util.Url;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NetworkManagerTest {
    private final RecordingCDP cdp = new RecordingCDP();
    private final NetworkManager networkManager = new NetworkManager(cdp);

    @AfterEach
    void tearDown() {
        cdp.shutdown();
    }

    @Test
    void emptyBlacklistLeavesInterceptionOff() {
        networkManager.block(UrlBlacklist.empty(), Set.of());
        assertFalse(cdp.hasSent("Fetch.enable"));
    }

    @Test
    void interceptsAllRequestsAtRequestStage() throws Exception {
        networkManager.block(new UrlBlacklist(List.of("*.png")), Set.of());
        var enable = cdp.nextCommand("Fetch.enable");
        @SuppressWarnings("unchecked")
        var patterns = (List<Fetch.RequestPattern>) enable.params().get("patterns");
        assertEquals(List.of(new Fetch.RequestPattern("*", null, "Request")), patterns);

        networkManager.block(new UrlBlacklist(List.of("*.gif")), Set.of());
        networkManager.block(UrlBlacklist.empty(), Set.of());
        assertEquals("Fetch.disable", cdp.nextCommand().method());
    }

    @Test
    void blockedRequestsFail() throws Exception {
        networkManager.block(new UrlBlacklist(List.of("*.png")), Set.of());
        cdp.nextCommand("Fetch.enable");

        pause("R1", "http://example.org/logo.png");
        var command = cdp.nextCommand();
        assertEquals("Fetch.failRequest", command.method());
        assertEquals("R1", ((Fetch.RequestId) command.params().get("requestId")).value());
        assertEquals("BlockedByClient", command.params().get("errorReason"));
    }

    @Test
    void otherRequestsContinue() throws Exception {
        networkManager.block(new UrlBlacklist(List.of("*.png")), Set.of());
        cdp.nextCommand("Fetch.enable");

        pause("R2", "http://example.org/index.html");
        var command = cdp.nextCommand();
        assertEquals("Fetch.continueRequest", command.method());
        assertEquals("R2", ((Fetch.RequestId) command.params().get("requestId")).value());
    }

    @Test
    void safeUrlsAreAlwaysAllowed() throws Exception {
        var safe = new Url("file:///tmp/printroo/page.html");
        networkManager.block(new UrlBlacklist(List.of("file:*")), Set.of(safe));
        cdp.nextCommand("Fetch.enable");

        pause("R3", safe.toString());
        assertEquals("Fetch.continueRequest", cdp.nextCommand().method());
        pause("R4", "file:///etc/hosts");
        assertEquals("Fetch.failRequest", cdp.nextCommand().method());
    }

    @Test
    void cacheAndTrafficLoggingEnableNetworkOnce() throws Exception {
        networkManager.setCacheDisabled(true);
        networkManager.logTraffic(true);
        assertEquals("Network.enable", cdp.nextCommand().method());
        var setCache = cdp.nextCommand();
        assertEquals("Network.setCacheDisabled", setCache.method());
        assertEquals(true, setCache.params().get("cacheDisabled"));
        assertFalse(cdp.hasSent("Network.enable"));
    }

    private void pause(String requestId, String url) {
        cdp.receiveEvent("Fetch.requestPaused", Map.of(
                "requestId", requestId,
                "request", Map.of("url", url, "method", "GET"),
                "frameId", "F1",
                "resourceType", "Document"));
    }
}
