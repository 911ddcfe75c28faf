package org.netpreserve.printroo.cdp;

import org.netpreserve.printroo.cdp.domains.Fetch;
import org.netpreserve.printroo.cdp.domains.Network;
import org.netpreserve.printroo.cdp.protocol.CDPBase;
import org.netpreserve.printroo.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request filtering and traffic logging for one page.
 */
public class NetworkManager {
    private static final Logger log = LoggerFactory.getLogger(NetworkManager.class);
    private final Fetch fetch;
    private final Network network;
    private final Set<Url> safeUrls = ConcurrentHashMap.newKeySet();
    private volatile UrlBlacklist blacklist = UrlBlacklist.empty();
    private volatile boolean logTraffic;
    private boolean networkEnabled;
    private boolean fetchEnabled;

    public NetworkManager(CDPBase cdp) {
        this.fetch = cdp.domain(Fetch.class);
        this.network = cdp.domain(Network.class);
        fetch.onRequestPaused(this::handleRequestPaused);
        network.onRequestWillBeSent(this::handleRequestWillBeSent);
        network.onResponseReceived(this::handleResponseReceived);
        network.onLoadingFailed(this::handleLoadingFailed);
    }

    /**
     * Fails every request whose URL is matched by the blacklist, except for the given safe URLs which are always
     * allowed. Interception is only switched on when the blacklist has patterns.
     */
    public synchronized void block(UrlBlacklist blacklist, Set<Url> safeUrls) {
        this.safeUrls.clear();
        this.safeUrls.addAll(safeUrls);
        this.blacklist = blacklist;
        if (blacklist.isEmpty()) {
            if (fetchEnabled) {
                fetch.disable();
                fetchEnabled = false;
            }
            return;
        }
        if (!fetchEnabled) {
            fetch.enable(List.of(new Fetch.RequestPattern("*", null, "Request")));
            fetchEnabled = true;
        }
    }

    /**
     * Logs requests, responses and failures at info level. Purely observational.
     */
    public synchronized void logTraffic(boolean logTraffic) {
        this.logTraffic = logTraffic;
        if (logTraffic) enableNetwork();
    }

    public synchronized void setCacheDisabled(boolean cacheDisabled) {
        enableNetwork();
        network.setCacheDisabled(cacheDisabled);
    }

    private void enableNetwork() {
        if (networkEnabled) return;
        network.enable();
        networkEnabled = true;
    }

    private void handleRequestPaused(Fetch.RequestPaused event) {
        Url url = event.request().url();
        CompletionStage<Void> decision;
        if (blacklist.isBlocked(url, safeUrls)) {
            if (logTraffic) {
                log.atInfo().addKeyValue("url", url).log("Blocked request");
            } else {
                log.debug("Blocked request for {}", url);
            }
            decision = fetch.failRequestAsync(event.requestId(), "BlockedByClient");
        } else {
            decision = fetch.continueRequestAsync(event.requestId());
        }
        decision.whenComplete((v, t) -> {
            if (t != null) log.debug("Request {} no longer paused: {}", event.requestId().value(), t.getMessage());
        });
    }

    private void handleRequestWillBeSent(Network.RequestWillBeSent event) {
        if (!logTraffic) return;
        log.atInfo().addKeyValue("method", event.request().method())
                .addKeyValue("url", event.request().url())
                .log("Request");
    }

    private void handleResponseReceived(Network.ResponseReceived event) {
        if (!logTraffic) return;
        var response = event.response();
        log.atInfo().addKeyValue("status", response.status())
                .addKeyValue("url", response.url())
                .addKeyValue("type", response.mimeType())
                .log("Response");
    }

    private void handleLoadingFailed(Network.LoadingFailed event) {
        if (!logTraffic) return;
        log.atInfo().addKeyValue("requestId", event.requestId())
                .addKeyValue("error", event.errorText())
                .addKeyValue("blockedReason", event.blockedReason())
                .log("Loading failed");
    }
}
