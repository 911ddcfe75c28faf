package org.netpreserve.printroo.cdp.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * A flattened session attached to one page target.
 */
public class CDPSession extends CDPBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPSession.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);
    private final String sessionId;
    private final String targetId;
    private final CDPClient client;

    /**
     * Creates a session bounded by the client's current countdown, so the commands that set up the page are
     * bounded too.
     */
    public CDPSession(CDPClient client, String sessionId, String targetId) {
        super();
        this.client = client;
        setCountdown(client.countdown());
        setCommandTimeout(client.commandTimeout());
        this.sessionId = sessionId;
        this.targetId = targetId;
        client.sessions.put(sessionId, this);
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        client.rpc.send(new RPC.Command(commandId, method, params, sessionId));
    }

    @Override
    protected long nextCommandId() {
        return client.nextCommandId();
    }

    /**
     * Closes the page target. Bounded by its own timeout rather than the countdown, so it also works once the
     * countdown has run out.
     */
    @Override
    public void close() {
        if (!client.isClosed()) {
            try {
                client.sendCommand("Target.closeTarget", Map.<String, Object>of("targetId", targetId), CLOSE_TIMEOUT, null);
            } catch (Exception e) {
                log.warn("Error closing session target", e);
            }
        }
        client.sessions.remove(sessionId);
        super.close();
    }

    public String targetId() {
        return targetId;
    }

    public String sessionId() {
        return sessionId;
    }
}
