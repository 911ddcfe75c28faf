package org.netpreserve.printroo.cdp.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Browser-level connection to the DevTools endpoint. Page sessions share its socket and id sequence.
 */
public class CDPClient extends CDPBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPClient.class);
    private final AtomicLong idSeq = new AtomicLong();
    final Map<String, CDPSession> sessions = new ConcurrentHashMap<>();
    final RPC rpc;

    public CDPClient(URI devtoolsUrl) throws IOException {
        this.rpc = new RPC.Socket(devtoolsUrl, this::handleMessage, this::handleRpcClose);
    }

    CDPClient(RPC rpc) {
        this.rpc = rpc;
    }

    /**
     * Closes the socket unless the browser already did, then stops the dispatcher threads of the client and of
     * any sessions left open.
     */
    @Override
    public void close() {
        if (!isClosed()) {
            rpc.close();
        }
        super.close();
        List.copyOf(sessions.values()).forEach(CDPSession::close);
    }

    @Override
    protected void handleMessage(RPC.ServerMessage message) {
        if (message.sessionId() == null) {
            super.handleMessage(message);
        } else {
            var session = sessions.get(message.sessionId());
            if (session != null) {
                session.handleMessage(message);
            } else {
                log.debug("Ignoring CDP message for unknown session: {}", message);
            }
        }
    }

    @Override
    protected void handleRpcClose() {
        super.handleRpcClose();
        sessions.values().forEach(CDPSession::handleRpcClose);
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        rpc.send(new RPC.Command(commandId, method, params, null));
    }

    @Override
    protected long nextCommandId() {
        return idSeq.incrementAndGet();
    }
}
