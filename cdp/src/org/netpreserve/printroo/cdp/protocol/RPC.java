package org.netpreserve.printroo.cdp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.printroo.util.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

public interface RPC {
    ObjectMapper JSON = new ObjectMapper(new JsonFactoryBuilder()
            .streamReadConstraints(StreamReadConstraints.builder().maxStringLength(300 * 1024 * 1024).build())
            .build())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    void send(Command message) throws IOException;

    void close();

    record Command(long id, String method, Map<String, Object> params, String sessionId) {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
    @JsonSubTypes({@JsonSubTypes.Type(Event.class), @JsonSubTypes.Type(Response.class)})
    interface ServerMessage {
        String sessionId();
    }

    record Event(String method, ObjectNode params, String sessionId) implements ServerMessage {
    }

    record Response(long id, ObjectNode result, Error error, String sessionId) implements ServerMessage {
    }

    record Error(int code, String message) {
    }

    /**
     * CDP over a WebSocket. Messages are received on the HTTP client's listener thread and passed to the
     * message handler in arrival order. The close handler runs once, when the socket closes or faults.
     */
    class Socket implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Socket.class);
        private static final HttpClient httpClient = HttpClient.newHttpClient();
        private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
        private final WebSocket webSocket;
        private final Consumer<ServerMessage> messageHandler;
        private final Runnable closeHandler;
        private final AtomicBoolean closed = new AtomicBoolean();

        public Socket(URI devtoolsUrl, Consumer<ServerMessage> messageHandler, Runnable closeHandler) throws IOException {
            this.messageHandler = messageHandler;
            this.closeHandler = closeHandler;
            try {
                this.webSocket = httpClient.newWebSocketBuilder()
                        .connectTimeout(CONNECT_TIMEOUT)
                        .buildAsync(devtoolsUrl, new Listener())
                        .get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted connecting to " + devtoolsUrl, e);
            } catch (ExecutionException | TimeoutException e) {
                throw new IOException("Unable to connect to " + devtoolsUrl, e);
            }
        }

        @Override
        public void send(Command message) throws IOException {
            if (closed.get()) throw new CDPClosedException();
            String json = JSON.writeValueAsString(message);
            if (log.isTraceEnabled()) {
                log.trace("-> {}", LogUtils.ellipses(json));
            }
            webSocket.sendText(json, true);
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            try {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "")
                        .orTimeout(1, TimeUnit.SECONDS);
            } catch (Exception e) {
                log.debug("Error sending close frame", e);
            }
            webSocket.abort();
            closeHandler.run();
        }

        private void handleClosed() {
            if (closed.compareAndSet(false, true)) {
                closeHandler.run();
            }
        }

        private class Listener implements WebSocket.Listener {
            private final StringBuilder buffer = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                if (!last) {
                    buffer.append(data);
                    webSocket.request(1);
                    return null;
                }
                if (buffer.length() > 0) {
                    buffer.append(data);
                    data = buffer.toString();
                    buffer.setLength(0);
                }
                try {
                    if (log.isTraceEnabled()) {
                        log.trace("<- {}", LogUtils.ellipses(data.toString()));
                    }
                    var message = JSON.readValue(data.toString(), ServerMessage.class);
                    messageHandler.accept(message);
                } catch (IOException e) {
                    log.error("Failed to parse message", e);
                }
                webSocket.request(1);
                return null;
            }

            @Override
            public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                log.debug("WebSocket closed by browser: {} {}", statusCode, reason);
                handleClosed();
                return null;
            }

            @Override
            public void onError(WebSocket webSocket, Throwable error) {
                log.warn("WebSocket error", error);
                handleClosed();
            }
        }
    }
}
