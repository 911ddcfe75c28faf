package org.netpreserve.printroo.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

public interface Fetch {
    void enable(List<RequestPattern> patterns);

    void disable();

    CompletionStage<Void> continueRequestAsync(RequestId requestId);

    CompletionStage<Void> failRequestAsync(RequestId requestId, String errorReason);

    void onRequestPaused(Consumer<RequestPaused> handler);

    record RequestId(@JsonValue String value) {
        @JsonCreator
        public RequestId {
            Objects.requireNonNull(value);
        }
    }

    record RequestPattern(
            String urlPattern,
            String resourceType,
            String requestStage
    ) {
    }

    record RequestPaused(
            RequestId requestId,
            Network.Request request,
            Page.FrameId frameId,
            String resourceType,
            String responseErrorReason,
            Integer responseStatusCode,
            Network.RequestId networkId
    ) {
    }
}
