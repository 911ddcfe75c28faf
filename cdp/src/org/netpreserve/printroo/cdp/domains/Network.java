package org.netpreserve.printroo.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.netpreserve.printroo.util.Url;

import java.util.Objects;
import java.util.function.Consumer;

public interface Network {
    void enable();

    void setCacheDisabled(boolean cacheDisabled);

    void onRequestWillBeSent(Consumer<RequestWillBeSent> handler);

    void onResponseReceived(Consumer<ResponseReceived> handler);

    void onLoadingFailed(Consumer<LoadingFailed> handler);

    record LoaderId(@JsonValue String value) {
        @JsonCreator
        public LoaderId {
            Objects.requireNonNull(value);
        }
    }

    record MonotonicTime(@JsonValue double value) {
        @JsonCreator
        public MonotonicTime {
        }
    }

    record RequestId(@JsonValue String value) {
        @JsonCreator
        public RequestId {
            Objects.requireNonNull(value);
        }

        public String toString() {
            return value;
        }
    }

    record Request(Url url, String method) {
    }

    record Response(Url url, int status, String statusText, String mimeType) {
    }

    record RequestWillBeSent(
            RequestId requestId,
            LoaderId loaderId,
            Request request,
            String type,
            Page.FrameId frameId) {
    }

    record ResponseReceived(
            RequestId requestId,
            LoaderId loaderId,
            String type,
            Response response,
            Page.FrameId frameId
    ) {
    }

    record LoadingFailed(
            RequestId requestId,
            String type,
            String errorText,
            boolean canceled,
            String blockedReason
    ) {
    }
}
