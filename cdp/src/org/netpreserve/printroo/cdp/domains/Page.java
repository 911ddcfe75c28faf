package org.netpreserve.printroo.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.netpreserve.printroo.cdp.protocol.Unwrap;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

public interface Page {
    Navigate navigate(String url);

    void enable();

    void stopLoading();

    void setDocumentContent(FrameId frameId, String html);

    void onLoadEventFired(Consumer<LoadEventFired> handler);

    @Unwrap
    FrameTree getFrameTree();

    @Unwrap("data")
    byte[] captureScreenshot(String format, Boolean captureBeyondViewport);

    @Unwrap("data")
    String captureSnapshot(String format);

    @Unwrap("data")
    byte[] printToPDF(Boolean landscape, Boolean displayHeaderFooter, Boolean printBackground, Double scale,
                      Double paperWidth, Double paperHeight, Double marginTop, Double marginBottom,
                      Double marginLeft, Double marginRight, String pageRanges, String headerTemplate,
                      String footerTemplate, Boolean preferCSSPageSize);

    record FrameId(@JsonValue String value) {
        @JsonCreator
        public FrameId {
            Objects.requireNonNull(value);
        }
    }

    record FrameTree(Frame frame, List<FrameTree> childFrames) {
    }

    record Frame(@NotNull FrameId id, FrameId parentId, @NotNull Network.LoaderId loaderId, String name,
                 @NotNull String url, String securityOrigin, String mimeType, String unreachableUrl) {
    }

    record Navigate(FrameId frameId, Network.LoaderId loaderId, String errorText) {
    }

    record LoadEventFired(Network.MonotonicTime timestamp) {
    }
}
