package org.netpreserve.printroo.cdp.domains;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.netpreserve.printroo.cdp.protocol.RPC;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public interface Runtime {
    Evaluate evaluate(String expression, Integer timeout, boolean returnByValue, boolean awaitPromise);

    void onConsoleAPICalled(Consumer<ConsoleAPICalled> event);

    void enable();

    record ConsoleAPICalled(String type, JsonNode args) {}

    record Evaluate(RemoteObject result, ExceptionDetails exceptionDetails) {
    }

    record RemoteObject(String type, JsonNode value) {
        public Object toJavaObject() {
            return switch (type) {
                case "string" -> value.asText();
                case "number" -> value.numberValue();
                case "boolean" -> value.asBoolean();
                case "object" -> {
                    if (value == null || value.isNull()) yield null;
                    try {
                        if (value.isArray()) {
                            yield RPC.JSON.treeToValue(value, List.class);
                        } else {
                            yield RPC.JSON.treeToValue(value, Map.class);
                        }
                    } catch (JsonProcessingException e) {
                        throw new RuntimeException(e);
                    }
                }
                case "undefined" -> null;
                default -> throw new IllegalStateException("Don't know how to convert to Java object: " + type);
            };
        }
    }

    record ExceptionDetails(int exceptionId, String text, int lineNumber, int columnNumber, RemoteObject exception) {
    }
}
