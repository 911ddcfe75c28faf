package org.netpreserve.printroo.cdp;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Where the browser's DevTools WebSocket can be reached.
 */
public record DevToolsEndpoint(String host, int port, String path) {
    public static final String ACTIVE_PORT_FILE = "DevToolsActivePort";
    private static final String LISTENING_PREFIX = "DevTools listening on ";

    public DevToolsEndpoint {
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("Invalid port: " + port);
        if (!path.startsWith("/")) path = "/" + path;
    }

    public static DevToolsEndpoint of(URI uri) {
        return new DevToolsEndpoint(uri.getHost(), uri.getPort(), uri.getRawPath());
    }

    /**
     * Parses a line the browser prints on stderr once it is listening, e.g.
     * {@code DevTools listening on ws://127.0.0.1:50160/devtools/browser/53add595-...}.
     */
    public static Optional<DevToolsEndpoint> fromStderrLine(String line) {
        int i = line.indexOf(LISTENING_PREFIX);
        if (i == -1) return Optional.empty();
        var uri = URI.create(line.substring(i + LISTENING_PREFIX.length()).trim());
        return Optional.of(of(uri));
    }

    /**
     * Parses the two-line file the browser writes into a named profile directory: the port then the path.
     *
     * @throws IllegalArgumentException if the file is incomplete or malformed, for example while it is still
     *                                  being written
     */
    public static DevToolsEndpoint fromActivePortFile(List<String> lines) {
        if (lines.size() < 2 || lines.get(1).isBlank()) {
            throw new IllegalArgumentException("Expected port and path lines in " + ACTIVE_PORT_FILE);
        }
        int port = Integer.parseInt(lines.get(0).trim());
        return new DevToolsEndpoint("127.0.0.1", port, lines.get(1).trim());
    }

    public URI toUri() {
        return URI.create("ws://" + host + ":" + port + path);
    }

    @Override
    public String toString() {
        return toUri().toString();
    }
}
