package org.netpreserve.printroo.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * URL type which caches parsing.
 * <p>
 * Equality is exact string equality, which is what the safe-URL allow-list relies on.
 */
public class Url {
    private final String url;
    private URI uri;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    public static Url of(Path path) {
        return new Url(path.toAbsolutePath().toUri().toString());
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    public String scheme() {
        int colon = url.indexOf(':');
        if (colon <= 0) return null;
        return url.substring(0, colon).toLowerCase(Locale.ROOT);
    }

    @JsonValue
    public String toString() {
        return url;
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isFile() {
        return startsWithIgnoreCase(url, "file:");
    }

    /**
     * Local filesystem path of a file: URL.
     *
     * @throws IllegalStateException if this is not a valid file: URL
     */
    public Path toPath() {
        if (!isFile()) throw new IllegalStateException("Not a file URL: " + url);
        try {
            return Path.of(toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid file URL: " + url, e);
        }
    }

    public String path() {
        try {
            String path = toURI().getPath();
            return path == null ? "" : path;
        } catch (URISyntaxException e) {
            return "";
        }
    }

    /**
     * The lowercased extension of the last path segment including the dot, or an empty string.
     */
    public String extension() {
        String path = path();
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash) return "";
        return path.substring(dot).toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
