package org.netpreserve.printroo.cdp;

import org.apache.commons.lang3.StringUtils;
import org.netpreserve.printroo.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * The ordered set of command-line flags the browser is started with.
 * <p>
 * Flag names are compared case-insensitively and appear at most once. The flags in {@link #MANDATORY} can be given
 * a new value but never removed: without them the browser would not be headless or would not expose a DevTools
 * endpoint.
 */
public class ChromeArguments {
    private static final Logger log = LoggerFactory.getLogger(ChromeArguments.class);
    private static final String USER_DATA_DIR = "--user-data-dir";
    public static final Set<String> MANDATORY = Set.of("--headless", "--disable-gpu", "--no-first-run",
            "--remote-debugging-port", "--window-size");
    private static final List<String> DEFAULT_FLAGS = List.of(
            "--headless",
            "--disable-gpu",
            "--hide-scrollbars",
            "--mute-audio",
            "--disable-background-networking",
            "--disable-background-timer-throttling",
            "--disable-default-apps",
            "--disable-extensions",
            "--disable-hang-monitor",
            "--disable-prompt-on-repost",
            "--disable-sync",
            "--disable-translate",
            "--metrics-recording-only",
            "--no-first-run",
            "--disable-crash-reporter");

    // lowercased name -> flag as given
    private final LinkedHashMap<String, Flag> flags = new LinkedHashMap<>();
    private Path userProfile;

    private record Flag(String name, String value) {
        String toArgument() {
            return value == null ? name : name + "=" + value;
        }
    }

    public ChromeArguments() {
        reset();
    }

    /**
     * Restores the default flag set. A user profile set earlier is kept.
     */
    public synchronized void reset() {
        log.debug("Resetting browser arguments to default");
        flags.clear();
        DEFAULT_FLAGS.forEach(this::add);
        add("--remote-debugging-port", "0");
        setWindowSize(WindowSize.HD_1366_768);
        if (userProfile != null) {
            add(USER_DATA_DIR, userProfile.toString());
        }
    }

    /**
     * Adds a bare flag, or a {@code --name=value} flag. Does nothing if a bare flag of the same name is already
     * present.
     */
    public synchronized void add(String flag) {
        String name = checkName(flag);
        int equals = name.indexOf('=');
        if (equals != -1) {
            add(name.substring(0, equals), name.substring(equals + 1));
            return;
        }
        if (flags.containsKey(key(name))) return;
        log.debug("Adding browser argument '{}'", name);
        flags.put(key(name), new Flag(name, null));
    }

    /**
     * Adds a flag with a value, replacing the value of an existing flag of the same name. Giving
     * {@code --user-data-dir} switches to the named-profile mode of {@link #setUserProfile(Path)}.
     */
    public synchronized void add(String flag, String value) {
        String name = checkName(flag);
        if (value == null) throw new ConfigurationException("Value for " + name + " is null");
        if (key(name).equals(USER_DATA_DIR)) {
            userProfile = Path.of(value).toAbsolutePath();
            value = userProfile.toString();
        }
        log.debug("Adding browser argument '{}={}'", name, value);
        flags.put(key(name), new Flag(name, value));
    }

    public synchronized void remove(String flag) {
        String name = checkName(flag);
        int equals = name.indexOf('=');
        if (equals != -1) name = name.substring(0, equals);
        if (MANDATORY.contains(key(name))) {
            throw new ConfigurationException("Can't remove '" + name + "' argument, this argument is always needed");
        }
        if (flags.remove(key(name)) != null) {
            log.debug("Removed browser argument '{}'", name);
        }
        if (key(name).equals(USER_DATA_DIR)) {
            userProfile = null;
        }
    }

    public synchronized boolean contains(String flag) {
        return flags.containsKey(key(flag));
    }

    public synchronized Optional<String> value(String flag) {
        var existing = flags.get(key(flag));
        return existing == null ? Optional.empty() : Optional.ofNullable(existing.value());
    }

    public void setWindowSize(int width, int height) {
        if (width <= 0) throw new ConfigurationException("Window width must be greater than zero: " + width);
        if (height <= 0) throw new ConfigurationException("Window height must be greater than zero: " + height);
        add("--window-size", width + "," + height);
    }

    public void setWindowSize(WindowSize size) {
        setWindowSize(size.width(), size.height());
    }

    /**
     * Proxy configuration such as {@code foopy:8080}, {@code http=foopy:80;ftp=foopy2} or {@code direct://}.
     */
    public void setProxyServer(String value) {
        add("--proxy-server", value);
    }

    /**
     * Semicolon-separated hosts that bypass the proxy, e.g. {@code *.google.com;*foo.com;127.0.0.1:8080}.
     */
    public void setProxyBypassList(String values) {
        add("--proxy-bypass-list", values);
    }

    public void setProxyPacUrl(String value) {
        add("--proxy-pac-url", value);
    }

    public void setUserAgent(String value) {
        add("--user-agent", value);
    }

    /**
     * Makes the browser cache to the given directory instead of the profile. A browser locks its cache directory,
     * so concurrently running browsers must each be given their own.
     *
     * @param sizeMegabytes maximum cache size, or null to let the browser decide
     */
    public void setDiskCache(Path directory, Long sizeMegabytes) {
        if (!Files.isDirectory(directory)) {
            throw new ConfigurationException("The directory '" + directory + "' does not exist");
        }
        add("--disk-cache-dir", StringUtils.stripEnd(directory.toString(), "/\\"));
        if (sizeMegabytes != null) {
            if (sizeMegabytes <= 0) {
                throw new ConfigurationException("Disk cache size has to be a value of 1 or greater");
            }
            add("--disk-cache-size", Long.toString(sizeMegabytes * 1024 * 1024));
        }
    }

    /**
     * Switches to named-profile mode: the browser stores its profile in the given directory and announces its
     * DevTools port through a marker file there rather than on stderr.
     */
    public synchronized void setUserProfile(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new ConfigurationException("The directory '" + directory.toAbsolutePath() + "' does not exist");
        }
        add(USER_DATA_DIR, directory.toString());
    }

    public synchronized Path userProfile() {
        return userProfile;
    }

    public synchronized List<String> toList() {
        return flags.values().stream().map(Flag::toArgument).toList();
    }

    @Override
    public String toString() {
        return String.join(" ", toList());
    }

    private static String checkName(String flag) {
        if (StringUtils.isBlank(flag)) {
            throw new ConfigurationException("Argument is null, empty or white space");
        }
        return flag.trim();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
