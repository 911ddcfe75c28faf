package org.netpreserve.printroo.cdp;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.printroo.ConfigurationException;
import org.netpreserve.printroo.cdp.protocol.CDPClient;
import org.netpreserve.printroo.util.CountdownTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Owns at most one browser process, starting it on demand and replacing it when it has died.
 * <p>
 * The browser's options are fixed once it has started: changing them throws {@link BrowserProcessException}
 * until the supervisor is closed.
 */
public class BrowserSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserSupervisor.class);
    private final ChromeArguments arguments;
    private final BrowserProcess.Connector connector;
    private String executable;
    private List<String> launcher = List.of();
    private Duration startupTimeout;
    private volatile BrowserProcess browserProcess;

    public BrowserSupervisor(ChromeArguments arguments) {
        this(arguments, CDPClient::new);
    }

    public BrowserSupervisor(ChromeArguments arguments, BrowserProcess.Connector connector) {
        this.arguments = arguments;
        this.connector = connector;
    }

    /**
     * Returns the running browser, starting one if there is none or the previous one has died.
     *
     * @param countdown bounds the startup, may be null
     */
    public synchronized BrowserProcess ensureRunning(@Nullable CountdownTimer countdown) {
        if (browserProcess != null) {
            if (browserProcess.isAlive()) {
                log.debug("Browser already running on PID {}, start skipped", browserProcess.pid());
                return browserProcess;
            }
            log.warn("Browser PID {} is no longer running, starting a new one", browserProcess.pid());
            browserProcess.close();
            browserProcess = null;
        }
        browserProcess = BrowserProcess.start(executable, arguments, launcher, startupTimeout, countdown, connector);
        return browserProcess;
    }

    public boolean isRunning() {
        var process = browserProcess;
        return process != null && process.isAlive();
    }

    /**
     * Applies a change to the browser's command-line flags.
     *
     * @throws BrowserProcessException if the browser has already been started
     */
    public synchronized void modifyArguments(Consumer<ChromeArguments> change) {
        checkNotStarted();
        change.accept(arguments);
    }

    public synchronized List<String> arguments() {
        return arguments.toList();
    }

    /**
     * Browser executable to run. If null well-known install locations are searched.
     */
    public synchronized void setExecutable(@Nullable String executable) {
        checkNotStarted();
        this.executable = executable;
    }

    public synchronized void setStartupTimeout(@Nullable Duration startupTimeout) {
        checkNotStarted();
        this.startupTimeout = startupTimeout;
    }

    /**
     * Runs the browser as another user through non-interactive sudo, which must be configured to allow it.
     * Windows domains and passwords can't be passed on, they are logged and ignored.
     */
    public synchronized void setUser(String userName, @Nullable String password) {
        checkNotStarted();
        if (userName == null || userName.isBlank()) {
            throw new ConfigurationException("User name is null, empty or white space");
        }
        String user = userName.trim();
        int backslash = user.indexOf('\\');
        if (backslash != -1) {
            log.warn("Ignoring domain '{}' of user {}", user.substring(0, backslash), user);
            user = user.substring(backslash + 1);
        }
        if (password != null) {
            log.warn("Ignoring password for user {}, sudo must allow running the browser without one", user);
        }
        log.info("Browser will run as user {}", user);
        this.launcher = List.of("sudo", "-n", "-u", user, "--");
    }

    public synchronized List<String> launcher() {
        return launcher;
    }

    private void checkNotStarted() {
        if (browserProcess != null) {
            throw new BrowserProcessException("Browser already started, options can't be changed until it is closed");
        }
    }

    /**
     * Kills the browser if one is running. The supervisor can start a new one afterwards.
     */
    @Override
    public synchronized void close() {
        if (browserProcess == null) return;
        browserProcess.close();
        browserProcess = null;
    }
}
