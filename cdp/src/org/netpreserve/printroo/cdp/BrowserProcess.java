package org.netpreserve.printroo.cdp;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.printroo.cdp.domains.Browser;
import org.netpreserve.printroo.cdp.domains.Target;
import org.netpreserve.printroo.cdp.protocol.CDPClient;
import org.netpreserve.printroo.cdp.protocol.CDPSession;
import org.netpreserve.printroo.util.CountdownTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.lang.ProcessBuilder.Redirect.DISCARD;
import static java.lang.ProcessBuilder.Redirect.PIPE;

/**
 * A running headless browser and the DevTools connection to it.
 */
public class BrowserProcess implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserProcess.class);
    private static final List<String> BROWSER_EXECUTABLES = List.of(
            "chromium",
            "chromium-browser",
            "google-chrome",
            "google-chrome-stable",
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe",
            "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe");
    static final Duration DEFAULT_ACTIVE_PORT_TIMEOUT = Duration.ofSeconds(10);
    private static final long ACTIVE_PORT_POLL_MILLIS = 5;
    private static final Duration EXIT_TIMEOUT = Duration.ofSeconds(10);

    private final Process process;
    private final List<String> command;
    private final DevToolsEndpoint endpoint;
    private final CDPClient cdp;
    private final Browser browser;
    private final Target target;
    private final List<ProcessHandle> children;
    private final Thread shutdownHook;
    private volatile boolean closed;

    /**
     * Opens the protocol connection once the endpoint is known.
     */
    @FunctionalInterface
    public interface Connector {
        CDPClient connect(URI devtoolsUrl) throws IOException;
    }

    BrowserProcess(Process process, List<String> command, DevToolsEndpoint endpoint, CDPClient cdp,
                   Thread shutdownHook) {
        this.process = process;
        this.command = command;
        this.endpoint = endpoint;
        this.cdp = cdp;
        this.browser = cdp.domain(Browser.class);
        this.target = cdp.domain(Target.class);
        this.children = process.descendants().toList();
        this.shutdownHook = shutdownHook;
    }

    public static BrowserProcess start(@Nullable String executable, ChromeArguments arguments) {
        return start(executable, arguments, List.of(), null, null, CDPClient::new);
    }

    /**
     * Launches the browser and waits until its DevTools endpoint is reachable.
     *
     * @param launcher       command prefix such as {@code sudo -n -u user --}, may be empty
     * @param startupTimeout bound on endpoint discovery; null means unbounded when reading stderr and
     *                       10 seconds when polling a profile's marker file
     * @param countdown      conversion deadline also bounding discovery, may be null
     * @throws BrowserProcessException if the browser can't be started, exits early or isn't ready in time
     */
    public static BrowserProcess start(@Nullable String executable, ChromeArguments arguments, List<String> launcher,
                                       @Nullable Duration startupTimeout, @Nullable CountdownTimer countdown,
                                       Connector connector) {
        if (executable == null) {
            executable = findExecutable().orElseThrow(() ->
                    new BrowserProcessException("Couldn't detect browser. Set the browser executable explicitly"));
        }
        var command = new ArrayList<>(launcher);
        command.add(executable);
        command.addAll(arguments.toList());

        Path profile = arguments.userProfile();
        Path activePortFile = profile == null ? null : profile.resolve(DevToolsEndpoint.ACTIVE_PORT_FILE);
        if (activePortFile != null) {
            try {
                Files.deleteIfExists(activePortFile);
            } catch (IOException e) {
                throw new BrowserProcessException("Unable to delete stale " + activePortFile, e);
            }
        }

        log.info("Starting browser: {}", String.join(" ", command));
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectInput(PIPE)
                    .redirectOutput(DISCARD)
                    .redirectError(PIPE)
                    .start();
        } catch (IOException e) {
            log.error("Could not start the browser process", e);
            throw new BrowserProcessException("Could not start browser '" + executable + "'", e);
        }
        log.info("Browser process started with PID {}", process.pid());

        var shutdownHook = new Thread(() -> killProcessTree(process, process.descendants().toList()),
                "browser-shutdown-" + process.pid());
        java.lang.Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            var stderrEndpoint = readStderr(process, activePortFile == null);
            process.onExit().thenAccept(p -> stderrEndpoint.completeExceptionally(new BrowserProcessException(
                    "Browser exited unexpectedly with exit code " + p.exitValue() + ", arguments used: " +
                    String.join(" ", command))));

            DevToolsEndpoint endpoint;
            if (activePortFile == null) {
                endpoint = awaitStderrEndpoint(stderrEndpoint, CountdownTimer.bound(startupTimeout, countdown));
            } else {
                Duration timeout = CountdownTimer.bound(startupTimeout == null ? DEFAULT_ACTIVE_PORT_TIMEOUT :
                        startupTimeout, countdown);
                endpoint = pollActivePortFile(process, activePortFile, timeout);
            }

            log.info("Connecting to DevTools on {}", endpoint);
            CDPClient cdp;
            try {
                cdp = connector.connect(endpoint.toUri());
            } catch (IOException e) {
                throw new BrowserProcessException("Unable to connect to DevTools on " + endpoint, e);
            }
            log.info("Connected to DevTools");
            return new BrowserProcess(process, List.copyOf(command), endpoint, cdp, shutdownHook);
        } catch (RuntimeException e) {
            killProcessTree(process, process.descendants().toList());
            removeShutdownHook(shutdownHook);
            throw e;
        }
    }

    /**
     * Drains stderr on a daemon thread for the lifetime of the process. If requested the returned future completes
     * with the endpoint announced there.
     */
    private static CompletableFuture<DevToolsEndpoint> readStderr(Process process, boolean announcesEndpoint) {
        var future = new CompletableFuture<DevToolsEndpoint>();
        var thread = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(),
                    StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (announcesEndpoint && !future.isDone()) {
                        var endpoint = DevToolsEndpoint.fromStderrLine(line);
                        if (endpoint.isPresent()) {
                            log.info("Browser: {}", line);
                            future.complete(endpoint.get());
                            continue;
                        }
                    }
                    log.debug("Browser: {}", line);
                }
            } catch (Exception e) {
                if (process.isAlive()) {
                    log.error("Error reading browser stderr", e);
                }
                future.completeExceptionally(e);
            }
        }, "browser-stderr-" + process.pid());
        thread.setDaemon(true);
        thread.start();
        return future;
    }

    private static DevToolsEndpoint awaitStderrEndpoint(CompletableFuture<DevToolsEndpoint> future,
                                                        @Nullable Duration timeout) {
        try {
            if (timeout == null) {
                return future.get();
            }
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof BrowserProcessException processException) {
                throw processException;
            }
            throw new BrowserProcessException("Failed reading DevTools endpoint from browser", e.getCause());
        } catch (TimeoutException e) {
            throw new BrowserStartupTimeoutException("A timeout of '" + timeout.toMillis() +
                                                     "' milliseconds exceeded, could not make a connection to the browser DevTools");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserProcessException("Interrupted waiting for browser to start", e);
        }
    }

    static DevToolsEndpoint pollActivePortFile(Process process, Path file, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        Exception lastError = null;
        while (true) {
            if (Files.exists(file)) {
                try {
                    return DevToolsEndpoint.fromActivePortFile(Files.readAllLines(file, StandardCharsets.UTF_8));
                } catch (IOException | IllegalArgumentException e) {
                    // probably still being written
                    lastError = e;
                }
            }
            if (!process.isAlive()) {
                throw new BrowserProcessException("Browser exited unexpectedly with exit code " +
                                                  process.exitValue() + " before writing " + file);
            }
            if (System.nanoTime() - deadline >= 0) {
                if (lastError == null) {
                    throw new BrowserStartupTimeoutException("A timeout of '" + timeout.toMillis() +
                                                             "' milliseconds exceeded, the file '" + file + "' did not exist");
                }
                throw new BrowserStartupTimeoutException("A timeout of '" + timeout.toMillis() +
                                                         "' milliseconds exceeded, could not read the file '" + file + "'", lastError);
            }
            try {
                Thread.sleep(ACTIVE_PORT_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrowserProcessException("Interrupted waiting for " + file, e);
            }
        }
    }

    /**
     * Looks for a Chromium-family browser in the PATH and the usual install locations.
     */
    public static Optional<String> findExecutable() {
        String pathEnv = System.getenv("PATH");
        for (var executable : BROWSER_EXECUTABLES) {
            Path candidate = Path.of(executable);
            if (candidate.isAbsolute()) {
                if (Files.isExecutable(candidate)) return Optional.of(executable);
                continue;
            }
            if (pathEnv == null) continue;
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (dir.isEmpty()) continue;
                Path resolved = Path.of(dir).resolve(executable);
                if (Files.isExecutable(resolved)) return Optional.of(resolved.toString());
            }
        }
        return Optional.empty();
    }

    public boolean isAlive() {
        return !closed && process.isAlive() && !cdp.isClosed();
    }

    public long pid() {
        return process.pid();
    }

    public DevToolsEndpoint endpoint() {
        return endpoint;
    }

    public List<String> command() {
        return command;
    }

    public CDPClient cdp() {
        return cdp;
    }

    /**
     * Bounds browser-level commands, such as opening a window, by the countdown. Null removes the bound.
     */
    public void setCountdown(@Nullable CountdownTimer countdown) {
        cdp.setCountdown(countdown);
    }

    /**
     * Opens a new page target with its own session. Closing the returned navigator closes the page.
     */
    public Navigator newWindow() {
        String targetId = target.createTarget("about:blank", null, null).targetId();
        var sessionId = target.attachToTarget(targetId, true).sessionId();
        var session = new CDPSession(cdp, sessionId, targetId);
        return new Navigator(session);
    }

    /**
     * Closes the connection and kills the browser and every process it spawned. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (!cdp.isClosed()) {
            try {
                browser.closeAsync();
            } catch (Exception e) {
                log.debug("Browser.close failed", e);
            }
        }
        cdp.close();
        var descendants = new ArrayList<>(children);
        descendants.addAll(process.descendants().toList());
        if (process.isAlive()) {
            log.info("Stopping browser PID {}", process.pid());
        }
        killProcessTree(process, descendants);
        removeShutdownHook(shutdownHook);
    }

    private static void killProcessTree(Process process, List<ProcessHandle> descendants) {
        for (var child : descendants) {
            child.destroyForcibly(); // returns false if it already exited
        }
        if (!process.isAlive()) return;
        process.destroyForcibly();
        try {
            if (!process.waitFor(EXIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Browser PID {} did not exit within {}", process.pid(), EXIT_TIMEOUT);
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted closing process", e);
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            java.lang.Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // already shutting down, the hook is running
        }
    }
}
