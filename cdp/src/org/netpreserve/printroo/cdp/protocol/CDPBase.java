package org.netpreserve.printroo.cdp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.core.util.Separators.Spacing;
import com.fasterxml.jackson.databind.*;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.printroo.util.CountdownTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static org.netpreserve.printroo.util.LogUtils.ellipses;

/**
 * Command/response correlation and event dispatch shared by the browser-level client and page sessions.
 * <p>
 * Replies and events are handled one at a time on a dedicated dispatcher thread. Callers block on a future per
 * command id, bounded by the command timeout and the current {@link CountdownTimer}.
 */
public abstract class CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPBase.class);
    private static final ObjectWriter logJson = RPC.JSON.copy()
            .writer().without(JsonWriteFeature.QUOTE_FIELD_NAMES)
            .with(new DefaultPrettyPrinter()
                    .withArrayIndenter(null)
                    .withObjectIndenter(null)
                    .withSeparators(new Separators()
                            .withObjectEntrySpacing(Spacing.AFTER)
                            .withObjectFieldValueSpacing(Spacing.AFTER)));
    static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(120);
    private final Map<Long, CompletableFuture<JsonNode>> commands = new ConcurrentHashMap<>();
    private final Map<String, Consumer<JsonNode>> listeners = new ConcurrentHashMap<>();
    private final Map<String, EventSubscription<?>> subscriptions = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private volatile Thread executorThread;
    private volatile boolean closed;
    private volatile Duration commandTimeout = DEFAULT_COMMAND_TIMEOUT;
    private volatile CountdownTimer countdown;

    protected CDPBase() {
        String parentThreadName = Thread.currentThread().getName();
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, parentThreadName + "-CDP");
            thread.setDaemon(true);
            executorThread = thread;
            return thread;
        });
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T> T domain(Class<T> domainInterface) {
        return (T) Proxy.newProxyInstance(getClass().getClassLoader(), new Class[]{domainInterface},
                (proxy, method, args) -> {
                    var methodParameters = method.getParameters();
                    if (method.getName().equals("toString")) {
                        return domainInterface.getSimpleName() + "@" + System.identityHashCode(proxy);
                    }
                    if (method.getName().startsWith("on") && methodParameters.length == 1) {
                        var type = ((ParameterizedType) method.getGenericParameterTypes()[0]);
                        var eventClass = (Class<?>) type.getActualTypeArguments()[0];
                        addListener(eventClass, (Consumer) args[0]);
                        return null;
                    }
                    var params = new HashMap<String, Object>(methodParameters.length);
                    for (int i = 0; i < methodParameters.length; i++) {
                        if (args[i] != null) params.put(methodParameters[i].getName(), args[i]);
                    }
                    Unwrap unwrap = method.getAnnotation(Unwrap.class);
                    return sendProxyCommand(domainInterface.getSimpleName() + "." + method.getName(), params,
                            method.getGenericReturnType(), unwrap);
                });
    }

    /**
     * Sets the timer that bounds every blocking call made through this connection's domain proxies. Pass null to
     * only apply the command timeout.
     */
    public void setCountdown(@Nullable CountdownTimer countdown) {
        this.countdown = countdown;
    }

    public @Nullable CountdownTimer countdown() {
        return countdown;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public Duration commandTimeout() {
        return commandTimeout;
    }

    protected void handleMessage(RPC.ServerMessage message) {
        try {
            executor.submit(() -> {
                if (message instanceof RPC.Event event) {
                    handleEvent(event);
                } else if (message instanceof RPC.Response response) {
                    handleResponse(response);
                } else {
                    log.error("Unknown message type: {}", message);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Caught rejected execution exception, session is probably closing", e);
        }
    }

    private void handleResponse(RPC.Response response) {
        var future = commands.remove(response.id());
        if (future == null) {
            log.warn("Received response to unknown call id {}", response.id());
        } else {
            if (response.error() == null) {
                future.complete(response.result());
            } else {
                future.completeExceptionally(new CDPException(response.error().code(), response.error().message()));
            }
        }
    }

    private void handleEvent(RPC.Event event) {
        if (log.isTraceEnabled()) {
            try {
                log.trace("{}{}", event.method(), ellipses(logJson.writeValueAsString(event.params())));
            } catch (JsonProcessingException ignored) {}
        }
        var subscription = subscriptions.get(event.method());
        if (subscription != null && subscription.offer(event.params())) {
            subscriptions.remove(event.method(), subscription);
        }
        Consumer<JsonNode> handler = listeners.get(event.method());
        if (handler != null) {
            try {
                handler.accept(event.params());
            } catch (Exception e) {
                log.error("{} handler threw", event.method(), e);
            }
        }
    }

    static String eventName(Class<?> eventClass) {
        String className = eventClass.getSimpleName();
        return eventClass.getEnclosingClass().getSimpleName() + "."
               + className.substring(0, 1).toLowerCase(Locale.ROOT)
               + className.substring(1);
    }

    public <T> void addListener(Class<T> eventClass, Consumer<T> callback) {
        listeners.put(eventName(eventClass), params -> {
            T event;
            try {
                event = RPC.JSON.treeToValue(params, eventClass);
            } catch (JsonProcessingException e) {
                log.warn("Dropping malformed {} event: {}", eventName(eventClass), e.getOriginalMessage());
                return;
            }
            callback.accept(event);
        });
    }

    /**
     * Registers interest in the next event of the given type that satisfies the matcher. Subscribe before sending
     * the command that triggers the event, otherwise the event may be missed.
     *
     * @throws IllegalStateException if a subscription to the same event is already active
     */
    public <T> EventSubscription<T> subscribe(Class<T> eventClass, Predicate<T> matcher) {
        if (closed) {
            throw new CDPClosedException();
        }
        var subscription = new EventSubscription<>(this, eventName(eventClass), eventClass, matcher);
        var existing = subscriptions.putIfAbsent(subscription.eventName(), subscription);
        if (existing != null) {
            throw new IllegalStateException("Already waiting for " + subscription.eventName());
        }
        return subscription;
    }

    /**
     * Blocks until an event matching the predicate arrives.
     */
    public <T> T waitForEvent(Class<T> eventClass, Predicate<T> matcher, @Nullable Duration timeout,
                              @Nullable CountdownTimer countdown) {
        var subscription = subscribe(eventClass, matcher);
        try {
            return subscription.await(timeout, countdown);
        } finally {
            subscription.cancel();
        }
    }

    void unsubscribe(EventSubscription<?> subscription) {
        subscriptions.remove(subscription.eventName(), subscription);
    }

    /**
     * Sends a raw command and blocks for its result.
     *
     * @param timeout   bound for this command, or null to rely only on the countdown
     * @param countdown conversion deadline, may be null
     */
    public JsonNode sendCommand(String method, Map<String, Object> params, @Nullable Duration timeout,
                                @Nullable CountdownTimer countdown) {
        checkNotOnDispatcherThread();
        if (closed) {
            throw new CDPClosedException();
        }
        Duration bound = CountdownTimer.bound(timeout, countdown);
        if (bound != null && bound.isZero()) {
            throw new CDPTimeoutException("No time left to send " + method);
        }
        long commandId = nextCommandId();
        var future = new CompletableFuture<JsonNode>();
        try {
            commands.put(commandId, future);
            traceCommand(commandId, method, params);
            sendCommandMessage(commandId, method, params);
            return await(future, bound, method);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            commands.remove(commandId);
        }
    }

    private Object sendProxyCommand(String method, Map<String, Object> params, Type returnType, Unwrap unwrap) {
        boolean returnsCompletionStage = returnType instanceof ParameterizedType parameterizedType &&
                                         CompletionStage.class.isAssignableFrom((Class<?>) parameterizedType.getRawType());
        if (!returnsCompletionStage) {
            checkNotOnDispatcherThread();
        }

        if (method.endsWith("Async")) {
            method = method.substring(0, method.length() - "Async".length());
        }

        Duration bound = CountdownTimer.bound(commandTimeout, countdown);
        if (!returnsCompletionStage && bound != null && bound.isZero()) {
            throw new CDPTimeoutException("No time left to send " + method);
        }

        long commandId = nextCommandId();
        traceCommand(commandId, method, params);

        boolean leaveCommandInMap = false;
        try {
            var future = new CompletableFuture<JsonNode>();

            if (log.isTraceEnabled()) {
                String methodName = method;
                future.whenComplete((result, ex) -> {
                    try {
                        if (ex == null) {
                            log.trace("[{}] {} [{}]", commandId, ellipses(logJson.writeValueAsString(result)), methodName);
                        } else {
                            log.trace("[{}] {}", commandId, ex.getMessage());
                        }
                    } catch (JsonProcessingException ignored) {}
                });
            }

            commands.put(commandId, future);
            if (closed) {
                future.completeExceptionally(new CDPClosedException());
            } else {
                sendCommandMessage(commandId, method, params);
            }

            Type valueType;
            if (returnsCompletionStage) {
                valueType = ((ParameterizedType) returnType).getActualTypeArguments()[0];
            } else {
                valueType = returnType;
            }

            CompletableFuture<?> mappedFuture = future.thenApply(result -> {
                ObjectReader reader;
                if (unwrap != null) {
                    String rootName = unwrap.value().isEmpty() ?
                            lowercaseFirstLetter(((Class<?>) valueType).getSimpleName()) : unwrap.value();
                    reader = RPC.JSON.reader(DeserializationFeature.UNWRAP_ROOT_VALUE)
                            .withRootName(rootName);
                } else {
                    reader = RPC.JSON.reader();
                }
                try {
                    return reader.treeToValue(result, RPC.JSON.constructType(valueType));
                } catch (JsonProcessingException e) {
                    throw new UncheckedIOException(e);
                }
            });
            if (returnsCompletionStage) {
                leaveCommandInMap = true;
                return mappedFuture;
            } else {
                return await(mappedFuture, bound, method);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            if (!leaveCommandInMap) commands.remove(commandId);
        }
    }

    /**
     * Waits for a future completed by the dispatcher thread, translating failures into {@link CDPException}s
     * with a stack trace from the calling thread.
     */
    static <T> T await(CompletableFuture<T> future, @Nullable Duration bound, String what) {
        try {
            if (bound == null) {
                return future.get();
            }
            return future.get(bound.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CDPException cdpException) {
                cdpException.actuallyFillInStackTrace();
                throw cdpException;
            } else if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            } else {
                throw new RuntimeException(e.getCause());
            }
        } catch (TimeoutException e) {
            throw new CDPTimeoutException("Timed out after " + bound.toMillis() + "ms waiting for " + what);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CDPTimeoutException("Interrupted waiting for " + what);
        }
    }

    private void checkNotOnDispatcherThread() {
        if (Thread.currentThread() == executorThread) {
            throw new IllegalStateException("Sending command on the event handler thread would deadlock");
        }
    }

    private void traceCommand(long commandId, String method, Map<String, Object> params) {
        if (log.isTraceEnabled()) {
            try {
                log.trace("[{}] {}{}", commandId, method, ellipses(logJson.writeValueAsString(params)));
            } catch (JsonProcessingException ignored) {}
        }
    }

    private static String lowercaseFirstLetter(String s) {
        return s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1);
    }

    protected abstract void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException;

    protected abstract long nextCommandId();

    int pendingCommandCount() {
        return commands.size();
    }

    public boolean isClosed() {
        return closed;
    }

    protected void close() {
        handleRpcClose();
        executor.shutdown();
    }

    boolean isDispatcherShutdown() {
        return executor.isShutdown();
    }

    /**
     * Fails everything still waiting on this connection. Called when the socket closes or faults.
     */
    protected void handleRpcClose() {
        closed = true;
        commands.values().forEach(command ->
                command.completeExceptionally(new CDPClosedException()));
        commands.clear();
        subscriptions.values().forEach(subscription ->
                subscription.fail(new CDPClosedException()));
        subscriptions.clear();
    }
}
