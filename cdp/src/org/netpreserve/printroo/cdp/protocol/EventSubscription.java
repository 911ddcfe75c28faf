package org.netpreserve.printroo.cdp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.printroo.util.CountdownTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * A one-shot wait for the first event of a type that satisfies a matcher.
 */
public class EventSubscription<T> {
    private static final Logger log = LoggerFactory.getLogger(EventSubscription.class);
    private final CDPBase owner;
    private final String eventName;
    private final Class<T> eventClass;
    private final Predicate<T> matcher;
    private final CompletableFuture<T> future = new CompletableFuture<>();

    EventSubscription(CDPBase owner, String eventName, Class<T> eventClass, Predicate<T> matcher) {
        this.owner = owner;
        this.eventName = eventName;
        this.eventClass = eventClass;
        this.matcher = matcher;
    }

    public String eventName() {
        return eventName;
    }

    /**
     * Called on the dispatcher thread. Returns true if the event fulfilled this subscription.
     */
    boolean offer(JsonNode params) {
        if (future.isDone()) return true;
        T event;
        try {
            event = RPC.JSON.treeToValue(params, eventClass);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed {} event: {}", eventName, e.getOriginalMessage());
            return false;
        }
        boolean matches;
        try {
            matches = matcher.test(event);
        } catch (RuntimeException e) {
            log.error("{} matcher threw", eventName, e);
            return false;
        }
        return matches && future.complete(event);
    }

    void fail(Throwable t) {
        future.completeExceptionally(t);
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Blocks until the event arrives.
     *
     * @throws CDPTimeoutException if neither the timeout nor the countdown allow waiting any longer
     * @throws CDPClosedException  if the connection closed first
     */
    public T await(@Nullable Duration timeout, @Nullable CountdownTimer countdown) {
        Duration bound = CountdownTimer.bound(timeout, countdown);
        if (bound != null && bound.isZero() && !future.isDone()) {
            throw new CDPTimeoutException("No time left to wait for " + eventName);
        }
        return CDPBase.await(future, bound, eventName);
    }

    /**
     * Stops waiting. Safe to call after the event arrived.
     */
    public void cancel() {
        future.cancel(false);
        owner.unsubscribe(this);
    }
}
