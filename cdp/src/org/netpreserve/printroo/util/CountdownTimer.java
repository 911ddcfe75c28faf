package org.netpreserve.printroo.util;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * A pausable deadline shared by every blocking wait of one conversion.
 * <p>
 * Elapsed time is computed from clock reads when asked for, there is no background thread. The timer is created
 * paused; {@link #start()} starts it and resumes it after a {@link #stop()}.
 */
public class CountdownTimer {
    public enum State {RUNNING, PAUSED}

    private final Duration budget;
    private final LongSupplier nanoClock;
    private long elapsedNanos;
    private long startedAtNanos;
    private State state = State.PAUSED;

    public CountdownTimer(Duration budget) {
        this(budget, System::nanoTime);
    }

    CountdownTimer(Duration budget, LongSupplier nanoClock) {
        if (budget.isNegative()) throw new IllegalArgumentException("Negative budget: " + budget);
        this.budget = budget;
        this.nanoClock = nanoClock;
    }

    public static CountdownTimer started(Duration budget) {
        var timer = new CountdownTimer(budget);
        timer.start();
        return timer;
    }

    public synchronized void start() {
        if (state == State.RUNNING) return;
        startedAtNanos = nanoClock.getAsLong();
        state = State.RUNNING;
    }

    public synchronized void stop() {
        if (state == State.PAUSED) return;
        elapsedNanos += nanoClock.getAsLong() - startedAtNanos;
        state = State.PAUSED;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized Duration elapsed() {
        long elapsed = elapsedNanos;
        if (state == State.RUNNING) {
            elapsed += nanoClock.getAsLong() - startedAtNanos;
        }
        return Duration.ofNanos(elapsed);
    }

    public Duration remaining() {
        Duration remaining = budget.minus(elapsed());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    public Duration budget() {
        return budget;
    }

    /**
     * Returns the smaller of the given operation timeout and the remaining time. A null timeout means the
     * operation has no bound of its own.
     */
    public Duration bound(@Nullable Duration operationTimeout) {
        Duration remaining = remaining();
        if (operationTimeout == null || operationTimeout.compareTo(remaining) > 0) {
            return remaining;
        }
        return operationTimeout;
    }

    /**
     * Like {@link #bound(Duration)} but tolerates a missing timer. Returns null when neither bound exists.
     */
    public static @Nullable Duration bound(@Nullable Duration operationTimeout, @Nullable CountdownTimer countdown) {
        if (countdown == null) return operationTimeout;
        return countdown.bound(operationTimeout);
    }

    @Override
    public String toString() {
        return "CountdownTimer{budget=" + budget.toMillis() + "ms, remaining=" + remaining().toMillis() + "ms, " +
               state + "}";
    }
}
