package com.insider.resolution.concurrent;

import com.insider.resolution.ratelimit.NanoClock;

import java.time.Duration;

/**
 * A point in monotonic time by which a resolution must finish.
 *
 * <p>Held as a start instant plus a budget so that very long durations saturate at
 * {@link Long#MAX_VALUE} nanoseconds instead of wrapping into the past.</p>
 */
public final class Deadline {

    private final long startNanos;
    private final long budgetNanos;
    private final NanoClock clock;

    private Deadline(long startNanos, long budgetNanos, NanoClock clock) {
        this.startNanos = startNanos;
        this.budgetNanos = budgetNanos;
        this.clock = clock;
    }

    public static Deadline after(Duration duration) {
        return after(duration, NanoClock.system());
    }

    public static Deadline after(Duration duration, NanoClock clock) {
        return new Deadline(clock.nanoTime(), saturatedNanos(duration), clock);
    }

    /**
     * Time left, never negative.
     */
    public Duration remaining() {
        return Duration.ofNanos(Math.max(0, budgetNanos - elapsedNanos()));
    }

    public boolean isExpired() {
        return elapsedNanos() >= budgetNanos;
    }

    /**
     * The shorter of the remaining time and {@code cap}.
     */
    public Duration remainingOrAtMost(Duration cap) {
        Duration remaining = remaining();
        return remaining.compareTo(cap) < 0 ? remaining : cap;
    }

    /**
     * A deadline {@code extra} past this one, used for the grace period.
     */
    public Deadline extendedBy(Duration extra) {
        long extraNanos = saturatedNanos(extra);
        long budget = budgetNanos > Long.MAX_VALUE - extraNanos ? Long.MAX_VALUE : budgetNanos + extraNanos;
        return new Deadline(startNanos, budget, clock);
    }

    private long elapsedNanos() {
        return Math.max(0, clock.nanoTime() - startNanos);
    }

    private static long saturatedNanos(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return 0;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return "Deadline{remaining=" + remaining().toMillis() + "ms}";
    }
}
