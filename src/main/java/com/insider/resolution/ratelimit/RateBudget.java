package com.insider.resolution.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket shared by every outbound request of a resolver.
 *
 * <p>Tokens are stored as fixed-point millitokens and refilled lazily from elapsed time.
 * All state is read and written under one lock; waiting happens outside it.</p>
 */
public class RateBudget {
    private static final Logger log = LoggerFactory.getLogger(RateBudget.class);

    private static final long SCALE = 1000;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final RateBudgetConfig config;
    private final NanoClock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final long maxMillitokens;

    private long millitokens;
    private long lastRefillNanos;

    public RateBudget(RateBudgetConfig config) {
        this(config, NanoClock.system());
    }

    public RateBudget(RateBudgetConfig config, NanoClock clock) {
        this.config = config;
        this.clock = clock;
        this.maxMillitokens = (long) config.capacity() * SCALE;
        this.millitokens = maxMillitokens;
        this.lastRefillNanos = clock.nanoTime();
    }

    public static RateBudget defaults() {
        return new RateBudget(RateBudgetConfig.defaults());
    }

    /**
     * Takes one token, waiting up to the configured acquire timeout.
     */
    public long acquire() throws InterruptedException {
        return acquire(config.acquireTimeout());
    }

    /**
     * Takes one token, waiting at most {@code timeout}.
     *
     * @return nanoseconds spent waiting
     * @throws RateLimitTimeoutException if no token became available in time
     * @throws InterruptedException      if interrupted while waiting
     */
    public long acquire(Duration timeout) throws InterruptedException {
        long start = clock.nanoTime();
        long deadline = start + Math.max(0, timeout.toNanos());
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                long now = clock.nanoTime();
                refill(now);
                if (millitokens >= SCALE) {
                    millitokens -= SCALE;
                    return now - start;
                }
                waitNanos = nanosUntilNextToken(now);
                if (now + waitNanos > deadline) {
                    log.debug("Rate budget exhausted, next token in {}ms exceeds timeout {}ms",
                            waitNanos / 1_000_000, timeout.toMillis());
                    throw new RateLimitTimeoutException(timeout);
                }
            } finally {
                lock.unlock();
            }
            clock.sleep(waitNanos);
        }
    }

    /**
     * Takes a token only if one is available right now.
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill(clock.nanoTime());
            if (millitokens >= SCALE) {
                millitokens -= SCALE;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public long availableTokens() {
        lock.lock();
        try {
            refill(clock.nanoTime());
            return millitokens / SCALE;
        } finally {
            lock.unlock();
        }
    }

    public RateBudgetConfig getConfig() {
        return config;
    }

    private void refill(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        if (elapsed >= nanosPerMillitoken() * (maxMillitokens - millitokens)) {
            millitokens = maxMillitokens;
            lastRefillNanos = now;
            return;
        }
        long added = elapsed / nanosPerMillitoken();
        if (added <= 0) {
            return;
        }
        millitokens += added;
        // advance only by the time actually converted so fractions are not lost
        lastRefillNanos += added * nanosPerMillitoken();
    }

    private long nanosUntilNextToken(long now) {
        long missing = SCALE - millitokens;
        return Math.max(1, missing * nanosPerMillitoken() - (now - lastRefillNanos));
    }

    private long nanosPerMillitoken() {
        return Math.max(1, NANOS_PER_SECOND / ((long) config.permitsPerSecond() * SCALE));
    }
}
