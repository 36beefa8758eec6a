package com.insider.resolution.ratelimit;

import java.time.Duration;

/**
 * Configuration for the outbound request budget.
 *
 * <pre>
 * insider-resolution:
 *   rate-limit:
 *     permits-per-second: 10
 *     capacity: 10
 *     acquire-timeout-seconds: 30
 * </pre>
 *
 * @param permitsPerSecond sustained request rate shared by every strategy
 * @param capacity         maximum burst (tokens in the bucket)
 * @param acquireTimeout   longest a single request waits for a token
 */
public record RateBudgetConfig(
        int permitsPerSecond,
        int capacity,
        Duration acquireTimeout
) {
    public RateBudgetConfig {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("permitsPerSecond must be positive, got " + permitsPerSecond);
        }
        if (capacity <= 0) {
            capacity = permitsPerSecond;
        }
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            acquireTimeout = Duration.ofSeconds(30);
        }
    }

    /**
     * 10 requests per second with a burst of 10, the published EDGAR fair-access limit.
     */
    public static RateBudgetConfig defaults() {
        return new RateBudgetConfig(10, 10, Duration.ofSeconds(30));
    }
}
