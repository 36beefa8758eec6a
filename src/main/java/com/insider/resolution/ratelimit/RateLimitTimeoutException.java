package com.insider.resolution.ratelimit;

import java.time.Duration;

/**
 * Thrown when no rate-budget token became available within the caller's timeout.
 * The request is not made; the limit is never bypassed.
 */
public class RateLimitTimeoutException extends RuntimeException {

    private final Duration timeout;

    public RateLimitTimeoutException(Duration timeout) {
        super("No rate budget token available within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public RateLimitTimeoutException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = Duration.ZERO;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
