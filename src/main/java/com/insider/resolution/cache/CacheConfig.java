package com.insider.resolution.cache;

import java.time.Duration;

/**
 * Configuration for the identity cache.
 *
 * @param maxSize     maximum number of entries
 * @param positiveTtl time-to-live of found, fully covered identities
 * @param negativeTtl time-to-live of not-found or partially covered results
 * @param enabled     whether caching is enabled
 */
public record CacheConfig(int maxSize, Duration positiveTtl, Duration negativeTtl, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (positiveTtl == null || positiveTtl.isNegative() || positiveTtl.isZero()) {
            throw new IllegalArgumentException("positiveTtl must be > 0");
        }
        if (negativeTtl == null || negativeTtl.isNegative() || negativeTtl.isZero()) {
            throw new IllegalArgumentException("negativeTtl must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 entries, 4h positive TTL, 15min negative TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofHours(4), Duration.ofMinutes(15), true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), Duration.ofSeconds(1), false);
    }

    public Duration ttlFor(TtlClass ttlClass) {
        return ttlClass == TtlClass.POSITIVE ? positiveTtl : negativeTtl;
    }
}
