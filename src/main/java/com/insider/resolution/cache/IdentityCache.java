package com.insider.resolution.cache;

import com.insider.resolution.core.model.ResolvedIdentity;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache of resolution results keyed by canonical query (see {@link CacheKeys}).
 * An entry read past its time-to-live is a miss and is removed.
 */
public interface IdentityCache {

    /**
     * Gets a cached result.
     *
     * @param key canonical query key
     * @return the cached identity, or empty if absent or expired
     */
    Optional<ResolvedIdentity> get(String key);

    /**
     * Caches a result for an explicit time-to-live. A non-positive TTL stores nothing.
     */
    void put(String key, ResolvedIdentity value, Duration ttl);

    /**
     * Caches a result with the TTL of its {@link TtlClass}.
     */
    void put(String key, ResolvedIdentity value);

    void invalidate(String key);

    void invalidateAll();

    CacheStats getStats();
}
