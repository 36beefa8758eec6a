package com.insider.resolution.cache;

import com.insider.resolution.core.model.ResolvedIdentity;

import java.time.Duration;
import java.util.Optional;

/**
 * No-op cache implementation. Used as the default when caching is disabled.
 */
public class NoOpIdentityCache implements IdentityCache {

    @Override
    public Optional<ResolvedIdentity> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, ResolvedIdentity value, Duration ttl) {
        // no-op
    }

    @Override
    public void put(String key, ResolvedIdentity value) {
        // no-op
    }

    @Override
    public void invalidate(String key) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
