package com.insider.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.insider.resolution.core.model.ResolvedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Caffeine-backed identity cache. Each entry expires after its own TTL, so found and
 * not-found results age out independently.
 */
public class CaffeineIdentityCache implements IdentityCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineIdentityCache.class);

    private final CacheConfig config;
    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    public CaffeineIdentityCache(CacheConfig config) {
        this(config, Ticker.systemTicker(), Clock.systemUTC());
    }

    /**
     * Creates a cache driven by the given ticker, for deterministic expiry in tests.
     */
    public CaffeineIdentityCache(CacheConfig config, Ticker ticker, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("CaffeineIdentityCache initialized: maxSize={}, positiveTtl={}, negativeTtl={}",
                config.maxSize(), config.positiveTtl(), config.negativeTtl());
    }

    @Override
    public Optional<ResolvedIdentity> get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        return Optional.ofNullable(entry).map(CacheEntry::value);
    }

    @Override
    public void put(String key, ResolvedIdentity value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            log.debug("Skipping cache write for '{}' with non-positive ttl {}", key, ttl);
            return;
        }
        TtlClass ttlClass = TtlClass.of(value);
        cache.put(key, new CacheEntry(value, Instant.now(clock), ttl, ttlClass));
        log.debug("Cached '{}' as {} for {}", key, ttlClass, ttl);
    }

    @Override
    public void put(String key, ResolvedIdentity value) {
        put(key, value, config.ttlFor(TtlClass.of(value)));
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Expires each entry after the TTL it was written with; reads do not extend it.
     */
    private static final class PerEntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime,
                                      long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime,
                                    long currentDuration) {
            return currentDuration;
        }
    }
}
