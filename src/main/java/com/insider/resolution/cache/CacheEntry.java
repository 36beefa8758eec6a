package com.insider.resolution.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.insider.resolution.core.model.ResolvedIdentity;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached identity with its write time and expiry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(ResolvedIdentity value, Instant createdAt, Duration ttl, TtlClass ttlClass) {

    public CacheEntry {
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(ttl, "ttl is required");
        Objects.requireNonNull(ttlClass, "ttlClass is required");
    }

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
