package com.insider.resolution.cache;

import java.util.Locale;

/**
 * Cache key derivation for raw queries.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * Lowercases, trims and collapses internal whitespace, so "Gale  Klappa " and
     * "gale klappa" share an entry.
     */
    public static String canonicalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Cache key must not be null");
        }
        return raw.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
