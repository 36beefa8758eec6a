package com.insider.resolution.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.insider.resolution.core.model.ResolvedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity cache persisted as a single JSON document, so results survive restarts.
 *
 * <p>Layout: an object mapping each canonical query to
 * {@code {"value": ResolvedIdentity, "createdAt": ..., "ttl": ..., "ttlClass": ...}}.
 * The file is rewritten through a temporary file and an atomic move on every change.
 * Entries already expired when the file is loaded are dropped.</p>
 */
public class FileBackedIdentityCache implements IdentityCache {
    private static final Logger log = LoggerFactory.getLogger(FileBackedIdentityCache.class);

    private static final TypeReference<Map<String, CacheEntry>> LAYOUT = new TypeReference<>() {
    };

    private final Path file;
    private final CacheConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public FileBackedIdentityCache(Path file, CacheConfig config) {
        this(file, config, Clock.systemUTC());
    }

    public FileBackedIdentityCache(Path file, CacheConfig config, Clock clock) {
        this.file = file;
        this.config = config;
        this.clock = clock;
        this.objectMapper = createObjectMapper();
        load();
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Optional<ResolvedIdentity> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpiredAt(Instant.now(clock))) {
            if (entries.remove(key, entry)) {
                evictions.incrementAndGet();
                persist();
            }
            misses.incrementAndGet();
            log.debug("Cache entry '{}' expired at {}", key, entry.expiresAt());
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, ResolvedIdentity value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            log.debug("Skipping cache write for '{}' with non-positive ttl {}", key, ttl);
            return;
        }
        entries.put(key, new CacheEntry(value, Instant.now(clock), ttl, TtlClass.of(value)));
        evictOverflow();
        persist();
    }

    @Override
    public void put(String key, ResolvedIdentity value) {
        put(key, value, config.ttlFor(TtlClass.of(value)));
    }

    @Override
    public void invalidate(String key) {
        if (entries.remove(key) != null) {
            persist();
        }
    }

    @Override
    public void invalidateAll() {
        entries.clear();
        persist();
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), evictions.get(), entries.size());
    }

    public Path getFile() {
        return file;
    }

    private void evictOverflow() {
        while (entries.size() > config.maxSize()) {
            entries.entrySet().stream()
                    .min(Map.Entry.comparingByValue(
                            (a, b) -> a.createdAt().compareTo(b.createdAt())))
                    .ifPresent(oldest -> {
                        if (entries.remove(oldest.getKey(), oldest.getValue())) {
                            evictions.incrementAndGet();
                        }
                    });
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            Map<String, CacheEntry> stored = objectMapper.readValue(file.toFile(), LAYOUT);
            Instant now = Instant.now(clock);
            stored.forEach((key, entry) -> {
                if (!entry.isExpiredAt(now)) {
                    entries.put(key, entry);
                }
            });
            log.info("Loaded {} of {} cache entries from {}", entries.size(), stored.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read identity cache file " + file, e);
        }
    }

    private void persist() {
        synchronized (writeLock) {
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
                objectMapper.writeValue(tmp.toFile(), new TreeMap<>(entries));
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write identity cache file " + file, e);
            }
        }
    }
}
