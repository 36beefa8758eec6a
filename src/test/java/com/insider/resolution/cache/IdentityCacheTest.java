package com.insider.resolution.cache;

import com.insider.resolution.core.model.ResolvedIdentity;
import com.insider.resolution.support.FakeTicker;
import com.insider.resolution.support.Identities;
import com.insider.resolution.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IdentityCacheTest {

    private static final CacheConfig CONFIG =
            new CacheConfig(100, Duration.ofHours(4), Duration.ofMinutes(15), true);

    @Nested
    @DisplayName("TTL classes")
    class TtlClassTests {

        @Test
        @DisplayName("Should classify a fully covered found result as positive")
        void positive() {
            assertEquals(TtlClass.POSITIVE, TtlClass.of(Identities.found("gale klappa")));
        }

        @Test
        @DisplayName("Should classify not-found and partially covered results as negative")
        void negative() {
            assertEquals(TtlClass.NEGATIVE, TtlClass.of(Identities.notFound("nobody atall")));
            assertEquals(TtlClass.NEGATIVE, TtlClass.of(Identities.foundWithGaps("gale klappa")));
        }

        @Test
        @DisplayName("Should map each class to its configured TTL")
        void ttlFor() {
            assertEquals(Duration.ofHours(4), CONFIG.ttlFor(TtlClass.POSITIVE));
            assertEquals(Duration.ofMinutes(15), CONFIG.ttlFor(TtlClass.NEGATIVE));
        }
    }

    @Nested
    @DisplayName("Cache keys")
    class CacheKeyTests {

        @ParameterizedTest
        @CsvSource({
                "'Gale Klappa', gale klappa",
                "'  GALE   KLAPPA ', gale klappa",
                "'Klappa, Gale', 'klappa, gale'"
        })
        @DisplayName("Should lowercase and collapse whitespace")
        void canonicalize(String raw, String expected) {
            assertEquals(expected, CacheKeys.canonicalize(raw));
        }

        @Test
        @DisplayName("Should reject a null key")
        void nullKey() {
            assertThrows(IllegalArgumentException.class, () -> CacheKeys.canonicalize(null));
        }
    }

    @Nested
    @DisplayName("NoOpIdentityCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always miss")
        void alwaysMiss() {
            NoOpIdentityCache cache = new NoOpIdentityCache();
            cache.put("gale klappa", Identities.found("gale klappa"));
            assertTrue(cache.get("gale klappa").isEmpty());
            assertEquals(0, cache.getStats().size());
        }
    }

    @Nested
    @DisplayName("CaffeineIdentityCache")
    class CaffeineTests {

        private final FakeTicker ticker = new FakeTicker();
        private final MutableClock clock = new MutableClock(Identities.RESOLVED_AT);
        private final CaffeineIdentityCache cache = new CaffeineIdentityCache(CONFIG, ticker, clock);

        @Test
        @DisplayName("Should return a stored result")
        void putAndGet() {
            ResolvedIdentity identity = Identities.found("gale klappa");
            cache.put("gale klappa", identity);

            Optional<ResolvedIdentity> cached = cache.get("gale klappa");
            assertTrue(cached.isPresent());
            assertEquals(identity, cached.get());
            assertTrue(cache.get("someone else").isEmpty());

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate());
        }

        @Test
        @DisplayName("Should expire negative results sooner than positive ones")
        void perClassExpiry() {
            cache.put("gale klappa", Identities.found("gale klappa"));
            cache.put("nobody atall", Identities.notFound("nobody atall"));

            ticker.advance(Duration.ofMinutes(16));
            assertTrue(cache.get("gale klappa").isPresent());
            assertTrue(cache.get("nobody atall").isEmpty());

            ticker.advance(Duration.ofHours(4));
            assertTrue(cache.get("gale klappa").isEmpty());
        }

        @Test
        @DisplayName("Should not extend the TTL on read")
        void readDoesNotExtend() {
            cache.put("nobody atall", Identities.notFound("nobody atall"));
            ticker.advance(Duration.ofMinutes(10));
            assertTrue(cache.get("nobody atall").isPresent());
            ticker.advance(Duration.ofMinutes(10));
            assertTrue(cache.get("nobody atall").isEmpty());
        }

        @Test
        @DisplayName("Should skip writes with a non-positive TTL")
        void zeroTtl() {
            cache.put("gale klappa", Identities.found("gale klappa"), Duration.ZERO);
            assertTrue(cache.get("gale klappa").isEmpty());
        }

        @Test
        @DisplayName("Should invalidate one key or all of them")
        void invalidate() {
            cache.put("a b", Identities.found("a b"));
            cache.put("c d", Identities.found("c d"));
            cache.invalidate("a b");
            assertTrue(cache.get("a b").isEmpty());
            assertTrue(cache.get("c d").isPresent());
            cache.invalidateAll();
            assertTrue(cache.get("c d").isEmpty());
        }
    }

    @Nested
    @DisplayName("FileBackedIdentityCache")
    class FileBackedTests {

        @TempDir
        Path dir;

        private final MutableClock clock = new MutableClock(Instant.parse("2025-06-30T12:00:00Z"));

        @Test
        @DisplayName("Should survive a restart")
        void survivesReload() {
            Path file = dir.resolve("cache.json");
            FileBackedIdentityCache first = new FileBackedIdentityCache(file, CONFIG, clock);
            ResolvedIdentity identity = Identities.found("gale klappa");
            first.put("gale klappa", identity);
            assertTrue(Files.exists(file));

            FileBackedIdentityCache second = new FileBackedIdentityCache(file, CONFIG, clock);
            Optional<ResolvedIdentity> reloaded = second.get("gale klappa");
            assertTrue(reloaded.isPresent());
            assertEquals(identity, reloaded.get());
        }

        @Test
        @DisplayName("Should drop entries that expired while stopped")
        void dropsExpiredOnLoad() {
            Path file = dir.resolve("cache.json");
            FileBackedIdentityCache first = new FileBackedIdentityCache(file, CONFIG, clock);
            first.put("gale klappa", Identities.found("gale klappa"));
            first.put("nobody atall", Identities.notFound("nobody atall"));

            clock.advance(Duration.ofHours(1));
            FileBackedIdentityCache second = new FileBackedIdentityCache(file, CONFIG, clock);
            assertEquals(1, second.getStats().size());
            assertTrue(second.get("gale klappa").isPresent());
            assertTrue(second.get("nobody atall").isEmpty());
        }

        @Test
        @DisplayName("Should treat an expired read as a miss and remove it")
        void expiredRead() {
            FileBackedIdentityCache cache = new FileBackedIdentityCache(dir.resolve("cache.json"), CONFIG, clock);
            cache.put("nobody atall", Identities.notFound("nobody atall"));
            clock.advance(Duration.ofMinutes(15));
            assertTrue(cache.get("nobody atall").isEmpty());
            assertEquals(0, cache.getStats().size());
            assertEquals(1, cache.getStats().missCount());
            assertEquals(1, cache.getStats().evictionCount());
        }

        @Test
        @DisplayName("Should evict the oldest entry when full")
        void evictsOldest() {
            CacheConfig small = new CacheConfig(2, Duration.ofHours(4), Duration.ofMinutes(15), true);
            FileBackedIdentityCache cache = new FileBackedIdentityCache(dir.resolve("cache.json"), small, clock);
            cache.put("first", Identities.found("first"));
            clock.advance(Duration.ofSeconds(1));
            cache.put("second", Identities.found("second"));
            clock.advance(Duration.ofSeconds(1));
            cache.put("third", Identities.found("third"));

            assertTrue(cache.get("first").isEmpty());
            assertTrue(cache.get("second").isPresent());
            assertTrue(cache.get("third").isPresent());
        }

        @Test
        @DisplayName("Should fail loudly on a corrupt file")
        void corruptFile() throws Exception {
            Path file = dir.resolve("cache.json");
            Files.writeString(file, "{ not json");
            assertThrows(UncheckedIOException.class, () -> new FileBackedIdentityCache(file, CONFIG, clock));
        }
    }
}
