package com.insider.resolution.metrics;

import com.insider.resolution.core.model.AttemptStatus;
import com.insider.resolution.core.model.FetchErrorReason;
import com.insider.resolution.core.model.ResolutionOutcome;
import com.insider.resolution.core.model.StrategyKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolutionDuration(ResolutionOutcome.RESOLVED, false, Duration.ofMillis(100));
                noOp.incrementStrategyAttempt(StrategyKind.INDEXED_SEARCH, AttemptStatus.SUCCEEDED);
                noOp.incrementFetchError(FetchErrorReason.TIMEOUT);
                noOp.recordMatchScore(0.9);
                noOp.recordEntitiesScanned(50);
                noOp.recordRateLimitWait(Duration.ofMillis(100));
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record resolution duration per outcome and cache hit")
        void recordResolutionDuration() {
            metrics.recordResolutionDuration(ResolutionOutcome.RESOLVED, false, Duration.ofMillis(150));
            metrics.recordResolutionDuration(ResolutionOutcome.RESOLVED, false, Duration.ofMillis(250));
            metrics.recordResolutionDuration(ResolutionOutcome.RESOLVED, true, Duration.ofMillis(1));

            Timer timer = registry.find("insider.resolution.duration")
                    .tag("outcome", "RESOLVED")
                    .tag("cacheHit", "false")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
            assertEquals(1, registry.find("insider.resolution.duration").tag("cacheHit", "true").timer().count());
        }

        @Test
        @DisplayName("Should count strategy attempts by strategy and status")
        void incrementStrategyAttempt() {
            metrics.incrementStrategyAttempt(StrategyKind.INDEXED_SEARCH, AttemptStatus.UNAVAILABLE);
            metrics.incrementStrategyAttempt(StrategyKind.INDEXED_SEARCH, AttemptStatus.UNAVAILABLE);
            metrics.incrementStrategyAttempt(StrategyKind.EXHAUSTIVE_SCAN, AttemptStatus.SUCCEEDED);

            Counter unavailable = registry.find("insider.strategy.attempt")
                    .tag("strategy", "INDEXED_SEARCH")
                    .tag("status", "UNAVAILABLE")
                    .counter();
            assertNotNull(unavailable);
            assertEquals(2.0, unavailable.count());
        }

        @Test
        @DisplayName("Should count fetch errors by reason")
        void incrementFetchError() {
            metrics.incrementFetchError(FetchErrorReason.RATE_LIMITED);

            Counter counter = registry.find("insider.fetch.error").tag("reason", "RATE_LIMITED").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should record match scores and scan sizes as distributions")
        void distributions() {
            metrics.recordMatchScore(0.9);
            metrics.recordMatchScore(1.0);
            metrics.recordEntitiesScanned(500);

            DistributionSummary scores = registry.find("insider.match.score").summary();
            assertNotNull(scores);
            assertEquals(2, scores.count());
            assertEquals(0.95, scores.mean(), 0.001);
            assertEquals(500.0, registry.find("insider.scan.entities").summary().totalAmount());
        }

        @Test
        @DisplayName("Should record rate budget waits")
        void recordRateLimitWait() {
            metrics.recordRateLimitWait(Duration.ofMillis(100));

            Timer timer = registry.find("insider.ratelimit.wait").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.find("insider.cache.hit").counter().count());
            assertEquals(1.0, registry.find("insider.cache.miss").counter().count());
        }
    }
}
