package com.insider.resolution.metrics;

import com.insider.resolution.core.model.AttemptStatus;
import com.insider.resolution.core.model.FetchErrorReason;
import com.insider.resolution.core.model.ResolutionOutcome;
import com.insider.resolution.core.model.StrategyKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code insider.resolution.duration} Timer (tags: outcome, cacheHit)</li>
 *   <li>{@code insider.strategy.attempt} Counter (tags: strategy, status)</li>
 *   <li>{@code insider.fetch.error} Counter (tag: reason)</li>
 *   <li>{@code insider.match.score} DistributionSummary</li>
 *   <li>{@code insider.scan.entities} DistributionSummary</li>
 *   <li>{@code insider.ratelimit.wait} Timer</li>
 *   <li>{@code insider.cache.hit} Counter</li>
 *   <li>{@code insider.cache.miss} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary matchScoreSummary;
    private final DistributionSummary scannedEntitiesSummary;
    private final Timer rateLimitWaitTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.matchScoreSummary = DistributionSummary.builder("insider.match.score")
                .description("Distribution of accepted candidate match scores")
                .register(registry);
        this.scannedEntitiesSummary = DistributionSummary.builder("insider.scan.entities")
                .description("Entities fetched per exhaustive scan")
                .register(registry);
        this.rateLimitWaitTimer = Timer.builder("insider.ratelimit.wait")
                .description("Time spent waiting for a rate budget token")
                .register(registry);
        this.cacheHitCounter = Counter.builder("insider.cache.hit")
                .description("Number of identity cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("insider.cache.miss")
                .description("Number of identity cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(ResolutionOutcome outcome, boolean cacheHit, Duration duration) {
        String key = outcome.name() + ":" + cacheHit;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("insider.resolution.duration")
                        .description("Duration of identity resolutions")
                        .tag("outcome", outcome.name())
                        .tag("cacheHit", Boolean.toString(cacheHit))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementStrategyAttempt(StrategyKind strategy, AttemptStatus status) {
        String key = "attempt:" + strategy.name() + ":" + status.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("insider.strategy.attempt")
                        .description("Strategy invocations by outcome")
                        .tag("strategy", strategy.name())
                        .tag("status", status.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementFetchError(FetchErrorReason reason) {
        String key = "fetchError:" + reason.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("insider.fetch.error")
                        .description("Entities excluded from a scan")
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordMatchScore(double score) {
        matchScoreSummary.record(score);
    }

    @Override
    public void recordEntitiesScanned(int count) {
        scannedEntitiesSummary.record(count);
    }

    @Override
    public void recordRateLimitWait(Duration wait) {
        rateLimitWaitTimer.record(wait);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
