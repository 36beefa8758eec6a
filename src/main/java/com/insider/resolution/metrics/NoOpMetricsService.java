package com.insider.resolution.metrics;

import com.insider.resolution.core.model.AttemptStatus;
import com.insider.resolution.core.model.FetchErrorReason;
import com.insider.resolution.core.model.ResolutionOutcome;
import com.insider.resolution.core.model.StrategyKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(ResolutionOutcome outcome, boolean cacheHit, Duration duration) {
    }

    @Override
    public void incrementStrategyAttempt(StrategyKind strategy, AttemptStatus status) {
    }

    @Override
    public void incrementFetchError(FetchErrorReason reason) {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void recordEntitiesScanned(int count) {
    }

    @Override
    public void recordRateLimitWait(Duration wait) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
