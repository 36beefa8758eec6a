package com.insider.resolution.metrics;

import com.insider.resolution.core.model.AttemptStatus;
import com.insider.resolution.core.model.FetchErrorReason;
import com.insider.resolution.core.model.ResolutionOutcome;
import com.insider.resolution.core.model.StrategyKind;

import java.time.Duration;

/**
 * Interface for recording insider resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void recordResolutionDuration(ResolutionOutcome outcome, boolean cacheHit, Duration duration);

    void incrementStrategyAttempt(StrategyKind strategy, AttemptStatus status);

    void incrementFetchError(FetchErrorReason reason);

    void recordMatchScore(double score);

    void recordEntitiesScanned(int count);

    void recordRateLimitWait(Duration wait);

    void recordCacheHit();

    void recordCacheMiss();
}
