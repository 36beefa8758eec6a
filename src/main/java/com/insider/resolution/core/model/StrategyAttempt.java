package com.insider.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Diagnostic record of one strategy invocation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategyAttempt(StrategyKind strategy, AttemptStatus status, int matchCount, String detail) {

    public StrategyAttempt {
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(status, "status is required");
    }

    public static StrategyAttempt unavailable(StrategyKind strategy, String detail) {
        return new StrategyAttempt(strategy, AttemptStatus.UNAVAILABLE, 0, detail);
    }
}
