package com.insider.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A filer name observed at one entity that scored against the queried variants.
 * Produced by a retrieval strategy during a single resolution.
 */
public record CandidateMatch(
        Entity entity,
        String matchedName,
        double confidence,
        List<FilingEvidence> evidence,
        StrategyKind strategy
) {
    public CandidateMatch {
        Objects.requireNonNull(entity, "entity is required");
        Objects.requireNonNull(matchedName, "matchedName is required");
        Objects.requireNonNull(strategy, "strategy is required");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public String entityId() {
        return entity.id();
    }
}
