package com.insider.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * What a resolution tried, so callers can tell "no positions" from "could not fully search".
 *
 * @param variantsTried       name variants generated from the query
 * @param strategiesAttempted strategies run, in order
 * @param entityErrors        entities excluded by fetch errors or the deadline
 * @param entitiesScanned     entities successfully fetched by the exhaustive scan
 * @param deadlineExceeded    whether the call deadline cut work short
 * @param cacheHit            whether this result was served from the cache
 * @param entityLimit         cap on scanned entities when the exhaustive scan was truncated by one, else null
 * @param fallbackSkipped     whether an empty index answer was returned without the exhaustive scan
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolutionDiagnostics(
        List<String> variantsTried,
        List<StrategyAttempt> strategiesAttempted,
        List<EntityFetchError> entityErrors,
        int entitiesScanned,
        boolean deadlineExceeded,
        boolean cacheHit,
        Integer entityLimit,
        boolean fallbackSkipped
) {
    public ResolutionDiagnostics {
        variantsTried = variantsTried != null ? List.copyOf(variantsTried) : List.of();
        strategiesAttempted = strategiesAttempted != null ? List.copyOf(strategiesAttempted) : List.of();
        entityErrors = entityErrors != null ? List.copyOf(entityErrors) : List.of();
    }

    public static ResolutionDiagnostics empty() {
        return new ResolutionDiagnostics(List.of(), List.of(), List.of(), 0, false, false, null, false);
    }

    /**
     * True when some part of the search space could not be covered.
     */
    public boolean partialCoverage() {
        return deadlineExceeded
                || entityLimit != null
                || fallbackSkipped
                || !entityErrors.isEmpty()
                || strategiesAttempted.stream().noneMatch(a ->
                        a.status() == AttemptStatus.SUCCEEDED || a.status() == AttemptStatus.EMPTY);
    }

    /**
     * Whether this result searched at least as much as a request with the given scope would.
     * A result cut down by an entity limit does not answer a request with a larger or no limit,
     * and one that skipped the fallback scan does not answer a request that allows it.
     *
     * @param requestedEntityLimit the request's entity cap, null when uncapped
     * @param fallbackOnEmpty      whether the request scans exhaustively after an empty index answer
     */
    public boolean coversScope(Integer requestedEntityLimit, boolean fallbackOnEmpty) {
        if (fallbackSkipped && fallbackOnEmpty) {
            return false;
        }
        return entityLimit == null
                || (requestedEntityLimit != null && requestedEntityLimit <= entityLimit);
    }

    public boolean attempted(StrategyKind strategy) {
        return strategiesAttempted.stream().anyMatch(a -> a.strategy() == strategy);
    }

    public ResolutionDiagnostics asCacheHit() {
        return new ResolutionDiagnostics(variantsTried, strategiesAttempted, entityErrors,
                entitiesScanned, deadlineExceeded, true, entityLimit, fallbackSkipped);
    }
}
