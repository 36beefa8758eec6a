package com.insider.resolution.api;

/**
 * Steps of a single resolution, in the order the orchestrator may visit them.
 */
public enum ResolutionState {
    IDLE,
    CACHE_CHECK,
    HIT_RETURN,
    NORMALIZE,
    TRY_INDEXED,
    TRY_EXHAUSTIVE,
    AGGREGATE,
    CACHE_STORE,
    DONE
}
