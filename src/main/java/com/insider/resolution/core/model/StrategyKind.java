package com.insider.resolution.core.model;

/**
 * The retrieval strategies that can produce candidate matches.
 */
public enum StrategyKind {
    /** Global indexed (full-text) search surface queried by name term. */
    INDEXED_SEARCH,
    /** Per-entity scan over an entity universe. */
    EXHAUSTIVE_SCAN
}
