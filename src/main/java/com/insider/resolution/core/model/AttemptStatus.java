package com.insider.resolution.core.model;

/**
 * Result of running one retrieval strategy.
 */
public enum AttemptStatus {
    /** Completed and produced at least one match. */
    SUCCEEDED,
    /** Completed without any match. */
    EMPTY,
    /** Could not run or could not be interpreted. */
    UNAVAILABLE,
    /** Completed with some entities missing (fetch errors or deadline). */
    PARTIAL
}
