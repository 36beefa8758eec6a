package com.insider.resolution.core.model;

/**
 * Terminal outcome of an identity resolution.
 * {@link #NOT_FOUND} is a normal result, not an error.
 */
public enum ResolutionOutcome {
    RESOLVED,
    NOT_FOUND
}
