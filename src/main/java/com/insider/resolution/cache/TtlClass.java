package com.insider.resolution.cache;

import com.insider.resolution.core.model.ResolvedIdentity;

/**
 * Expiry class of a cached result.
 */
public enum TtlClass {
    /** A found identity backed by a fully covered search. */
    POSITIVE,
    /** Not found, or found with coverage gaps; retried sooner. */
    NEGATIVE;

    public static TtlClass of(ResolvedIdentity identity) {
        return identity.found() && !identity.diagnostics().partialCoverage() ? POSITIVE : NEGATIVE;
    }
}
