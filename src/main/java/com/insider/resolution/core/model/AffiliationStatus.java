package com.insider.resolution.core.model;

/**
 * Whether an insider affiliation is believed to still be held.
 */
public enum AffiliationStatus {
    CURRENT,
    FORMER,
    UNKNOWN
}
