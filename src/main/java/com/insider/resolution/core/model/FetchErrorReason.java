package com.insider.resolution.core.model;

/**
 * Why a single entity could not be fetched during a scan.
 */
public enum FetchErrorReason {
    /** The call deadline elapsed before the fetch started or completed. */
    TIMEOUT,
    /** No rate budget token could be acquired before the deadline. */
    RATE_LIMITED,
    /** The fetch itself failed (transport error, bad payload, ...). */
    FAILED
}
