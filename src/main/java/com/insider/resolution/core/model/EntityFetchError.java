package com.insider.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Records that one entity was excluded from a scan, so callers can report partial coverage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityFetchError(String entityId, FetchErrorReason reason, String message) {

    public EntityFetchError {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(reason, "reason is required");
        message = message != null ? message : reason.name().toLowerCase();
    }

    public static EntityFetchError timeout(String entityId, String message) {
        return new EntityFetchError(entityId, FetchErrorReason.TIMEOUT, message);
    }

    public static EntityFetchError rateLimited(String entityId, String message) {
        return new EntityFetchError(entityId, FetchErrorReason.RATE_LIMITED, message);
    }

    public static EntityFetchError failed(String entityId, String message) {
        return new EntityFetchError(entityId, FetchErrorReason.FAILED, message);
    }
}
