package com.insider.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A filer entity (typically a public company) whose ownership filings may name insiders.
 * Identifiers are unique within an entity universe and stable across retrieval strategies.
 *
 * @param id          stable identifier (e.g. the zero-padded CIK)
 * @param displayName human-readable name
 * @param sizeRank    optional size ranking, lower is larger; {@code null} when unranked
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Entity(String id, String displayName, Integer sizeRank) {

    public Entity {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
    }

    /**
     * Creates an unranked entity.
     */
    public static Entity of(String id, String displayName) {
        return new Entity(id, displayName, null);
    }
}
