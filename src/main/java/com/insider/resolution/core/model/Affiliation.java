package com.insider.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * An entity at which the resolved identity holds or held a reporting role.
 *
 * @param entity            the filer entity
 * @param status            current, former or unknown, judged from the most recent evidence
 * @param confidence        best match confidence for this entity
 * @param matchedName       filer name that produced the best confidence
 * @param alternateNames    other filer names matched at this entity, sorted
 * @param lastFilingDate    most recent dated evidence, {@code null} if none was dated
 * @param filingCount       number of distinct supporting filings
 * @param strategy          strategy that produced the best match
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Affiliation(
        Entity entity,
        AffiliationStatus status,
        double confidence,
        String matchedName,
        List<String> alternateNames,
        LocalDate lastFilingDate,
        int filingCount,
        StrategyKind strategy
) {
    public Affiliation {
        Objects.requireNonNull(entity, "entity is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(matchedName, "matchedName is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
        alternateNames = alternateNames != null ? List.copyOf(alternateNames) : List.of();
    }

    public String entityId() {
        return entity.id();
    }

    public Affiliation withStatus(AffiliationStatus newStatus) {
        if (newStatus == status) {
            return this;
        }
        return new Affiliation(entity, newStatus, confidence, matchedName, alternateNames, lastFilingDate,
                filingCount, strategy);
    }
}
