package com.insider.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One filing that supports a candidate match.
 *
 * @param accessionNumber filing accession number, may be {@code null} when the source omits it
 * @param filingDate      filing date, may be {@code null}
 * @param filerName       the reporting-owner name exactly as it appears on the filing
 * @param source          strategy that observed the filing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilingEvidence(String accessionNumber, LocalDate filingDate, String filerName,
                             StrategyKind source) {

    public FilingEvidence {
        Objects.requireNonNull(filerName, "filerName is required");
        Objects.requireNonNull(source, "source is required");
    }
}
