package com.insider.resolution.source;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A reporting-owner name found on one of an entity's recent filings.
 */
public record FilerRecord(String filerName, LocalDate filingDate, String accessionNumber) {

    public FilerRecord {
        Objects.requireNonNull(filerName, "filerName is required");
    }
}
