package com.insider.resolution.source;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One hit from an indexed filing search: a filer name observed on a filing of an entity.
 *
 * @param entityId        issuer identifier
 * @param entityName      issuer display name, may be {@code null}
 * @param filerName       reporting-owner name as printed on the filing
 * @param filingDate      filing date, may be {@code null}
 * @param accessionNumber filing accession number, may be {@code null}
 */
public record FilingReference(String entityId, String entityName, String filerName,
                              LocalDate filingDate, String accessionNumber) {

    public FilingReference {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(filerName, "filerName is required");
    }
}
