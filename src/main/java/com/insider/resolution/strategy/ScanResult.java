package com.insider.resolution.strategy;

import com.insider.resolution.core.model.CandidateMatch;
import com.insider.resolution.core.model.EntityFetchError;

import java.util.List;

/**
 * Outcome of an exhaustive scan. Per-entity failures are listed, never thrown.
 *
 * @param matches          candidates at or above the match threshold
 * @param errors           entities excluded by fetch errors or the deadline
 * @param entitiesScanned  entities whose filings were fetched and scored
 * @param deadlineExceeded whether the deadline cut the scan short
 */
public record ScanResult(List<CandidateMatch> matches, List<EntityFetchError> errors,
                         int entitiesScanned, boolean deadlineExceeded) {

    public ScanResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ScanResult empty() {
        return new ScanResult(List.of(), List.of(), 0, false);
    }
}
