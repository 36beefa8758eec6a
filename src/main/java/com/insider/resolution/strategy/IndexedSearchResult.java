package com.insider.resolution.strategy;

import com.insider.resolution.core.model.CandidateMatch;

import java.util.List;

/**
 * Outcome of an indexed search that had at least one successful query.
 *
 * @param matches        candidates at or above the match threshold
 * @param queriesIssued  number of variant queries attempted
 * @param queriesFailed  number of those that failed
 * @param referencesSeen distinct filing references returned
 */
public record IndexedSearchResult(List<CandidateMatch> matches, int queriesIssued, int queriesFailed,
                                  int referencesSeen) {

    public IndexedSearchResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public boolean partial() {
        return queriesFailed > 0;
    }
}
