package com.insider.resolution.source;

import com.insider.resolution.strategy.SearchUnavailableException;

import java.util.List;

/**
 * A global search surface that finds filings mentioning a name across all entities.
 */
public interface IndexedSearchClient {

    /**
     * Searches filings for a name term.
     *
     * @param term a single name variant, searched as an exact phrase
     * @return matching filing references, possibly empty
     * @throws SearchUnavailableException if the surface is unreachable, returns an error,
     *                                    or answers in an unexpected shape
     */
    List<FilingReference> search(String term) throws SearchUnavailableException;
}
