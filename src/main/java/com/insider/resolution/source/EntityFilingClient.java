package com.insider.resolution.source;

import java.io.IOException;
import java.util.List;

/**
 * Per-entity access to recent filings, used by the exhaustive scan.
 */
public interface EntityFilingClient {

    /**
     * Returns the reporting-owner names on the entity's recent ownership filings.
     *
     * @throws IOException if the entity's filings could not be fetched
     */
    List<FilerRecord> fetchRecentFilers(String entityId) throws IOException;
}
