package com.tresComas.financialData.filings.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire-level access to the regulatory filings provider.
 * A missing resource (HTTP 404) yields null; any other failure throws
 * {@link com.tresComas.financialData.common.exception.UpstreamUnavailableException}.
 */
public interface FilingsApi {

    /**
     * Ticker to CIK directory, an object of entries shaped {"cik_str": 320193, "ticker": "AAPL", "title": "..."}.
     */
    JsonNode fetchTickerDirectory();

    /**
     * Filing history for a 10-digit CIK, including the columnar "filings.recent" block.
     */
    JsonNode fetchSubmissions(String cik);

    /**
     * XBRL company facts for a 10-digit CIK, grouped by taxonomy and tag.
     */
    JsonNode fetchCompanyFacts(String cik);
}
