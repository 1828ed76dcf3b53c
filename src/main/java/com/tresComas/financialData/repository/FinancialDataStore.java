package com.tresComas.financialData.repository;

import com.tresComas.financialData.aggregator.model.CompositeRecord;
import com.tresComas.financialData.filings.model.Filing;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import org.bson.Document;

/**
 * Document store for aggregation results.
 *
 * Saves are upserts keyed by ticker (composite records, options snapshots) or accession number
 * (filings). A save returns true when a document with the new content is present afterwards;
 * failures are logged and reported as false.
 */
public interface FinancialDataStore extends AutoCloseable {

    void open();

    boolean saveCompositeRecord(CompositeRecord record);

    boolean saveFiling(Filing filing);

    boolean saveOptionsSnapshot(String ticker, OptionsChain options);

    Document findCompositeRecord(String ticker);

    Document findFiling(String accessionNumber);

    Document findOptionsSnapshot(String ticker);

    long countFilings();

    @Override
    void close();
}
