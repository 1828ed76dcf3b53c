package com.tresComas.financialData.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tresComas.financialData.aggregator.model.CompositeRecord;
import com.tresComas.financialData.filings.model.Filing;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.time.Clock;

/**
 * Shared validation and document mapping for store implementations.
 * Subclasses only provide keyed upsert, lookup and count per collection.
 */
@Slf4j
public abstract class AbstractFinancialDataStore implements FinancialDataStore {

    public static final String STOCK_DATA = "stock_data";
    public static final String SEC_FILINGS = "sec_filings";
    public static final String OPTIONS_DATA = "options_data";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    protected AbstractFinancialDataStore(ObjectMapper objectMapper, Clock clock) {
        // ISO-8601 timestamps in stored documents
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    @Override
    public boolean saveCompositeRecord(CompositeRecord record) {
        if (record == null || record.getBasicInfo() == null) {
            log.warn("Composite record missing basicInfo, not saved");
            return false;
        }
        String symbol = record.getSymbol();
        if (symbol == null || symbol.isBlank()) {
            log.warn("Composite record missing symbol, not saved");
            return false;
        }

        Document document = toDocument(record);
        return document != null && save(STOCK_DATA, "symbol", symbol, document, "composite record");
    }

    @Override
    public boolean saveFiling(Filing filing) {
        if (filing == null) {
            log.warn("Invalid SEC filing, not saved");
            return false;
        }
        String accessionNumber = filing.getAccessionNumber();
        if (accessionNumber == null || accessionNumber.isBlank()) {
            log.warn("SEC filing missing accessionNumber, not saved");
            return false;
        }

        Document document = toDocument(filing);
        return document != null && save(SEC_FILINGS, "accessionNumber", accessionNumber, document, "SEC filing");
    }

    @Override
    public boolean saveOptionsSnapshot(String ticker, OptionsChain options) {
        if (ticker == null || ticker.isBlank() || options == null) {
            log.warn("Invalid options data, not saved - ticker: {}", ticker);
            return false;
        }

        Document optionsDocument = toDocument(options.getExpirations());
        if (optionsDocument == null) {
            return false;
        }
        Document document = new Document("symbol", ticker)
                .append("timestamp", clock.instant().toString())
                .append("options", optionsDocument);
        return save(OPTIONS_DATA, "symbol", ticker, document, "options data");
    }

    @Override
    public Document findCompositeRecord(String ticker) {
        return find(STOCK_DATA, "symbol", ticker);
    }

    @Override
    public Document findFiling(String accessionNumber) {
        return find(SEC_FILINGS, "accessionNumber", accessionNumber);
    }

    @Override
    public Document findOptionsSnapshot(String ticker) {
        return find(OPTIONS_DATA, "symbol", ticker);
    }

    @Override
    public long countFilings() {
        return count(SEC_FILINGS);
    }

    /**
     * Replaces the document whose key field equals the key, inserting it if absent.
     *
     * @return true if the document is stored afterwards
     */
    protected abstract boolean upsert(String collection, String keyField, String key, Document document);

    protected abstract Document find(String collection, String keyField, String key);

    protected abstract long count(String collection);

    private boolean save(String collection, String keyField, String key, Document document, String description) {
        try {
            boolean success = upsert(collection, keyField, key, document);
            if (success) {
                log.info("Saved {} - {}: {}", description, keyField, key);
            } else {
                log.warn("Failed to save {} - {}: {}", description, keyField, key);
            }
            return success;
        } catch (RuntimeException e) {
            log.error("Error saving {} - {}: {}", description, keyField, key, e);
            return false;
        }
    }

    /**
     * Converts a domain object to a BSON Document via its JSON form.
     */
    private Document toDocument(Object value) {
        try {
            return Document.parse(objectMapper.writeValueAsString(value));
        } catch (Exception e) {
            log.error("Failed to convert {} to Document", value.getClass().getSimpleName(), e);
            return null;
        }
    }
}
