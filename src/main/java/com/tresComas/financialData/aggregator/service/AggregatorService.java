package com.tresComas.financialData.aggregator.service;

import com.tresComas.financialData.aggregator.model.CompositeRecord;
import com.tresComas.financialData.aggregator.model.SecData;
import com.tresComas.financialData.cache.service.ResponseCache;
import com.tresComas.financialData.filings.model.Filing;
import com.tresComas.financialData.filings.service.FilingsSource;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import com.tresComas.financialData.marketdata.service.MarketDataSource;
import com.tresComas.financialData.repository.FinancialDataStore;
import com.tresComas.financialData.validation.service.DataValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregator service - builds the composite record for one security.
 *
 * Workflow steps:
 * BASIC_INFO -> HISTORICAL (1y, 1d) -> OPTIONS (snapshot saved) -> IMPLIED_VOLATILITY
 * -> CIK -> RECENT_10K (saved) -> RECENT_8K (each saved) -> KEY_FINANCIALS -> SAVE_COMPOSITE
 *
 * The CIK is resolved once; without one the three filings steps are skipped.
 * A step that yields nothing leaves its field at the default. An unexpected failure stops
 * the remaining steps, but whatever was gathered is still saved and returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregatorService {

    private final MarketDataSource marketDataSource;
    private final FilingsSource filingsSource;
    private final FinancialDataStore store;
    private final ResponseCache cache;
    private final DataValidator validator;
    private final Clock clock;

    /**
     * Gathers market data and filings for a ticker into one record.
     *
     * @param ticker Ticker symbol
     * @return Composite record, possibly partial; never null
     * @throws com.tresComas.financialData.validation.exception.InvalidInputException if the ticker is invalid
     */
    public CompositeRecord getCompositeRecord(String ticker) {
        String symbol = validator.validateTicker(ticker);
        log.info("Starting aggregation - ticker: {}", symbol);

        CompositeRecord record = CompositeRecord.builder()
                .symbol(symbol)
                .lastUpdated(clock.instant())
                .build();

        try {
            record.setBasicInfo(marketDataSource.getTickerInfo(symbol));

            record.setHistoricalData(marketDataSource.getHistoricalSeries(symbol));

            OptionsChain options = marketDataSource.getOptionsChain(symbol);
            if (options != null) {
                record.setOptionsData(options);
                store.saveOptionsSnapshot(symbol, options);
                record.setImpliedVolatility(marketDataSource.getImpliedVolatility(symbol, options));
            }

            SecData secData = record.getSecData();
            String cik = filingsSource.getCik(symbol);
            if (cik == null) {
                log.warn("Skipping SEC data, no CIK - ticker: {}", symbol);
            } else {
                Filing recent10K = filingsSource.getRecent10K(symbol, cik);
                if (recent10K != null) {
                    secData.setRecent10K(recent10K);
                    store.saveFiling(recent10K);
                }

                List<Filing> recent8K = filingsSource.getRecent8K(symbol, cik, FilingsSource.DEFAULT_8K_COUNT);
                if (recent8K != null && !recent8K.isEmpty()) {
                    secData.setRecent8K(new ArrayList<>(recent8K));
                    recent8K.forEach(store::saveFiling);
                }

                secData.setKeyFinancials(filingsSource.extractKeyFinancials(symbol, cik));
            }
        } catch (Exception e) {
            log.error("Aggregation stopped early, returning partial record - ticker: {}", symbol, e);
        }

        boolean saved = store.saveCompositeRecord(record);
        log.info("Finished aggregation - ticker: {}, saved: {}, hasBasicInfo: {}, hasOptions: {}, hasFinancials: {}",
                symbol, saved, record.getBasicInfo() != null, record.getOptionsData() != null,
                record.getSecData().getKeyFinancials() != null);
        return record;
    }

    /**
     * Removes cached responses whose key contains the pattern, or all of them when it is blank.
     *
     * @return Number of cache entries removed
     */
    public int clearCache(String pattern) {
        return cache.clear(pattern);
    }
}
