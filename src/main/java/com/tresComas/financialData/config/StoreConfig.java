package com.tresComas.financialData.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tresComas.financialData.repository.AbstractFinancialDataStore;
import com.tresComas.financialData.repository.FinancialDataStore;
import com.tresComas.financialData.repository.InMemoryFinancialDataStore;
import com.tresComas.financialData.repository.MongoFinancialDataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;

/**
 * Selects the document store. The container opens it on startup and closes it on shutdown.
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Value("${store.type:mongo}")
    private String storeType;

    @Value("${store.mongo.uri:mongodb://localhost:27017/}")
    private String mongoUri;

    @Value("${store.mongo.database:tres_comas_capital}")
    private String mongoDatabase;

    @Value("${store.mongo.collections.stock-data:stock_data}")
    private String stockDataCollection;

    @Value("${store.mongo.collections.sec-filings:sec_filings}")
    private String secFilingsCollection;

    @Value("${store.mongo.collections.options-data:options_data}")
    private String optionsDataCollection;

    @Bean(initMethod = "open", destroyMethod = "close")
    public FinancialDataStore financialDataStore(ObjectMapper objectMapper, Clock clock) {
        if ("memory".equalsIgnoreCase(storeType)) {
            return new InMemoryFinancialDataStore(objectMapper, clock);
        }
        if (!"mongo".equalsIgnoreCase(storeType)) {
            throw new IllegalStateException("Unknown store.type '" + storeType + "', expected 'mongo' or 'memory'");
        }

        log.info("Configuring MongoDB store - database: {}", mongoDatabase);
        return new MongoFinancialDataStore(mongoUri, mongoDatabase, Map.of(
                AbstractFinancialDataStore.STOCK_DATA, stockDataCollection,
                AbstractFinancialDataStore.SEC_FILINGS, secFilingsCollection,
                AbstractFinancialDataStore.OPTIONS_DATA, optionsDataCollection),
                objectMapper, clock);
    }
}
