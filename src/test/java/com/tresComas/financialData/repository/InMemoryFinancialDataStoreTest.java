package com.tresComas.financialData.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tresComas.financialData.aggregator.model.CompositeRecord;
import com.tresComas.financialData.filings.model.Filing;
import com.tresComas.financialData.marketdata.model.OptionContract;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import com.tresComas.financialData.marketdata.model.OptionsExpiration;
import com.tresComas.financialData.marketdata.model.TickerInfo;
import com.tresComas.financialData.support.MutableClock;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFinancialDataStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-14T12:00:00Z");

    private FinancialDataStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFinancialDataStore(new ObjectMapper().findAndRegisterModules(), new MutableClock(NOW));
        store.open();
    }

    @Test
    @DisplayName("saving the same accession number twice keeps one document with the latest content")
    void filingUpsert() {
        assertTrue(store.saveFiling(filing("2023-11-03")));
        assertTrue(store.saveFiling(filing("2023-11-04")));

        assertEquals(1, store.countFilings());
        assertEquals("2023-11-04", store.findFiling("0000320193-23-000106").getString("filingDate"));
    }

    @Test
    @DisplayName("filing without accession number is rejected")
    void filingWithoutKey() {
        assertFalse(store.saveFiling(Filing.builder().ticker("AAPL").formType("10-K").build()));
        assertFalse(store.saveFiling(null));
        assertEquals(0, store.countFilings());
    }

    @Test
    @DisplayName("composite record is stored by symbol with ISO timestamps")
    void compositeRecord() {
        CompositeRecord record = CompositeRecord.builder()
                .symbol("AAPL")
                .basicInfo(TickerInfo.builder().symbol("AAPL").name("Apple Inc.").lastUpdated(NOW).build())
                .lastUpdated(NOW)
                .build();

        assertTrue(store.saveCompositeRecord(record));

        Document saved = store.findCompositeRecord("AAPL");
        assertEquals("AAPL", saved.getString("symbol"));
        assertEquals("2024-06-14T12:00:00Z", saved.getString("lastUpdated"));
        assertNotNull(saved.get("secData", Document.class));
    }

    @Test
    @DisplayName("composite record without basic info is rejected")
    void compositeWithoutBasicInfo() {
        assertFalse(store.saveCompositeRecord(CompositeRecord.builder().symbol("AAPL").build()));
        assertNull(store.findCompositeRecord("AAPL"));
    }

    @Test
    @DisplayName("options snapshot wraps the chain with symbol and timestamp")
    void optionsSnapshot() {
        OptionsChain chain = OptionsChain.builder()
                .symbol("AAPL")
                .expirations(Map.of("2024-06-21", OptionsExpiration.builder()
                        .calls(List.of(OptionContract.builder().contractSymbol("AAPL240621C00190000").strike(190).build()))
                        .build()))
                .build();

        assertTrue(store.saveOptionsSnapshot("AAPL", chain));

        Document snapshot = store.findOptionsSnapshot("AAPL");
        assertEquals("AAPL", snapshot.getString("symbol"));
        assertEquals(NOW.toString(), snapshot.getString("timestamp"));
        assertTrue(snapshot.get("options", Document.class).containsKey("2024-06-21"));
    }

    private static Filing filing(String filingDate) {
        return Filing.builder()
                .ticker("AAPL")
                .cik("0000320193")
                .formType("10-K")
                .accessionNumber("0000320193-23-000106")
                .filingDate(filingDate)
                .primaryDocument("aapl-20230930.htm")
                .build();
    }
}
