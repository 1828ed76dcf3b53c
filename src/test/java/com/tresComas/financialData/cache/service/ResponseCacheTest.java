package com.tresComas.financialData.cache.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tresComas.financialData.cache.model.CacheCategory;
import com.tresComas.financialData.cache.model.CacheSettings;
import com.tresComas.financialData.marketdata.model.TickerInfo;
import com.tresComas.financialData.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-14T12:00:00Z"));
        cache = new ResponseCache(CacheSettings.builder().build(), objectMapper, clock);
    }

    @Nested
    @DisplayName("get() / set()")
    class ReadWriteTests {

        @Test
        @DisplayName("stored value reads back equal")
        void roundTrip() {
            TickerInfo info = TickerInfo.builder()
                    .symbol("AAPL")
                    .name("Apple Inc.")
                    .marketCap(3.0e12)
                    .lastUpdated(clock.instant())
                    .build();

            assertTrue(cache.set("ticker_info_AAPL", info, CacheCategory.PRICE));
            assertEquals(info, cache.get("ticker_info_AAPL", CacheCategory.PRICE, TickerInfo.class));
        }

        @Test
        @DisplayName("generic values read back through a TypeReference")
        void genericRoundTrip() {
            cache.set("list", List.of("a", "b"), CacheCategory.DEFAULT);
            assertEquals(List.of("a", "b"), cache.get("list", CacheCategory.DEFAULT, new TypeReference<List<String>>() {
            }));
        }

        @Test
        @DisplayName("unknown key → null")
        void miss() {
            assertNull(cache.get("nothing", CacheCategory.PRICE, String.class));
        }

        @Test
        @DisplayName("set replaces the previous value")
        void overwrite() {
            cache.set("cik_AAPL", "1", CacheCategory.FILING);
            cache.set("cik_AAPL", "0000320193", CacheCategory.FILING);
            assertEquals("0000320193", cache.get("cik_AAPL", CacheCategory.FILING, String.class));
        }
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("entry is visible up to its TTL and missed after it while still stored")
        void priceExpiresAfterOneHour() {
            cache.set("k", "v", CacheCategory.PRICE);

            clock.advance(Duration.ofHours(1));
            assertEquals("v", cache.get("k", CacheCategory.PRICE, String.class));

            clock.advance(Duration.ofSeconds(1));
            assertNull(cache.get("k", CacheCategory.PRICE, String.class));
            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("freshness follows the category used on read")
        void categoryOnRead() {
            cache.set("k", "v", CacheCategory.PRICE);
            clock.advance(Duration.ofHours(2));

            assertNull(cache.get("k", CacheCategory.PRICE, String.class));
            assertEquals("v", cache.get("k", CacheCategory.HISTORICAL, String.class));
        }

        @Test
        @DisplayName("configured TTL overrides the category default")
        void configuredTtl() {
            cache = new ResponseCache(CacheSettings.builder()
                    .ttls(Map.of(CacheCategory.FILING, Duration.ofMinutes(5)))
                    .build(), objectMapper, clock);
            cache.set("k", "v", CacheCategory.FILING);

            clock.advance(Duration.ofMinutes(6));
            assertNull(cache.get("k", CacheCategory.FILING, String.class));
        }
    }

    @Nested
    @DisplayName("clear()")
    class ClearTests {

        @Test
        @DisplayName("pattern removes keys containing it and reports the count")
        void substringMatch() {
            cache.set("ticker_info_AAPL", "a", CacheCategory.PRICE);
            cache.set("historical_AAPL_1y_1d", "b", CacheCategory.HISTORICAL);
            cache.set("ticker_info_MSFT", "c", CacheCategory.PRICE);

            assertEquals(2, cache.clear("AAPL"));
            assertNull(cache.get("ticker_info_AAPL", CacheCategory.PRICE, String.class));
            assertEquals("c", cache.get("ticker_info_MSFT", CacheCategory.PRICE, String.class));
        }

        @Test
        @DisplayName("no pattern wipes everything")
        void wipeAll() {
            cache.set("a", "1", CacheCategory.PRICE);
            cache.set("b", "2", CacheCategory.PRICE);

            assertEquals(2, cache.clear(null));
            assertEquals(0, cache.clear(""));
        }
    }

    @Nested
    @DisplayName("disabled cache")
    class DisabledTests {

        @Test
        @DisplayName("cache.enabled=false → misses, set false, clear 0")
        void disabledBySetting() {
            ResponseCache disabled = new ResponseCache(CacheSettings.builder().enabled(false).build(), objectMapper, clock);

            assertFalse(disabled.isEnabled());
            assertFalse(disabled.set("k", "v", CacheCategory.PRICE));
            assertNull(disabled.get("k", CacheCategory.PRICE, String.class));
            assertEquals(0, disabled.clear(null));
        }

        @Test
        @DisplayName("backing store that cannot be built disables the cache")
        void invalidBackingStore() {
            ResponseCache disabled = new ResponseCache(CacheSettings.builder().maximumSize(-1).build(), objectMapper, clock);

            assertFalse(disabled.isEnabled());
            assertFalse(disabled.set("k", "v", CacheCategory.PRICE));
        }
    }
}
