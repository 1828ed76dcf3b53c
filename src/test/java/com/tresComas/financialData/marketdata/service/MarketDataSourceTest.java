package com.tresComas.financialData.marketdata.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tresComas.financialData.cache.model.CacheSettings;
import com.tresComas.financialData.cache.service.ResponseCache;
import com.tresComas.financialData.common.exception.UpstreamUnavailableException;
import com.tresComas.financialData.marketdata.client.MarketDataApi;
import com.tresComas.financialData.marketdata.dto.HistoryRequest;
import com.tresComas.financialData.marketdata.dto.RawPriceSeries;
import com.tresComas.financialData.marketdata.model.HistoricalSeries;
import com.tresComas.financialData.marketdata.model.ImpliedVolatility;
import com.tresComas.financialData.marketdata.model.OptionContract;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import com.tresComas.financialData.marketdata.model.OptionsExpiration;
import com.tresComas.financialData.marketdata.model.TickerInfo;
import com.tresComas.financialData.support.CountingRateLimiter;
import com.tresComas.financialData.support.MutableClock;
import com.tresComas.financialData.validation.exception.InvalidInputException;
import com.tresComas.financialData.validation.service.DataValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarketDataSourceTest {

    private MutableClock clock;
    private FakeMarketDataApi api;
    private CountingRateLimiter rateLimiter;
    private MarketDataSource source;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-14T12:00:00Z"));
        api = new FakeMarketDataApi();
        rateLimiter = new CountingRateLimiter();
        ResponseCache cache = new ResponseCache(CacheSettings.builder().build(), new ObjectMapper().findAndRegisterModules(), clock);
        source = new MarketDataSource(api, cache, rateLimiter, new DataValidator(clock), clock);
    }

    @Nested
    @DisplayName("getTickerInfo()")
    class TickerInfoTests {

        @Test
        @DisplayName("maps provider fields and defaults missing ones")
        void mapsFields() {
            api.info = Map.of("shortName", "Apple Inc.", "sector", "Technology", "marketCap", 3.1e12,
                    "trailingPE", 31.5, "averageVolume", 55_000_000L);

            TickerInfo info = source.getTickerInfo(" aapl ");

            assertEquals("AAPL", info.getSymbol());
            assertEquals("Apple Inc.", info.getName());
            assertEquals("Technology", info.getSector());
            assertEquals("", info.getIndustry());
            assertEquals(31.5, info.getPeRatio());
            assertEquals(0.0, info.getBeta());
            assertEquals(55_000_000L, info.getAvgVolume());
            assertEquals(clock.instant(), info.getLastUpdated());
        }

        @Test
        @DisplayName("cache hit makes no provider call and no limiter acquisition")
        void cacheHit() {
            api.info = Map.of("shortName", "Apple Inc.");
            TickerInfo first = source.getTickerInfo("AAPL");

            TickerInfo second = source.getTickerInfo("aapl");

            assertEquals(first, second);
            assertEquals(1, api.calls);
            assertEquals(1, rateLimiter.getAcquisitions());
        }

        @Test
        @DisplayName("expired entry is fetched again")
        void expiredEntry() {
            api.info = Map.of("shortName", "Apple Inc.");
            source.getTickerInfo("AAPL");

            clock.advance(Duration.ofMinutes(61));
            source.getTickerInfo("AAPL");

            assertEquals(2, api.calls);
        }

        @Test
        @DisplayName("provider failure degrades to null and is not cached")
        void providerFailure() {
            api.failure = new UpstreamUnavailableException("down");

            assertNull(source.getTickerInfo("AAPL"));

            api.failure = null;
            api.info = Map.of("shortName", "Apple Inc.");
            assertNotNull(source.getTickerInfo("AAPL"));
        }

        @Test
        @DisplayName("invalid ticker throws before any provider call")
        void invalidTicker() {
            assertThrows(InvalidInputException.class, () -> source.getTickerInfo(" "));
            assertEquals(0, rateLimiter.getAcquisitions());
        }
    }

    @Nested
    @DisplayName("getHistoricalSeries()")
    class HistoricalTests {

        @Test
        @DisplayName("period request uses the period and default interval")
        void periodRequest() {
            HistoricalSeries series = source.getHistoricalSeries("AAPL", null, null, "6mo", null);

            assertNotNull(series);
            assertEquals("1d", series.getInterval());
            assertEquals("6mo", api.lastHistoryRequest.getPeriod());
            assertFalse(api.lastHistoryRequest.hasDateRange());
        }

        @Test
        @DisplayName("date request fills the missing end with today and caches under the date key")
        void dateRequest() {
            source.getHistoricalSeries("AAPL", "2024-01-01", null, null, "1wk");
            source.getHistoricalSeries("AAPL", "2024-01-01", "2024-06-14", null, "1wk");

            assertEquals(LocalDate.of(2024, 6, 14), api.lastHistoryRequest.getEnd());
            assertEquals(1, api.calls);
        }

        @Test
        @DisplayName("empty payload → null")
        void emptyPayload() {
            api.history = RawPriceSeries.builder().dates(List.of()).columns(Map.of()).build();
            assertNull(source.getHistoricalSeries("AAPL"));
        }
    }

    @Nested
    @DisplayName("getOptionsChain()")
    class OptionsTests {

        @Test
        @DisplayName("defaults to the nearest expiration using two acquisitions")
        void nearestExpiration() {
            OptionsChain chain = source.getOptionsChain("AAPL");

            assertNotNull(chain);
            assertEquals(List.of("2024-06-21"), List.copyOf(chain.getExpirations().keySet()));
            assertEquals("2024-06-21", api.lastChainExpiration);
            assertEquals(2, rateLimiter.getAcquisitions());
        }

        @Test
        @DisplayName("unlisted expiration → null without fetching a chain")
        void unknownExpiration() {
            assertNull(source.getOptionsChain("AAPL", "2030-01-18"));
            assertNull(api.lastChainExpiration);
            assertEquals(1, rateLimiter.getAcquisitions());
        }

        @Test
        @DisplayName("no listed expirations → null")
        void noExpirations() {
            api.expirations = List.of();
            assertNull(source.getOptionsChain("AAPL"));
        }
    }

    @Nested
    @DisplayName("getImpliedVolatility()")
    class ImpliedVolatilityTests {

        @Test
        @DisplayName("supplied chain makes no provider call")
        void suppliedChain() {
            OptionsChain chain = OptionsChain.builder()
                    .symbol("AAPL")
                    .expirations(Map.of("2024-06-21", api.chain))
                    .build();

            ImpliedVolatility iv = source.getImpliedVolatility("AAPL", chain);

            assertEquals(0.25, iv.getAverageIv(), 1e-9);
            assertEquals(0, rateLimiter.getAcquisitions());
        }

        @Test
        @DisplayName("second lookup is served from cache")
        void cached() {
            source.getImpliedVolatility("AAPL");
            int acquisitions = rateLimiter.getAcquisitions();

            assertNotNull(source.getImpliedVolatility("AAPL"));
            assertEquals(acquisitions, rateLimiter.getAcquisitions());
        }

        @Test
        @DisplayName("no chain → null")
        void noChain() {
            assertNull(source.getImpliedVolatility("AAPL", null));
        }
    }

    private static class FakeMarketDataApi implements MarketDataApi {

        Map<String, Object> info = Map.of();
        RawPriceSeries history = defaultHistory();
        List<String> expirations = List.of("2024-06-21", "2024-06-28");
        OptionsExpiration chain = OptionsExpiration.builder()
                .calls(List.of(OptionContract.builder().type("call").strike(190).impliedVolatility(0.2).build()))
                .puts(List.of(OptionContract.builder().type("put").strike(190).impliedVolatility(0.3).build()))
                .build();
        RuntimeException failure;

        int calls;
        HistoryRequest lastHistoryRequest;
        String lastChainExpiration;

        @Override
        public Map<String, Object> fetchTickerInfo(String ticker) {
            calls++;
            if (failure != null) {
                throw failure;
            }
            return info;
        }

        @Override
        public RawPriceSeries fetchHistory(String ticker, HistoryRequest request) {
            calls++;
            lastHistoryRequest = request;
            return history;
        }

        @Override
        public List<String> fetchOptionExpirations(String ticker) {
            return expirations;
        }

        @Override
        public OptionsExpiration fetchOptionChain(String ticker, String expiration) {
            lastChainExpiration = expiration;
            return chain;
        }

        private static RawPriceSeries defaultHistory() {
            Map<String, List<Double>> columns = new HashMap<>();
            for (String column : List.of("Open", "High", "Low", "Close", "Volume")) {
                columns.put(column, new ArrayList<>(List.of(100.0, 101.0)));
            }
            return RawPriceSeries.builder()
                    .dates(List.of("2024-06-12", "2024-06-13"))
                    .columns(columns)
                    .build();
        }
    }
}
