package com.tresComas.financialData.marketdata.service;

import com.tresComas.financialData.cache.model.CacheCategory;
import com.tresComas.financialData.cache.service.ResponseCache;
import com.tresComas.financialData.common.util.PayloadValues;
import com.tresComas.financialData.marketdata.client.MarketDataApi;
import com.tresComas.financialData.marketdata.dto.HistoryRequest;
import com.tresComas.financialData.marketdata.dto.RawPriceSeries;
import com.tresComas.financialData.marketdata.model.HistoricalSeries;
import com.tresComas.financialData.marketdata.model.ImpliedVolatility;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import com.tresComas.financialData.marketdata.model.OptionsExpiration;
import com.tresComas.financialData.marketdata.model.TickerInfo;
import com.tresComas.financialData.marketdata.util.ImpliedVolatilityCalculator;
import com.tresComas.financialData.ratelimit.service.RateLimiter;
import com.tresComas.financialData.validation.model.DateRange;
import com.tresComas.financialData.validation.service.DataValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Market data source - quotes, price history and options through cache and rate limiter.
 *
 * Every query follows the same path:
 * 1. Validate the ticker (the only step that throws)
 * 2. Return a fresh cache entry without touching the rate limiter
 * 3. Otherwise acquire the limiter and call the provider
 * 4. Validate, cache and return; any provider failure degrades to null
 */
@Slf4j
@Service
public class MarketDataSource {

    public static final String DEFAULT_PERIOD = "1y";
    public static final String DEFAULT_INTERVAL = "1d";

    private final MarketDataApi marketDataApi;
    private final ResponseCache cache;
    private final RateLimiter rateLimiter;
    private final DataValidator validator;
    private final Clock clock;

    public MarketDataSource(MarketDataApi marketDataApi,
                            ResponseCache cache,
                            @Qualifier("marketDataRateLimiter") RateLimiter rateLimiter,
                            DataValidator validator,
                            Clock clock) {
        this.marketDataApi = marketDataApi;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Gets basic quote and profile information.
     *
     * @param ticker Ticker symbol
     * @return TickerInfo, or null if the provider call failed
     */
    public TickerInfo getTickerInfo(String ticker) {
        String symbol = validator.validateTicker(ticker);
        String cacheKey = "ticker_info_" + symbol;

        TickerInfo cached = cache.get(cacheKey, CacheCategory.PRICE, TickerInfo.class);
        if (cached != null) {
            log.info("Using cached ticker info - ticker: {}", symbol);
            return cached;
        }

        log.info("Fetching ticker info - ticker: {}", symbol);
        Map<String, Object> info = callUpstream("ticker info", symbol, () -> marketDataApi.fetchTickerInfo(symbol));
        if (info == null || info.isEmpty()) {
            log.warn("No ticker info returned - ticker: {}", symbol);
            return null;
        }

        TickerInfo tickerInfo = TickerInfo.builder()
                .symbol(symbol)
                .name(PayloadValues.toText(info.get("shortName"), ""))
                .sector(PayloadValues.toText(info.get("sector"), ""))
                .industry(PayloadValues.toText(info.get("industry"), ""))
                .marketCap(PayloadValues.toDouble(info.get("marketCap"), 0))
                .peRatio(PayloadValues.toDouble(info.get("trailingPE"), 0))
                .dividendYield(PayloadValues.toDouble(info.get("dividendYield"), 0))
                .beta(PayloadValues.toDouble(info.get("beta"), 0))
                .fiftyTwoWeekHigh(PayloadValues.toDouble(info.get("fiftyTwoWeekHigh"), 0))
                .fiftyTwoWeekLow(PayloadValues.toDouble(info.get("fiftyTwoWeekLow"), 0))
                .avgVolume(PayloadValues.toLong(info.get("averageVolume"), 0))
                .lastUpdated(clock.instant())
                .build();

        cache.set(cacheKey, tickerInfo, CacheCategory.PRICE);
        return tickerInfo;
    }

    /**
     * Gets OHLCV history, either for an explicit date range or for a relative period.
     * A date range is used as soon as either date is given; the missing side takes its default.
     *
     * @param ticker Ticker symbol
     * @param startDate Start date (yyyy-MM-dd), may be null
     * @param endDate End date (yyyy-MM-dd), may be null
     * @param period Relative period such as "1y", used when no date is given
     * @param interval Bar interval such as "1d"
     * @return Repaired series, or null if nothing usable came back
     */
    public HistoricalSeries getHistoricalSeries(String ticker, String startDate, String endDate,
                                                String period, String interval) {
        String symbol = validator.validateTicker(ticker);
        String effectivePeriod = period == null || period.isBlank() ? DEFAULT_PERIOD : period;
        String effectiveInterval = interval == null || interval.isBlank() ? DEFAULT_INTERVAL : interval;

        HistoryRequest request;
        String cacheKey;
        if (startDate != null || endDate != null) {
            DateRange range = validator.validateDateRange(startDate, endDate);
            request = HistoryRequest.builder()
                    .start(range.getStart())
                    .end(range.getEnd())
                    .interval(effectiveInterval)
                    .build();
            cacheKey = "historical_" + symbol + "_" + range.getStartDate() + "_" + range.getEndDate() + "_" + effectiveInterval;
        } else {
            request = HistoryRequest.builder()
                    .period(effectivePeriod)
                    .interval(effectiveInterval)
                    .build();
            cacheKey = "historical_" + symbol + "_" + effectivePeriod + "_" + effectiveInterval;
        }

        HistoricalSeries cached = cache.get(cacheKey, CacheCategory.HISTORICAL, HistoricalSeries.class);
        if (cached != null) {
            log.info("Using cached historical data - ticker: {}, cacheKey: {}", symbol, cacheKey);
            return cached;
        }

        log.info("Fetching historical data - ticker: {}, cacheKey: {}", symbol, cacheKey);
        RawPriceSeries raw = callUpstream("historical data", symbol, () -> marketDataApi.fetchHistory(symbol, request));
        HistoricalSeries series = validator.validateHistoricalSeries(symbol, effectiveInterval, raw);
        if (series == null) {
            return null;
        }

        cache.set(cacheKey, series, CacheCategory.HISTORICAL);
        return series;
    }

    public HistoricalSeries getHistoricalSeries(String ticker) {
        return getHistoricalSeries(ticker, null, null, DEFAULT_PERIOD, DEFAULT_INTERVAL);
    }

    /**
     * Gets the options chain for one expiration.
     * Without an explicit expiration the nearest listed one is used.
     *
     * @param ticker Ticker symbol
     * @param expiration Expiration date (yyyy-MM-dd), may be null
     * @return Chain with a single expiration, or null if none is listed or the requested one is unknown
     */
    public OptionsChain getOptionsChain(String ticker, String expiration) {
        String symbol = validator.validateTicker(ticker);
        boolean requested = expiration != null && !expiration.isBlank();
        String cacheKey = requested ? "options_" + symbol + "_" + expiration : "options_" + symbol;

        OptionsChain cached = cache.get(cacheKey, CacheCategory.PRICE, OptionsChain.class);
        if (cached != null) {
            log.info("Using cached options data - ticker: {}", symbol);
            return cached;
        }

        log.info("Fetching options data - ticker: {}", symbol);
        List<String> expirations = callUpstream("option expirations", symbol,
                () -> marketDataApi.fetchOptionExpirations(symbol));
        if (expirations == null || expirations.isEmpty()) {
            log.warn("No options available - ticker: {}", symbol);
            return null;
        }

        String target = requested ? expiration : expirations.get(0);
        if (requested && !expirations.contains(expiration)) {
            log.warn("Expiration date not available - ticker: {}, expiration: {}", symbol, expiration);
            return null;
        }

        OptionsExpiration slice = callUpstream("options chain", symbol, () -> marketDataApi.fetchOptionChain(symbol, target));
        if (slice == null) {
            return null;
        }

        OptionsChain chain = validator.validateOptionsChain(symbol, Map.of(target, slice));
        if (chain == null) {
            return null;
        }

        cache.set(cacheKey, chain, CacheCategory.PRICE);
        return chain;
    }

    public OptionsChain getOptionsChain(String ticker) {
        return getOptionsChain(ticker, null);
    }

    /**
     * Computes implied volatility from the nearest options chain.
     *
     * @param ticker Ticker symbol
     * @return ImpliedVolatility, or null if no options chain is available
     */
    public ImpliedVolatility getImpliedVolatility(String ticker) {
        String symbol = validator.validateTicker(ticker);
        ImpliedVolatility cached = cache.get(ivCacheKey(symbol), CacheCategory.PRICE, ImpliedVolatility.class);
        if (cached != null) {
            log.info("Using cached implied volatility - ticker: {}", symbol);
            return cached;
        }
        return getImpliedVolatility(symbol, getOptionsChain(symbol));
    }

    /**
     * Computes implied volatility from an already fetched chain. Makes no provider call.
     *
     * @param ticker Ticker symbol
     * @param chain Options chain, may be null
     * @return ImpliedVolatility, or null if the chain is null
     */
    public ImpliedVolatility getImpliedVolatility(String ticker, OptionsChain chain) {
        String symbol = validator.validateTicker(ticker);
        if (chain == null) {
            log.warn("No options data available to calculate implied volatility - ticker: {}", symbol);
            return null;
        }

        ImpliedVolatility impliedVolatility = ImpliedVolatilityCalculator.calculate(symbol, chain, clock.instant());
        log.info("Calculated implied volatility - ticker: {}, averageIv: {}", symbol, impliedVolatility.getAverageIv());
        cache.set(ivCacheKey(symbol), impliedVolatility, CacheCategory.PRICE);
        return impliedVolatility;
    }

    private static String ivCacheKey(String symbol) {
        return "iv_" + symbol;
    }

    private <T> T callUpstream(String description, String symbol, Supplier<T> call) {
        rateLimiter.acquire();
        try {
            return call.get();
        } catch (Exception e) {
            log.error("Error fetching {} - ticker: {}", description, symbol, e);
            return null;
        }
    }
}
