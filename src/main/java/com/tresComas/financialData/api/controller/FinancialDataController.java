package com.tresComas.financialData.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tresComas.financialData.aggregator.model.CompositeRecord;
import com.tresComas.financialData.aggregator.service.AggregatorService;
import com.tresComas.financialData.filings.model.Filing;
import com.tresComas.financialData.filings.model.KeyFinancials;
import com.tresComas.financialData.filings.service.FilingsSource;
import com.tresComas.financialData.marketdata.model.HistoricalSeries;
import com.tresComas.financialData.marketdata.model.ImpliedVolatility;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import com.tresComas.financialData.marketdata.service.MarketDataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Financial data REST controller - thin HTTP layer over the aggregator and the two sources.
 * Lookups that yield nothing answer 404.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class FinancialDataController {

    private final AggregatorService aggregatorService;
    private final MarketDataSource marketDataSource;
    private final FilingsSource filingsSource;

    /**
     * Runs a full aggregation for the ticker. Always answers with a record, possibly partial.
     */
    @GetMapping("/securities/{ticker}")
    public ResponseEntity<CompositeRecord> getCompositeRecord(@PathVariable String ticker) {
        return ResponseEntity.ok(aggregatorService.getCompositeRecord(ticker));
    }

    @GetMapping("/securities/{ticker}/history")
    public ResponseEntity<HistoricalSeries> getHistory(
            @PathVariable String ticker,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(defaultValue = MarketDataSource.DEFAULT_PERIOD) String period,
            @RequestParam(defaultValue = MarketDataSource.DEFAULT_INTERVAL) String interval) {
        return okOrNotFound(marketDataSource.getHistoricalSeries(ticker, start, end, period, interval));
    }

    @GetMapping("/securities/{ticker}/options")
    public ResponseEntity<OptionsChain> getOptions(
            @PathVariable String ticker,
            @RequestParam(required = false) String expiration) {
        return okOrNotFound(marketDataSource.getOptionsChain(ticker, expiration));
    }

    @GetMapping("/securities/{ticker}/implied-volatility")
    public ResponseEntity<ImpliedVolatility> getImpliedVolatility(@PathVariable String ticker) {
        return okOrNotFound(marketDataSource.getImpliedVolatility(ticker));
    }

    @GetMapping("/securities/{ticker}/filings")
    public ResponseEntity<List<Filing>> getFilings(
            @PathVariable String ticker,
            @RequestParam(defaultValue = FilingsSource.FORM_8K) String form,
            @RequestParam(defaultValue = "5") int count) {
        return ResponseEntity.ok(filingsSource.getFilingsMetadata(ticker, form, count));
    }

    @GetMapping("/securities/{ticker}/financials")
    public ResponseEntity<KeyFinancials> getKeyFinancials(@PathVariable String ticker) {
        return okOrNotFound(filingsSource.extractKeyFinancials(ticker));
    }

    @GetMapping("/securities/{ticker}/facts")
    public ResponseEntity<JsonNode> getCompanyFacts(@PathVariable String ticker) {
        return okOrNotFound(filingsSource.getCompanyFacts(ticker));
    }

    /**
     * Clears cached responses whose key contains the pattern, or everything without a pattern.
     */
    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Integer>> clearCache(@RequestParam(required = false) String pattern) {
        return ResponseEntity.ok(Map.of("cleared", aggregatorService.clearCache(pattern)));
    }

    private static <T> ResponseEntity<T> okOrNotFound(T body) {
        return body == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(body);
    }
}
