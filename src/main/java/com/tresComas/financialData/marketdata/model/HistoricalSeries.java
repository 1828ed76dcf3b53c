package com.tresComas.financialData.marketdata.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Validated OHLCV time series for a ticker, oldest bar first.
 */
@Value
@Builder
@Jacksonized
public class HistoricalSeries {
    
    String symbol;
    
    String interval;
    
    @Builder.Default
    List<PriceBar> bars = List.of();
    
    Instant lastUpdated;
}
