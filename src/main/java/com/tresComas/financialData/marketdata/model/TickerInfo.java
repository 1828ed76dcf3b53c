package com.tresComas.financialData.marketdata.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Basic information about a ticker, normalized from the market-data provider's info record.
 * Missing numeric fields default to zero, missing text fields to an empty string.
 */
@Value
@Builder
@Jacksonized
public class TickerInfo {
    
    String symbol;
    
    @Builder.Default
    String name = "";
    
    @Builder.Default
    String sector = "";
    
    @Builder.Default
    String industry = "";
    
    double marketCap;
    
    double peRatio;
    
    double dividendYield;
    
    double beta;
    
    double fiftyTwoWeekHigh;
    
    double fiftyTwoWeekLow;
    
    long avgVolume;
    
    /**
     * When this record was built from a provider response (not when it was cached).
     */
    Instant lastUpdated;
}
