package com.tresComas.financialData.marketdata.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Single option contract as reported by the market-data provider.
 */
@Value
@Builder
@Jacksonized
public class OptionContract {
    
    String contractSymbol;
    
    double strike;
    
    /**
     * Expiration date (yyyy-MM-dd).
     */
    String expiration;
    
    /**
     * "call" or "put".
     */
    String type;
    
    double lastPrice;
    
    double bid;
    
    double ask;
    
    double change;
    
    double percentChange;
    
    long volume;
    
    long openInterest;
    
    /**
     * Null when the provider did not report one.
     */
    Double impliedVolatility;
    
    boolean inTheMoney;
}
