package com.tresComas.financialData.marketdata.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Options chain for a ticker keyed by expiration date (yyyy-MM-dd), in provider order.
 */
@Value
@Builder
@Jacksonized
public class OptionsChain {
    
    String symbol;
    
    @Builder.Default
    Map<String, OptionsExpiration> expirations = Map.of();
    
    Instant lastUpdated;
}
