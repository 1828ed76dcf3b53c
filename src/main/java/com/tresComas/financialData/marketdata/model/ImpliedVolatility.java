package com.tresComas.financialData.marketdata.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Implied volatility derived from an options chain.
 */
@Value
@Builder
@Jacksonized
public class ImpliedVolatility {
    
    String symbol;
    
    /**
     * Mean of all computable per-expiration averages, 0.0 when none is computable.
     */
    double averageIv;
    
    @Builder.Default
    Map<String, ExpirationVolatility> expirations = Map.of();
    
    Instant lastUpdated;
}
