package com.tresComas.financialData.marketdata.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Implied volatility figures for one expiration. A side without any positive IV is null.
 */
@Value
@Builder
@Jacksonized
public class ExpirationVolatility {
    
    Double callsIv;
    
    Double putsIv;
    
    /**
     * Mean of the available side averages; null when neither side has a value.
     */
    Double averageIv;
}
