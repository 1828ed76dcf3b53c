package com.tresComas.financialData.marketdata.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One OHLCV row of a historical series.
 * Price fields may still be null when no earlier close exists to fill them from.
 */
@Value
@Builder
@Jacksonized
public class PriceBar {
    
    /**
     * yyyy-MM-dd for daily and coarser intervals, ISO instant for intraday intervals.
     */
    String date;
    
    Double open;
    
    Double high;
    
    Double low;
    
    Double close;
    
    long volume;
}
