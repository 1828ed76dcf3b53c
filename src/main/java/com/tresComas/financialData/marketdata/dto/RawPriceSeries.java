package com.tresComas.financialData.marketdata.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Columnar OHLCV payload as returned by the market-data provider, before validation.
 * 
 * Columns are keyed "Open", "High", "Low", "Close", "Volume". A column missing from the
 * provider response is absent from the map; individual cells may be null.
 */
@Value
@Builder
public class RawPriceSeries {
    
    List<String> dates;
    
    Map<String, List<Double>> columns;
}
