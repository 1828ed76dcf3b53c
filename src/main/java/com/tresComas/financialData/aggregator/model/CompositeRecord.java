package com.tresComas.financialData.aggregator.model;

import com.tresComas.financialData.marketdata.model.HistoricalSeries;
import com.tresComas.financialData.marketdata.model.ImpliedVolatility;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import com.tresComas.financialData.marketdata.model.TickerInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Everything known about one security after an aggregation run.
 *
 * Built up field by field while the aggregation proceeds; every section is optional
 * and stays at its default when the corresponding fetch produced nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompositeRecord {

    private String symbol;

    private TickerInfo basicInfo;

    private ImpliedVolatility impliedVolatility;

    private HistoricalSeries historicalData;

    private OptionsChain optionsData;

    @Builder.Default
    private SecData secData = new SecData();

    private Instant lastUpdated;
}
