package com.tresComas.financialData.filings.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Annual (10-K) figures extracted from a company-facts payload.
 * Every series is ordered by filing date, most recent first, and may be empty.
 */
@Value
@Builder
@Jacksonized
public class KeyFinancials {
    
    String ticker;
    
    @Builder.Default
    List<FinancialDataPoint> revenue = List.of();
    
    @Builder.Default
    List<FinancialDataPoint> netIncome = List.of();
    
    @Builder.Default
    List<FinancialDataPoint> eps = List.of();
    
    @Builder.Default
    List<FinancialDataPoint> assets = List.of();
    
    @Builder.Default
    List<FinancialDataPoint> liabilities = List.of();
    
    @Builder.Default
    List<FinancialDataPoint> cash = List.of();
}
