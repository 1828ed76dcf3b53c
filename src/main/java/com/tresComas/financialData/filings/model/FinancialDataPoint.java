package com.tresComas.financialData.filings.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One reported value of an accounting concept.
 */
@Value
@Builder
@Jacksonized
public class FinancialDataPoint {
    
    double value;
    
    /**
     * End of the reporting period (yyyy-MM-dd).
     */
    String endDate;
    
    /**
     * Date the report was filed (yyyy-MM-dd), empty when unknown.
     */
    String filingDate;
}
