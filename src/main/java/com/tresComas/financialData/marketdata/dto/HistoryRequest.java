package com.tresComas.financialData.marketdata.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Parameters of a historical series query: either an explicit date range or a provider period (e.g. "1y").
 */
@Value
@Builder
public class HistoryRequest {
    
    LocalDate start;
    
    LocalDate end;
    
    String period;
    
    String interval;
    
    public boolean hasDateRange() {
        return start != null && end != null;
    }
}
