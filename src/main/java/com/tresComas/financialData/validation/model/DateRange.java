package com.tresComas.financialData.validation.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Validated date range (start is never after end).
 */
@Value
public class DateRange {
    
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;
    
    LocalDate start;
    LocalDate end;
    
    public String getStartDate() {
        return start.format(DATE_FORMATTER);
    }
    
    public String getEndDate() {
        return end.format(DATE_FORMATTER);
    }
}
