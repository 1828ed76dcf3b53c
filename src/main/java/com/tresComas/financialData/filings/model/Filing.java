package com.tresComas.financialData.filings.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Metadata of one SEC filing. The accession number is the natural key used for persistence.
 */
@Value
@Builder
@Jacksonized
public class Filing {
    
    String ticker;
    
    /**
     * 10-digit, zero-padded CIK.
     */
    String cik;
    
    /**
     * Form type, e.g. "10-K" or "8-K".
     */
    String formType;
    
    String accessionNumber;
    
    String filingDate;
    
    String primaryDocument;
}
