package com.tresComas.financialData.marketdata.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Calls and puts for one expiration date.
 */
@Value
@Builder
@Jacksonized
public class OptionsExpiration {
    
    @Builder.Default
    List<OptionContract> calls = List.of();
    
    @Builder.Default
    List<OptionContract> puts = List.of();
    
    public boolean hasContracts() {
        return (calls != null && !calls.isEmpty()) || (puts != null && !puts.isEmpty());
    }
}
