package com.tresComas.financialData.aggregator.model;

import com.tresComas.financialData.filings.model.Filing;
import com.tresComas.financialData.filings.model.KeyFinancials;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Filing section of a composite record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecData {

    private Filing recent10K;

    @Builder.Default
    private List<Filing> recent8K = new ArrayList<>();

    private KeyFinancials keyFinancials;
}
