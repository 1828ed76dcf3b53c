package com.tresComas.financialData.filings.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tresComas.financialData.filings.model.FinancialDataPoint;
import com.tresComas.financialData.filings.model.KeyFinancials;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyFinancialsExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("keeps 10-K entries only, most recent filing first")
    void annualEntriesSorted() throws Exception {
        JsonNode facts = objectMapper.readTree("""
                {"facts": {"us-gaap": {
                    "NetIncomeLoss": {"units": {"USD": [
                        {"val": 94680000000, "end": "2022-09-24", "filed": "2022-10-28", "form": "10-K"},
                        {"val": 23636000000, "end": "2023-12-30", "filed": "2024-02-02", "form": "10-Q"},
                        {"val": 96995000000, "end": "2023-09-30", "filed": "2023-11-03", "form": "10-K"}
                    ]}},
                    "EarningsPerShareDiluted": {"units": {"USD/shares": [
                        {"val": 6.13, "end": "2023-09-30", "filed": "2023-11-03", "form": "10-K"}
                    ]}}
                }}}
                """);

        KeyFinancials financials = KeyFinancialsExtractor.extract("AAPL", facts);

        List<FinancialDataPoint> netIncome = financials.getNetIncome();
        assertEquals(2, netIncome.size());
        assertEquals("2023-11-03", netIncome.get(0).getFilingDate());
        assertEquals(96995000000.0, netIncome.get(0).getValue());
        assertEquals("2022-09-24", netIncome.get(1).getEndDate());
        assertEquals(6.13, financials.getEps().get(0).getValue());
    }

    @Test
    @DisplayName("first present revenue tag wins, later tags are not merged")
    void firstRevenueTagWins() throws Exception {
        JsonNode facts = objectMapper.readTree("""
                {"facts": {"us-gaap": {
                    "Revenues": {"units": {"USD": [{"val": 1, "end": "2023-12-31", "filed": "2024-02-01", "form": "10-K"}]}},
                    "SalesRevenueNet": {"units": {"USD": [{"val": 2, "end": "2012-12-31", "filed": "2013-02-01", "form": "10-K"}]}}
                }}}
                """);

        KeyFinancials financials = KeyFinancialsExtractor.extract("XYZ", facts);

        assertEquals(1, financials.getRevenue().size());
        assertEquals(1.0, financials.getRevenue().get(0).getValue());
    }

    @Test
    @DisplayName("missing taxonomy → every series empty")
    void missingTaxonomy() throws Exception {
        KeyFinancials financials = KeyFinancialsExtractor.extract("XYZ", objectMapper.readTree("{\"facts\": {\"dei\": {}}}"));

        assertEquals("XYZ", financials.getTicker());
        assertTrue(financials.getRevenue().isEmpty());
        assertTrue(financials.getNetIncome().isEmpty());
        assertTrue(financials.getEps().isEmpty());
        assertTrue(financials.getAssets().isEmpty());
        assertTrue(financials.getLiabilities().isEmpty());
        assertTrue(financials.getCash().isEmpty());
    }
}
