package com.tresComas.financialData.filings.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.tresComas.financialData.filings.model.FinancialDataPoint;
import com.tresComas.financialData.filings.model.KeyFinancials;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pulls annual figures out of an XBRL company facts document.
 *
 * Only us-gaap entries reported on a 10-K are used, across every unit the tag is reported in.
 * Each series is sorted by filing date, most recent first.
 */
public final class KeyFinancialsExtractor {

    public static final String ANNUAL_FORM = "10-K";

    private static final List<String> REVENUE_TAGS = List.of("Revenue", "Revenues", "SalesRevenueNet");

    private static final Comparator<FinancialDataPoint> MOST_RECENT_FIRST =
            Comparator.comparing((FinancialDataPoint point) -> point.getFilingDate() != null ? point.getFilingDate() : "")
                    .reversed();

    private KeyFinancialsExtractor() {
    }

    public static KeyFinancials extract(String ticker, JsonNode companyFacts) {
        JsonNode usGaap = companyFacts.path("facts").path("us-gaap");

        return KeyFinancials.builder()
                .ticker(ticker)
                .revenue(series(usGaap, firstPresentTag(usGaap, REVENUE_TAGS)))
                .netIncome(series(usGaap, "NetIncomeLoss"))
                .eps(series(usGaap, "EarningsPerShareDiluted"))
                .assets(series(usGaap, "Assets"))
                .liabilities(series(usGaap, "Liabilities"))
                .cash(series(usGaap, "CashAndCashEquivalentsAtCarryingValue"))
                .build();
    }

    private static String firstPresentTag(JsonNode taxonomy, List<String> tags) {
        return tags.stream()
                .filter(taxonomy::has)
                .findFirst()
                .orElse(null);
    }

    private static List<FinancialDataPoint> series(JsonNode taxonomy, String tag) {
        if (tag == null || !taxonomy.has(tag)) {
            return List.of();
        }

        List<FinancialDataPoint> points = new ArrayList<>();
        taxonomy.get(tag).path("units").elements().forEachRemaining(unitEntries -> {
            for (JsonNode entry : unitEntries) {
                if (ANNUAL_FORM.equals(entry.path("form").asText())) {
                    points.add(FinancialDataPoint.builder()
                            .value(entry.path("val").asDouble(0))
                            .endDate(entry.path("end").asText(""))
                            .filingDate(entry.path("filed").asText(""))
                            .build());
                }
            }
        });
        points.sort(MOST_RECENT_FIRST);
        return List.copyOf(points);
    }
}
