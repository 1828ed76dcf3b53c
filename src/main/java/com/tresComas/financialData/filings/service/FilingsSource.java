package com.tresComas.financialData.filings.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.tresComas.financialData.cache.model.CacheCategory;
import com.tresComas.financialData.cache.service.ResponseCache;
import com.tresComas.financialData.filings.client.FilingsApi;
import com.tresComas.financialData.filings.model.Filing;
import com.tresComas.financialData.filings.model.KeyFinancials;
import com.tresComas.financialData.filings.util.KeyFinancialsExtractor;
import com.tresComas.financialData.ratelimit.service.RateLimiter;
import com.tresComas.financialData.validation.exception.InvalidInputException;
import com.tresComas.financialData.validation.service.DataValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Filings source - CIK lookup, filing metadata and company facts through cache and rate limiter.
 *
 * All lookups are keyed by the canonical ticker. A ticker without a CIK yields an empty
 * filings list and null facts. Provider failures and empty results are never cached.
 */
@Slf4j
@Service
public class FilingsSource {

    public static final String FORM_10K = "10-K";
    public static final String FORM_8K = "8-K";
    public static final int DEFAULT_8K_COUNT = 5;

    private static final TypeReference<List<Filing>> FILING_LIST = new TypeReference<>() {
    };

    private final FilingsApi filingsApi;
    private final ResponseCache cache;
    private final RateLimiter rateLimiter;
    private final DataValidator validator;

    public FilingsSource(FilingsApi filingsApi,
                         ResponseCache cache,
                         @Qualifier("filingsRateLimiter") RateLimiter rateLimiter,
                         DataValidator validator) {
        this.filingsApi = filingsApi;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.validator = validator;
    }

    /**
     * Resolves the 10-digit, zero-padded CIK for a ticker.
     *
     * @param ticker Ticker symbol
     * @return CIK, or null if the ticker is not listed or the directory could not be fetched
     */
    public String getCik(String ticker) {
        String symbol = validator.validateTicker(ticker);
        String cacheKey = "cik_" + symbol;

        String cached = cache.get(cacheKey, CacheCategory.FILING, String.class);
        if (cached != null) {
            log.info("Using cached CIK - ticker: {}", symbol);
            return cached;
        }

        log.info("Fetching CIK - ticker: {}", symbol);
        JsonNode directory = callUpstream("company tickers", symbol, filingsApi::fetchTickerDirectory);
        if (directory == null) {
            return null;
        }

        for (JsonNode company : directory) {
            if (symbol.equals(company.path("ticker").asText("").toUpperCase(Locale.ROOT))) {
                String cik = String.format("%010d", company.path("cik_str").asLong(0));
                log.info("Found CIK - ticker: {}, cik: {}", symbol, cik);
                cache.set(cacheKey, cik, CacheCategory.FILING);
                return cik;
            }
        }

        log.warn("No CIK found - ticker: {}", symbol);
        return null;
    }

    /**
     * Lists the most recent filings of one form type.
     *
     * @param ticker Ticker symbol
     * @param formType Form type such as "10-K" or "8-K"
     * @param count Maximum number of filings, at least 1
     * @return Filings in provider order (most recent first), empty if none or on failure
     * @throws InvalidInputException if the form type is blank or count is below 1
     */
    public List<Filing> getFilingsMetadata(String ticker, String formType, int count) {
        String symbol = validator.validateTicker(ticker);
        if (formType == null || formType.isBlank()) {
            throw new InvalidInputException("Form type must be a non-empty string");
        }
        if (count < 1) {
            throw new InvalidInputException("Filing count must be at least 1, got " + count);
        }

        return getFilingsMetadata(symbol, getCik(symbol), formType, count);
    }

    /**
     * Lists filings for an already resolved CIK. Makes no CIK lookup.
     *
     * @param cik Resolved CIK, may be null
     * @return Filings in provider order, empty if the CIK is null, there are none, or on failure
     */
    public List<Filing> getFilingsMetadata(String ticker, String cik, String formType, int count) {
        String symbol = validator.validateTicker(ticker);
        if (formType == null || formType.isBlank()) {
            throw new InvalidInputException("Form type must be a non-empty string");
        }
        if (count < 1) {
            throw new InvalidInputException("Filing count must be at least 1, got " + count);
        }
        if (cik == null) {
            log.warn("Unable to get filings, no CIK - ticker: {}", symbol);
            return List.of();
        }

        String cacheKey = "filings_" + symbol + "_" + formType + "_" + count;
        List<Filing> cached = cache.get(cacheKey, CacheCategory.FILING, FILING_LIST);
        if (cached != null) {
            log.info("Using cached filings metadata - ticker: {}, form: {}", symbol, formType);
            return cached;
        }

        log.info("Fetching filings - ticker: {}, form: {}, cik: {}", symbol, formType, cik);
        JsonNode submissions = callUpstream("submissions", symbol, () -> filingsApi.fetchSubmissions(cik));
        if (submissions == null) {
            return List.of();
        }

        List<Filing> filings = recentFilings(symbol, cik, submissions.path("filings").path("recent"), formType, count);
        if (filings.isEmpty()) {
            log.warn("No filings found - ticker: {}, form: {}", symbol, formType);
            return filings;
        }

        log.info("Found filings - ticker: {}, form: {}, count: {}", symbol, formType, filings.size());
        cache.set(cacheKey, filings, CacheCategory.FILING);
        return filings;
    }

    /**
     * @return The most recent annual report, or null if none is available
     */
    public Filing getRecent10K(String ticker) {
        String symbol = validator.validateTicker(ticker);
        return getRecent10K(symbol, getCik(symbol));
    }

    public Filing getRecent10K(String ticker, String cik) {
        String symbol = validator.validateTicker(ticker);
        List<Filing> filings = getFilingsMetadata(symbol, cik, FORM_10K, 1);
        if (filings.isEmpty()) {
            log.warn("No 10-K filings found - ticker: {}", symbol);
            return null;
        }
        return filings.get(0);
    }

    public List<Filing> getRecent8K(String ticker, int count) {
        return getFilingsMetadata(ticker, FORM_8K, count);
    }

    public List<Filing> getRecent8K(String ticker, String cik, int count) {
        return getFilingsMetadata(ticker, cik, FORM_8K, count);
    }

    public List<Filing> getRecent8K(String ticker) {
        return getRecent8K(ticker, DEFAULT_8K_COUNT);
    }

    /**
     * Fetches the XBRL company facts document.
     *
     * @param ticker Ticker symbol
     * @return Facts document, or null if there is no CIK or the provider has no facts
     */
    public JsonNode getCompanyFacts(String ticker) {
        String symbol = validator.validateTicker(ticker);
        return getCompanyFacts(symbol, getCik(symbol));
    }

    public JsonNode getCompanyFacts(String ticker, String cik) {
        String symbol = validator.validateTicker(ticker);
        if (cik == null) {
            log.warn("Unable to get company facts, no CIK - ticker: {}", symbol);
            return null;
        }

        String cacheKey = "facts_" + symbol;
        JsonNode cached = cache.get(cacheKey, CacheCategory.FILING, JsonNode.class);
        if (cached != null) {
            log.info("Using cached company facts - ticker: {}", symbol);
            return cached;
        }

        log.info("Fetching company facts - ticker: {}, cik: {}", symbol, cik);
        JsonNode facts = callUpstream("company facts", symbol, () -> filingsApi.fetchCompanyFacts(cik));
        if (facts == null) {
            log.warn("No company facts found - ticker: {}, cik: {}", symbol, cik);
            return null;
        }

        cache.set(cacheKey, facts, CacheCategory.FILING);
        return facts;
    }

    /**
     * Extracts annual revenue, net income, diluted EPS, assets, liabilities and cash.
     *
     * @param ticker Ticker symbol
     * @return Key financials (series may be empty), or null if no facts are available
     */
    public KeyFinancials extractKeyFinancials(String ticker) {
        String symbol = validator.validateTicker(ticker);
        return extractKeyFinancials(symbol, getCik(symbol));
    }

    public KeyFinancials extractKeyFinancials(String ticker, String cik) {
        String symbol = validator.validateTicker(ticker);
        JsonNode facts = getCompanyFacts(symbol, cik);
        if (facts == null || !facts.has("facts")) {
            log.warn("No company facts available - ticker: {}", symbol);
            return null;
        }
        return KeyFinancialsExtractor.extract(symbol, facts);
    }

    private List<Filing> recentFilings(String symbol, String cik, JsonNode recent, String formType, int count) {
        JsonNode forms = recent.path("form");
        JsonNode accessionNumbers = recent.path("accessionNumber");
        JsonNode filingDates = recent.path("filingDate");
        JsonNode primaryDocuments = recent.path("primaryDocument");

        int rows = Math.min(forms.size(), Math.min(accessionNumbers.size(), filingDates.size()));
        List<Filing> filings = new ArrayList<>();

        for (int i = 0; i < rows && filings.size() < count; i++) {
            if (!formType.equals(forms.get(i).asText())) {
                continue;
            }

            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("form", forms.get(i).asText());
            fields.put("accessionNumber", textOrNull(accessionNumbers.get(i)));
            fields.put("filingDate", textOrNull(filingDates.get(i)));
            fields.put("primaryDocument", i < primaryDocuments.size() ? primaryDocuments.get(i).asText("") : "");

            Map<String, String> valid = validator.validateFiling(fields);
            if (valid == null) {
                continue;
            }

            filings.add(Filing.builder()
                    .ticker(symbol)
                    .cik(cik)
                    .formType(valid.get("form"))
                    .accessionNumber(valid.get("accessionNumber"))
                    .filingDate(valid.get("filingDate"))
                    .primaryDocument(valid.get("primaryDocument"))
                    .build());
        }
        return List.copyOf(filings);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private <T> T callUpstream(String description, String symbol, Supplier<T> call) {
        rateLimiter.acquire();
        try {
            return call.get();
        } catch (Exception e) {
            log.error("Error fetching {} - ticker: {}", description, symbol, e);
            return null;
        }
    }
}
