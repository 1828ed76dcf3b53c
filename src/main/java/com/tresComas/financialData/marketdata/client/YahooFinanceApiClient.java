package com.tresComas.financialData.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tresComas.financialData.common.exception.UpstreamUnavailableException;
import com.tresComas.financialData.marketdata.dto.HistoryRequest;
import com.tresComas.financialData.marketdata.dto.RawPriceSeries;
import com.tresComas.financialData.marketdata.model.OptionContract;
import com.tresComas.financialData.marketdata.model.OptionsExpiration;
import com.tresComas.financialData.validation.service.DataValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the Yahoo Finance JSON endpoints.
 *
 * Endpoints:
 * - v10/finance/quoteSummary for quote and profile fields
 * - v8/finance/chart for OHLCV history
 * - v7/finance/options for expirations and per-expiration chains
 *
 * Payload parsing lives in package-private methods so it can be exercised without the network.
 */
@Slf4j
@Component
public class YahooFinanceApiClient implements MarketDataApi {

    private static final String BROWSER_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36";
    private static final String QUOTE_MODULES = "price,summaryDetail,assetProfile,defaultKeyStatistics";

    private final RestClient restClient;

    public YahooFinanceApiClient(@Value("${yahoo.api.base-url:https://query2.finance.yahoo.com}") String baseUrl,
                                 @Value("${yahoo.api.timeout:10s}") Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);

        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Map<String, Object> fetchTickerInfo(String ticker) {
        JsonNode response = get("quoteSummary", ticker,
                "/v10/finance/quoteSummary/{ticker}?modules={modules}", ticker, QUOTE_MODULES);
        return parseQuoteSummary(response);
    }

    @Override
    public RawPriceSeries fetchHistory(String ticker, HistoryRequest request) {
        JsonNode response;
        if (request.hasDateRange()) {
            long period1 = request.getStart().atStartOfDay(ZoneOffset.UTC).toEpochSecond();
            // end date is inclusive
            long period2 = request.getEnd().plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
            response = get("chart", ticker,
                    "/v8/finance/chart/{ticker}?period1={period1}&period2={period2}&interval={interval}",
                    ticker, period1, period2, request.getInterval());
        } else {
            response = get("chart", ticker,
                    "/v8/finance/chart/{ticker}?range={range}&interval={interval}",
                    ticker, request.getPeriod(), request.getInterval());
        }
        return parseChart(response);
    }

    @Override
    public List<String> fetchOptionExpirations(String ticker) {
        JsonNode response = get("options", ticker, "/v7/finance/options/{ticker}", ticker);
        return parseOptionExpirations(response);
    }

    @Override
    public OptionsExpiration fetchOptionChain(String ticker, String expiration) {
        long epoch = LocalDate.parse(expiration).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        JsonNode response = get("options", ticker, "/v7/finance/options/{ticker}?date={date}", ticker, epoch);
        return parseOptionChain(response);
    }

    private JsonNode get(String endpoint, String ticker, String uri, Object... uriVariables) {
        try {
            log.debug("Calling Yahoo Finance - endpoint: {}, ticker: {}", endpoint, ticker);
            JsonNode body = restClient.get()
                    .uri(uri, uriVariables)
                    .retrieve()
                    .body(JsonNode.class);
            if (body == null) {
                throw new UpstreamUnavailableException("Yahoo Finance returned an empty " + endpoint + " response for " + ticker);
            }
            return body;
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("Failed to call Yahoo Finance " + endpoint + " for " + ticker + ": " + e.getMessage(), e);
        }
    }

    /**
     * Flattens the quoteSummary modules into one map. Formatted values ({"raw": 1.2, "fmt": "1.20"})
     * collapse to their raw number. The first module that carries a field wins.
     */
    Map<String, Object> parseQuoteSummary(JsonNode response) {
        JsonNode result = firstResult(response, "quoteSummary");
        Map<String, Object> info = new LinkedHashMap<>();
        result.fields().forEachRemaining(module -> {
            if (!module.getValue().isObject()) {
                return;
            }
            module.getValue().fields().forEachRemaining(field -> {
                Object value = scalar(field.getValue());
                if (value != null) {
                    info.putIfAbsent(field.getKey(), value);
                }
            });
        });
        return info;
    }

    /**
     * Converts a chart payload into columnar OHLCV. Null cells are kept as null so that
     * sparse rows reach {@link DataValidator} for repair.
     */
    RawPriceSeries parseChart(JsonNode response) {
        JsonNode result = firstResult(response, "chart");
        JsonNode timestamps = result.path("timestamp");
        JsonNode quote = result.path("indicators").path("quote").path(0);
        ZoneId zone = exchangeZone(result.path("meta"));

        List<String> dates = new ArrayList<>();
        for (JsonNode timestamp : timestamps) {
            dates.add(Instant.ofEpochSecond(timestamp.asLong()).atZone(zone).toLocalDate().toString());
        }

        Map<String, List<Double>> columns = new LinkedHashMap<>();
        columns.put(DataValidator.OPEN, column(quote.get("open"), dates.size()));
        columns.put(DataValidator.HIGH, column(quote.get("high"), dates.size()));
        columns.put(DataValidator.LOW, column(quote.get("low"), dates.size()));
        columns.put(DataValidator.CLOSE, column(quote.get("close"), dates.size()));
        columns.put(DataValidator.VOLUME, column(quote.get("volume"), dates.size()));

        return RawPriceSeries.builder()
                .dates(dates)
                .columns(columns)
                .build();
    }

    List<String> parseOptionExpirations(JsonNode response) {
        JsonNode result = firstResult(response, "optionChain");
        List<String> expirations = new ArrayList<>();
        for (JsonNode epoch : result.path("expirationDates")) {
            expirations.add(epochToDate(epoch.asLong()));
        }
        return expirations;
    }

    OptionsExpiration parseOptionChain(JsonNode response) {
        JsonNode options = firstResult(response, "optionChain").path("options").path(0);
        return OptionsExpiration.builder()
                .calls(contracts(options.path("calls"), "call"))
                .puts(contracts(options.path("puts"), "put"))
                .build();
    }

    private List<OptionContract> contracts(JsonNode nodes, String type) {
        List<OptionContract> contracts = new ArrayList<>();
        for (JsonNode node : nodes) {
            JsonNode iv = node.get("impliedVolatility");
            contracts.add(OptionContract.builder()
                    .contractSymbol(node.path("contractSymbol").asText(""))
                    .strike(node.path("strike").asDouble())
                    .expiration(node.has("expiration") ? epochToDate(node.get("expiration").asLong()) : null)
                    .type(type)
                    .lastPrice(node.path("lastPrice").asDouble())
                    .bid(node.path("bid").asDouble())
                    .ask(node.path("ask").asDouble())
                    .change(node.path("change").asDouble())
                    .percentChange(node.path("percentChange").asDouble())
                    .volume(node.path("volume").asLong())
                    .openInterest(node.path("openInterest").asLong())
                    .impliedVolatility(iv != null && iv.isNumber() ? iv.asDouble() : null)
                    .inTheMoney(node.path("inTheMoney").asBoolean(false))
                    .build());
        }
        return contracts;
    }

    private static JsonNode firstResult(JsonNode response, String root) {
        JsonNode container = response.path(root);
        JsonNode error = container.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new UpstreamUnavailableException("Yahoo Finance " + root + " error: " + error.path("description").asText(error.toString()));
        }
        JsonNode result = container.path("result").path(0);
        if (result.isMissingNode() || result.isNull()) {
            throw new UpstreamUnavailableException("Yahoo Finance " + root + " response has no result");
        }
        return result;
    }

    private static Object scalar(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isObject()) {
            JsonNode raw = value.get("raw");
            return raw != null && raw.isNumber() ? raw.numberValue() : null;
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return null;
    }

    private static List<Double> column(JsonNode values, int size) {
        if (values == null || !values.isArray()) {
            return null;
        }
        List<Double> column = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            JsonNode value = values.get(i);
            column.add(value != null && value.isNumber() ? value.asDouble() : null);
        }
        return column;
    }

    private static ZoneId exchangeZone(JsonNode meta) {
        String zone = meta.path("exchangeTimezoneName").asText("");
        if (!zone.isEmpty()) {
            try {
                return ZoneId.of(zone);
            } catch (RuntimeException e) {
                log.debug("Unknown exchange timezone {}, using UTC", zone);
            }
        }
        return ZoneOffset.UTC;
    }

    private static String epochToDate(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).atZone(ZoneOffset.UTC).toLocalDate().toString();
    }
}
