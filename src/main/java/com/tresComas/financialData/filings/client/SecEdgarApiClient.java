package com.tresComas.financialData.filings.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tresComas.financialData.common.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * Client for SEC EDGAR.
 * The SEC rejects requests without a descriptive User-Agent, so one must be configured.
 */
@Slf4j
@Component
public class SecEdgarApiClient implements FilingsApi {

    private final RestClient wwwClient;
    private final RestClient dataClient;

    @Autowired
    public SecEdgarApiClient(@Value("${sec.edgar.user-agent}") String userAgent,
                             @Value("${sec.edgar.www-base-url:https://www.sec.gov}") String wwwBaseUrl,
                             @Value("${sec.edgar.data-base-url:https://data.sec.gov}") String dataBaseUrl,
                             @Value("${sec.edgar.timeout:10s}") Duration timeout) {
        this(RestClient.builder().requestFactory(requestFactory(timeout)), userAgent, wwwBaseUrl, dataBaseUrl);
    }

    SecEdgarApiClient(RestClient.Builder builder, String userAgent, String wwwBaseUrl, String dataBaseUrl) {
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalStateException("SEC EDGAR user agent is not configured. Set sec.edgar.user-agent in application.yaml");
        }

        this.wwwClient = buildClient(builder.clone(), wwwBaseUrl, userAgent);
        this.dataClient = buildClient(builder.clone(), dataBaseUrl, userAgent);
    }

    @Override
    public JsonNode fetchTickerDirectory() {
        return get(wwwClient, "/files/company_tickers.json");
    }

    @Override
    public JsonNode fetchSubmissions(String cik) {
        return get(dataClient, "/submissions/CIK{cik}.json", cik);
    }

    @Override
    public JsonNode fetchCompanyFacts(String cik) {
        return get(dataClient, "/api/xbrl/companyfacts/CIK{cik}.json", cik);
    }

    private JsonNode get(RestClient client, String uri, Object... uriVariables) {
        try {
            log.debug("Calling SEC EDGAR - uri: {}", uri);
            return client.get()
                    .uri(uri, uriVariables)
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                            log.warn("SEC EDGAR resource not found - uri: {}", request.getURI());
                            return null;
                        }
                        if (response.getStatusCode().isError()) {
                            throw new UpstreamUnavailableException(
                                    "SEC EDGAR returned " + response.getStatusCode().value() + " for " + request.getURI());
                        }
                        return response.bodyTo(JsonNode.class);
                    });
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("Failed to call SEC EDGAR " + uri + ": " + e.getMessage(), e);
        }
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return requestFactory;
    }

    private static RestClient buildClient(RestClient.Builder builder, String baseUrl, String userAgent) {
        return builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
