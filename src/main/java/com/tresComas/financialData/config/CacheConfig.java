package com.tresComas.financialData.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tresComas.financialData.cache.model.CacheCategory;
import com.tresComas.financialData.cache.model.CacheSettings;
import com.tresComas.financialData.cache.service.ResponseCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Response cache configuration.
 * TTLs:
 * - Price (quotes, options, implied volatility): 1 hour
 * - Historical prices: 24 hours
 * - Filings (CIK, filings metadata, company facts): 7 days
 */
@Configuration
public class CacheConfig {

    @Value("${cache.enabled:true}")
    private boolean enabled;

    @Value("${cache.maximum-size:10000}")
    private long maximumSize;

    @Value("${cache.ttl.price:1h}")
    private Duration priceTtl;

    @Value("${cache.ttl.historical:24h}")
    private Duration historicalTtl;

    @Value("${cache.ttl.filing:7d}")
    private Duration filingTtl;

    @Value("${cache.ttl.default:1h}")
    private Duration defaultTtl;

    @Bean
    public CacheSettings cacheSettings() {
        return CacheSettings.builder()
                .enabled(enabled)
                .maximumSize(maximumSize)
                .ttls(Map.of(
                        CacheCategory.PRICE, priceTtl,
                        CacheCategory.HISTORICAL, historicalTtl,
                        CacheCategory.FILING, filingTtl,
                        CacheCategory.DEFAULT, defaultTtl))
                .build();
    }

    @Bean
    public ResponseCache responseCache(CacheSettings cacheSettings, ObjectMapper objectMapper, Clock clock) {
        return new ResponseCache(cacheSettings, objectMapper, clock);
    }
}
