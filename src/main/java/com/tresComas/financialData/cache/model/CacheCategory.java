package com.tresComas.financialData.cache.model;

import java.time.Duration;

/**
 * Freshness classes for cached responses, each with its default time-to-live.
 */
public enum CacheCategory {
    PRICE(Duration.ofHours(1)),
    HISTORICAL(Duration.ofHours(24)),
    FILING(Duration.ofDays(7)),
    DEFAULT(Duration.ofHours(1));

    private final Duration defaultTtl;

    CacheCategory(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
