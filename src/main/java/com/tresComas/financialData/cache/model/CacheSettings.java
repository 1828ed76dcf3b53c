package com.tresComas.financialData.cache.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

@Value
@Builder
public class CacheSettings {

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    long maximumSize = 10_000;

    @Builder.Default
    Map<CacheCategory, Duration> ttls = Map.of();

    /**
     * Time-to-live for a category, falling back to the category default when not configured.
     */
    public Duration ttlFor(CacheCategory category) {
        CacheCategory effective = category != null ? category : CacheCategory.DEFAULT;
        Duration configured = ttls != null ? ttls.get(effective) : null;
        return configured != null ? configured : effective.getDefaultTtl();
    }
}
