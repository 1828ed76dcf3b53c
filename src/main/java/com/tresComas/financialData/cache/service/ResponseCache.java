package com.tresComas.financialData.cache.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tresComas.financialData.cache.model.CacheCategory;
import com.tresComas.financialData.cache.model.CacheSettings;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Response cache backed by Caffeine.
 *
 * Values are stored as Jackson-serialized bytes together with the time they were written,
 * so a hit always yields a fresh copy. Freshness is judged on read against the TTL of the
 * category the caller asks for. Stale entries are left in place until overwritten, cleared
 * or evicted by the size bound.
 *
 * If the backing store cannot be built the cache runs disabled: every read misses,
 * every write returns false and clear returns 0.
 */
@Slf4j
public class ResponseCache {

    private final ObjectMapper objectMapper;
    private final CacheSettings settings;
    private final Clock clock;
    private final Cache<String, CacheEntry> entries;

    public ResponseCache(CacheSettings settings, ObjectMapper objectMapper, Clock clock) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.entries = settings.isEnabled() ? buildStore(settings) : null;
        if (entries == null) {
            log.warn("Response cache is disabled, all lookups will miss");
        } else {
            log.info("Response cache initialized - maximumSize: {}", settings.getMaximumSize());
        }
    }

    public boolean isEnabled() {
        return entries != null;
    }

    /**
     * Reads a cached value.
     *
     * @param key Cache key
     * @param category Freshness class deciding the TTL
     * @param type Type to materialize
     * @return The cached value, or null on miss, expiry, disabled cache or decode failure
     */
    public <T> T get(String key, CacheCategory category, Class<T> type) {
        byte[] bytes = readFresh(key, category);
        if (bytes == null) {
            return null;
        }
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            log.error("Failed to decode cached value - key: {}", key, e);
            entries.invalidate(key);
            return null;
        }
    }

    public <T> T get(String key, CacheCategory category, TypeReference<T> type) {
        byte[] bytes = readFresh(key, category);
        if (bytes == null) {
            return null;
        }
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            log.error("Failed to decode cached value - key: {}", key, e);
            entries.invalidate(key);
            return null;
        }
    }

    /**
     * Stores a value, replacing any previous entry under the key.
     * The category is only recorded for logging; freshness is decided by the category passed to get.
     *
     * @return true if stored, false when disabled or the value cannot be serialized
     */
    public boolean set(String key, Object value, CacheCategory category) {
        if (entries == null || key == null) {
            return false;
        }
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(value);
            entries.put(key, new CacheEntry(bytes, clock.instant()));
            log.debug("Cached value - key: {}, category: {}, bytes: {}", key, category, bytes.length);
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize value for cache - key: {}", key, e);
            return false;
        }
    }

    /**
     * Removes entries whose key contains the pattern, or every entry when the pattern is null or empty.
     *
     * @return Number of entries removed
     */
    public int clear(String pattern) {
        if (entries == null) {
            return 0;
        }
        List<String> keys = entries.asMap().keySet().stream()
                .filter(key -> pattern == null || pattern.isEmpty() || key.contains(pattern))
                .toList();
        entries.invalidateAll(keys);
        log.info("Cleared cache entries - pattern: {}, count: {}", pattern, keys.size());
        return keys.size();
    }

    public long size() {
        return entries == null ? 0 : entries.estimatedSize();
    }

    private byte[] readFresh(String key, CacheCategory category) {
        if (entries == null || key == null) {
            return null;
        }
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            log.debug("Cache miss - key: {}", key);
            return null;
        }
        Duration ttl = settings.ttlFor(category);
        if (Duration.between(entry.storedAt(), clock.instant()).compareTo(ttl) > 0) {
            log.debug("Cache entry expired - key: {}, ttl: {}", key, ttl);
            return null;
        }
        log.debug("Cache hit - key: {}", key);
        return entry.value();
    }

    private static Cache<String, CacheEntry> buildStore(CacheSettings settings) {
        try {
            return Caffeine.newBuilder()
                    .maximumSize(settings.getMaximumSize())
                    .build();
        } catch (RuntimeException e) {
            log.error("Failed to initialize response cache, continuing without cache", e);
            return null;
        }
    }

    private record CacheEntry(byte[] value, Instant storedAt) {
    }
}
