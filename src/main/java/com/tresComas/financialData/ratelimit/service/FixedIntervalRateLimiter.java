package com.tresComas.financialData.ratelimit.service;

import com.tresComas.financialData.ratelimit.util.Sleeper;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Spaces requests at least 1/requestsPerSecond apart, plus a fixed safety margin on every call.
 *
 * Used for the filings provider, which publishes a hard requests-per-second ceiling.
 * The first call only waits for the safety margin.
 */
@Slf4j
public class FixedIntervalRateLimiter implements RateLimiter {

    private final String name;
    private final long minIntervalNanos;
    private final long safetyMarginNanos;
    private final Ticker ticker;
    private final Sleeper sleeper;

    private long lastRequestNanos;
    private boolean hasRequested;

    public FixedIntervalRateLimiter(String name, double requestsPerSecond, Duration safetyMargin,
                                    Ticker ticker, Sleeper sleeper) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be positive: " + requestsPerSecond);
        }
        this.name = name;
        this.minIntervalNanos = (long) (1_000_000_000L / requestsPerSecond);
        this.safetyMarginNanos = safetyMargin == null ? 0L : Math.max(0L, safetyMargin.toNanos());
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    @Override
    public synchronized void acquire() {
        long waitNanos = 0L;
        if (hasRequested) {
            long elapsed = ticker.read() - lastRequestNanos;
            waitNanos = Math.max(0L, minIntervalNanos - elapsed);
        }
        waitNanos += safetyMarginNanos;

        if (waitNanos > 0) {
            log.debug("Rate limiting {} - waiting {} ms", name, waitNanos / 1_000_000);
            try {
                sleeper.sleep(Duration.ofNanos(waitNanos));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Rate limiter wait interrupted - limiter: {}", name);
            }
        }

        lastRequestNanos = ticker.read();
        hasRequested = true;
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
