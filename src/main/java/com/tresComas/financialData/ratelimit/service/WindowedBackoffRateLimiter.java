package com.tresComas.financialData.ratelimit.service;

import com.tresComas.financialData.ratelimit.util.Sleeper;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Rate limiter for the market data provider, which throttles without publishing a limit.
 *
 * Within a rolling window (one hour by default) requests are spaced by a minimum interval.
 * Once the window's request count passes the backoff threshold every further request waits
 * an extra 2^(count / backoffStep) seconds, capped at maxDelay. The count resets when the
 * window rolls over.
 */
@Slf4j
public class WindowedBackoffRateLimiter implements RateLimiter {

    private final String name;
    private final long windowNanos;
    private final long minSpacingNanos;
    private final int backoffThreshold;
    private final int backoffStep;
    private final Duration maxDelay;
    private final Ticker ticker;
    private final Sleeper sleeper;

    private long windowStartNanos;
    private long lastRequestNanos;
    private boolean hasRequested;
    private int requestCount;
    private Duration lastBackoffDelay = Duration.ZERO;

    @Builder
    public WindowedBackoffRateLimiter(String name, Duration window, Duration minSpacing, Integer backoffThreshold,
                                      Integer backoffStep, Duration maxDelay, Ticker ticker, Sleeper sleeper) {
        this.name = name != null ? name : "market-data";
        this.windowNanos = (window != null ? window : Duration.ofHours(1)).toNanos();
        this.minSpacingNanos = (minSpacing != null ? minSpacing : Duration.ofSeconds(1)).toNanos();
        this.backoffThreshold = backoffThreshold != null ? backoffThreshold : 5;
        this.backoffStep = backoffStep != null && backoffStep > 0 ? backoffStep : 5;
        this.maxDelay = maxDelay != null ? maxDelay : Duration.ofSeconds(30);
        this.ticker = ticker != null ? ticker : Ticker.systemTicker();
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.windowStartNanos = this.ticker.read();
    }

    @Override
    public synchronized void acquire() {
        long now = ticker.read();
        if (now - windowStartNanos > windowNanos) {
            log.debug("Rate limit window rolled over - limiter: {}, requests in last window: {}", name, requestCount);
            windowStartNanos = now;
            requestCount = 0;
        }

        if (hasRequested) {
            long elapsed = now - lastRequestNanos;
            if (elapsed < minSpacingNanos) {
                pause(Duration.ofNanos(minSpacingNanos - elapsed));
            }
        }

        if (requestCount > backoffThreshold) {
            Duration delay = backoffDelay(requestCount);
            lastBackoffDelay = delay;
            log.info("Backing off {} - request {} in window, delaying {} ms", name, requestCount, delay.toMillis());
            pause(delay);
        } else {
            lastBackoffDelay = Duration.ZERO;
        }

        lastRequestNanos = ticker.read();
        hasRequested = true;
        requestCount++;
    }

    public synchronized int getRequestCount() {
        return requestCount;
    }

    public synchronized Duration getLastBackoffDelay() {
        return lastBackoffDelay;
    }

    private Duration backoffDelay(int count) {
        int exponent = count / backoffStep;
        if (exponent >= 62) {
            return maxDelay;
        }
        Duration delay = Duration.ofSeconds(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    private void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Rate limiter wait interrupted - limiter: {}", name);
        }
    }
}
