package com.tresComas.financialData.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.tresComas.financialData.ratelimit.service.FixedIntervalRateLimiter;
import com.tresComas.financialData.ratelimit.service.RateLimiter;
import com.tresComas.financialData.ratelimit.service.WindowedBackoffRateLimiter;
import com.tresComas.financialData.ratelimit.util.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * One rate limiter per provider.
 * - Market data: unpublished limits, so requests are spaced and back off exponentially within an hourly window
 * - Filings: published ceiling, so requests are spaced at a fixed interval plus a safety margin
 */
@Configuration
public class RateLimiterConfig {

    @Value("${ratelimit.market-data.window:1h}")
    private Duration marketDataWindow;

    @Value("${ratelimit.market-data.min-spacing:1s}")
    private Duration marketDataMinSpacing;

    @Value("${ratelimit.market-data.backoff-threshold:5}")
    private int marketDataBackoffThreshold;

    @Value("${ratelimit.market-data.max-delay:30s}")
    private Duration marketDataMaxDelay;

    @Value("${ratelimit.filings.requests-per-second:5}")
    private double filingsRequestsPerSecond;

    @Value("${ratelimit.filings.safety-margin:100ms}")
    private Duration filingsSafetyMargin;

    @Bean
    public RateLimiter marketDataRateLimiter(Ticker ticker) {
        return WindowedBackoffRateLimiter.builder()
                .name("market-data")
                .window(marketDataWindow)
                .minSpacing(marketDataMinSpacing)
                .backoffThreshold(marketDataBackoffThreshold)
                .maxDelay(marketDataMaxDelay)
                .ticker(ticker)
                .sleeper(Sleeper.SYSTEM)
                .build();
    }

    @Bean
    public RateLimiter filingsRateLimiter(Ticker ticker) {
        return new FixedIntervalRateLimiter("filings", filingsRequestsPerSecond, filingsSafetyMargin, ticker, Sleeper.SYSTEM);
    }
}
