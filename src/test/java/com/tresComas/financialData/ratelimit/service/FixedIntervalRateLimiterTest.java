package com.tresComas.financialData.ratelimit.service;

import com.github.benmanes.caffeine.cache.Ticker;
import com.tresComas.financialData.ratelimit.util.Sleeper;
import com.tresComas.financialData.support.ManualTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FixedIntervalRateLimiterTest {

    @Test
    @DisplayName("first call waits only for the safety margin")
    void firstCall() {
        ManualTime time = new ManualTime();
        FixedIntervalRateLimiter limiter = new FixedIntervalRateLimiter("filings", 5, Duration.ofMillis(100), time, time);

        limiter.acquire();

        assertEquals(List.of(Duration.ofMillis(100)), time.getSleeps());
    }

    @Test
    @DisplayName("back-to-back calls are spaced by the interval plus margin")
    void backToBack() {
        ManualTime time = new ManualTime();
        FixedIntervalRateLimiter limiter = new FixedIntervalRateLimiter("filings", 5, Duration.ofMillis(100), time, time);

        limiter.acquire();
        time.clearSleeps();
        limiter.acquire();

        assertEquals(List.of(Duration.ofMillis(300)), time.getSleeps());
    }

    @Test
    @DisplayName("elapsed time counts toward the interval")
    void elapsedTimeCounts() {
        ManualTime time = new ManualTime();
        FixedIntervalRateLimiter limiter = new FixedIntervalRateLimiter("filings", 5, Duration.ZERO, time, time);

        limiter.acquire();
        time.advance(Duration.ofMillis(150));
        limiter.acquire();
        time.advance(Duration.ofSeconds(1));
        limiter.acquire();

        assertEquals(List.of(Duration.ofMillis(50)), time.getSleeps());
    }

    @Test
    @DisplayName("N calls on the system clock take at least (N-1)/rps")
    void systemClockSpacing() {
        FixedIntervalRateLimiter limiter =
                new FixedIntervalRateLimiter("filings", 20, Duration.ZERO, Ticker.systemTicker(), Sleeper.SYSTEM);

        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMillis >= 195, "elapsed " + elapsedMillis + " ms");
    }

    @Test
    @DisplayName("interrupted wait returns with the flag restored")
    void interrupted() {
        FixedIntervalRateLimiter limiter = new FixedIntervalRateLimiter("filings", 5, Duration.ofSeconds(5),
                Ticker.systemTicker(), Sleeper.SYSTEM);

        Thread.currentThread().interrupt();
        try {
            assertDoesNotThrow(limiter::acquire);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("non-positive rate is rejected")
    void invalidRate() {
        ManualTime time = new ManualTime();
        assertThrows(IllegalArgumentException.class,
                () -> new FixedIntervalRateLimiter("filings", 0, Duration.ZERO, time, time));
    }
}
