package com.tresComas.financialData.ratelimit.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pause, separated out so tests can run limiters against a manual clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
