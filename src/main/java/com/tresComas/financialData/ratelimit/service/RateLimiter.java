package com.tresComas.financialData.ratelimit.service;

/**
 * Paces outbound calls to an external provider.
 * Implementations block the caller until the next request may be sent; they never reject.
 */
public interface RateLimiter {

    /**
     * Blocks until the caller may issue its next request and records the request.
     * An interrupt ends the wait early with the interrupt flag restored.
     */
    void acquire();
}
