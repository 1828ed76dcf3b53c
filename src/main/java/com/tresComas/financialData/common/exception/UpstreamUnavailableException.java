package com.tresComas.financialData.common.exception;

/**
 * Exception thrown by provider API clients when an upstream call fails
 * (non-2xx status, timeout, malformed payload).
 * 
 * Never propagated past the source clients - they log it and degrade to an empty result.
 */
public class UpstreamUnavailableException extends RuntimeException {
    
    public UpstreamUnavailableException(String message) {
        super(message);
    }
    
    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
