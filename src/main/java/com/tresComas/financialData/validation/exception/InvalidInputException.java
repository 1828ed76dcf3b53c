package com.tresComas.financialData.validation.exception;

/**
 * Exception thrown when a caller passes a structurally invalid ticker, date or query parameter.
 */
public class InvalidInputException extends RuntimeException {
    
    public InvalidInputException(String message) {
        super(message);
    }
    
    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
