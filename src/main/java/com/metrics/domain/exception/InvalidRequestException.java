package com.metrics.domain.exception;

/**
 * Client input fault. Raised before any backend work and never retried.
 */
public class InvalidRequestException extends MetricsQueryException {
    
    public InvalidRequestException(String message) {
        super(message);
    }
}
