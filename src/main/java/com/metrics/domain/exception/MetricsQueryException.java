package com.metrics.domain.exception;

/**
 * Base class of every failure the engine surfaces to callers.
 * 
 * Raw driver errors are always classified into one of the subclasses
 * before they leave the engine.
 */
public abstract class MetricsQueryException extends RuntimeException {
    
    protected MetricsQueryException(String message) {
        super(message);
    }
    
    protected MetricsQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
