package com.metrics.domain.exception;

/**
 * Configuration fault: the backend dialect is not one the engine can
 * generate SQL for.
 */
public class UnsupportedDialectException extends MetricsQueryException {
    
    public UnsupportedDialectException(String dialect) {
        super("not available for dialect '" + dialect + "'");
    }
}
