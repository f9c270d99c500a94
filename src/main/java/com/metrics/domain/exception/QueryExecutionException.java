package com.metrics.domain.exception;

import lombok.Getter;

/**
 * Backend-reported SQL or connection failure, tagged with the phase it
 * happened in so base-query failures can be told apart from pivot failures.
 */
@Getter
public class QueryExecutionException extends MetricsQueryException {
    
    private final Phase phase;
    
    public QueryExecutionException(Phase phase, Throwable cause) {
        super(phase + " failed: " + cause.getMessage(), cause);
        this.phase = phase;
    }
    
    public QueryExecutionException(Phase phase, String message) {
        super(phase + " failed: " + message);
        this.phase = phase;
    }
}
