package com.metrics.domain.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class ExecutionTimeoutException extends MetricsQueryException {
    
    private final Phase phase;
    private final Duration timeout;
    
    public ExecutionTimeoutException(Phase phase, Duration timeout, Throwable cause) {
        super(phase + " timed out after " + timeout.toMillis() + " ms", cause);
        this.phase = phase;
        this.timeout = timeout;
    }
}
