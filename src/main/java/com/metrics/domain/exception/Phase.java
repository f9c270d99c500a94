package com.metrics.domain.exception;

/**
 * Stage of query execution a backend failure happened in.
 */
public enum Phase {
    CONNECTION,
    BASE_QUERY,
    COUNT_PROBE,
    PIVOT_LOAD,
    PIVOT_QUERY,
    CLEANUP
}
