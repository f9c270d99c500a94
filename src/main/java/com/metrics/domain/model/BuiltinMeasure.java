package com.metrics.domain.model;

/**
 * Measures computed by the engine itself rather than declared on the view.
 */
public enum BuiltinMeasure {
    COUNT,
    COUNT_DISTINCT
}
