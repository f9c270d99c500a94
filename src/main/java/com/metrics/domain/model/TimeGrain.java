package com.metrics.domain.model;

/**
 * Truncation granularity applied to a time dimension.
 */
public enum TimeGrain {
    MILLISECOND,
    SECOND,
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR
}
