package com.metrics.domain.model;

/**
 * Portable column types. Values are normalised on read so that each type
 * has exactly one Java representation.
 */
public enum ColumnType {
    STRING,     // String
    INTEGER,    // Long
    FLOAT,      // Double
    BOOLEAN,    // Boolean
    TIMESTAMP,  // Instant
    DATE,       // LocalDate
    UNKNOWN     // String
}
