package com.metrics.infrastructure.dialect;

import com.metrics.domain.model.TimeGrain;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * DuckDB and other embedded engines with DuckDB syntax. Supports PIVOT.
 */
public class DuckDbDialect implements Dialect {
    
    public static final DuckDbDialect INSTANCE = new DuckDbDialect();
    
    @Override
    public String name() {
        return "duckdb";
    }
    
    @Override
    public SqlFragment timeBucketExpression(String column, TimeGrain grain, String timeZone) {
        String specifier = dateTruncSpecifier(grain);
        if (Dialect.isUtc(timeZone)) {
            return SqlFragment.of(String.format("date_trunc('%s', %s)", specifier, column));
        }
        return SqlFragment.of(
                String.format("timezone(?, date_trunc('%s', timezone(?, %s::TIMESTAMPTZ)))", specifier, column),
                timeZone, timeZone);
    }
    
    // Keeps paging deterministic when the sort column has nulls
    @Override
    public String nullOrdering() {
        return " NULLS LAST";
    }
    
    @Override
    public boolean supportsNativePivot() {
        return true;
    }
    
    @Override
    public boolean requiresLateralUnnest() {
        return true;
    }
    
    @Override
    public String likeExpression(String left, String right, boolean negate) {
        return left + (negate ? " NOT ILIKE " : " ILIKE ") + right;
    }
    
    // TIMESTAMP columns hold UTC wall-clock values
    @Override
    public Object timestampArgument(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
    
    static String dateTruncSpecifier(TimeGrain grain) {
        return grain.name().toLowerCase(Locale.ROOT);
    }
}
