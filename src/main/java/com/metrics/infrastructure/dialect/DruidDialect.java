package com.metrics.infrastructure.dialect;

import com.metrics.domain.model.TimeGrain;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Apache Druid SQL. No PIVOT operator, so pivots are materialised locally.
 * Multi-value columns filter and group natively without an unnest.
 */
public class DruidDialect implements Dialect {
    
    public static final DruidDialect INSTANCE = new DruidDialect();
    
    @Override
    public String name() {
        return "druid";
    }
    
    @Override
    public SqlFragment timeBucketExpression(String column, TimeGrain grain, String timeZone) {
        if (Dialect.isUtc(timeZone)) {
            return SqlFragment.of(String.format("date_trunc('%s', %s)",
                    DuckDbDialect.dateTruncSpecifier(grain), column));
        }
        return SqlFragment.of(
                String.format("time_floor(%s, '%s', null, CAST(? AS VARCHAR))", column, timeFloorPeriod(grain)),
                timeZone);
    }
    
    @Override
    public String nullOrdering() {
        return "";
    }
    
    @Override
    public boolean supportsNativePivot() {
        return false;
    }
    
    @Override
    public boolean requiresLateralUnnest() {
        return false;
    }
    
    @Override
    public String likeExpression(String left, String right, boolean negate) {
        return "LOWER(" + left + ")" + (negate ? " NOT LIKE " : " LIKE ") + "LOWER(" + right + ")";
    }
    
    @Override
    public Object timestampArgument(Instant instant) {
        return Timestamp.from(instant);
    }
    
    static String timeFloorPeriod(TimeGrain grain) {
        return switch (grain) {
            case MILLISECOND -> "PT0.001S";
            case SECOND -> "PT1S";
            case MINUTE -> "PT1M";
            case HOUR -> "PT1H";
            case DAY -> "P1D";
            case WEEK -> "P1W";
            case MONTH -> "P1M";
            case QUARTER -> "P3M";
            case YEAR -> "P1Y";
        };
    }
}
