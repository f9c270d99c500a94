package com.metrics.infrastructure.dialect;

import com.metrics.domain.model.TimeGrain;

import java.time.Instant;

/**
 * SQL syntax and capability profile of an analytical backend.
 * 
 * Everything the compiler emits that differs between backends goes through
 * this interface; adding a backend means adding an implementation here and
 * registering it in {@link Dialects}.
 */
public interface Dialect {
    
    String name();
    
    /**
     * Truncate a timestamp column to the grain. Non-UTC zones are bound as
     * arguments, never interpolated.
     */
    SqlFragment timeBucketExpression(String column, TimeGrain grain, String timeZone);
    
    /**
     * Suffix appended to every ORDER BY term, possibly empty.
     */
    String nullOrdering();
    
    boolean supportsNativePivot();
    
    /**
     * Whether array dimensions must be exploded with a lateral unnest in the
     * FROM clause. Backends with native multi-value columns return false.
     */
    boolean requiresLateralUnnest();
    
    String likeExpression(String left, String right, boolean negate);
    
    /**
     * Value bound for a time range bound compared against the time dimension.
     */
    Object timestampArgument(Instant instant);
    
    default String safeName(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
    
    default String unnestClause(String arrayExpression, String tableAlias, String columnAlias) {
        return ", LATERAL UNNEST(" + arrayExpression + ") " + tableAlias + "(" + columnAlias + ")";
    }
    
    static boolean isUtc(String timeZone) {
        return timeZone == null || timeZone.isEmpty() || "UTC".equals(timeZone);
    }
}
