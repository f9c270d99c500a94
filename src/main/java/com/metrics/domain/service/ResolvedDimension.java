package com.metrics.domain.service;

import lombok.Value;

/**
 * A dimension lowered to SQL.
 * 
 * {@code selectExpression} is what the SELECT list projects (the unnested
 * alias for array dimensions); {@code filterExpression} is what predicates
 * compare against (the raw array for unnested dimensions).
 */
@Value
public class ResolvedDimension {
    
    String selectExpression;
    String filterExpression;
    String unnestClause;
    boolean unnested;
}
