package com.metrics.domain.exception;

import lombok.Getter;

/**
 * The pivot input would exceed the configured cell budget. Callers should
 * narrow the request (fewer dimensions or measures, smaller time range).
 */
@Getter
public class PivotCellLimitExceededException extends MetricsQueryException {
    
    private final int limit;
    
    public PivotCellLimitExceededException(int limit) {
        super("PIVOT cells count exceeded " + limit);
        this.limit = limit;
    }
}
