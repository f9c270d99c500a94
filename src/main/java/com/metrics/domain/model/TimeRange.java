package com.metrics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Half-open interval [start, end) over the view's time dimension.
 * Either bound may be absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeRange {
    
    private Instant start;
    private Instant end;
    
    public static boolean isEmpty(TimeRange range) {
        return range == null || (range.getStart() == null && range.getEnd() == null);
    }
}
