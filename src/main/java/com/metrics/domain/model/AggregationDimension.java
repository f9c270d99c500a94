package com.metrics.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A requested dimension. When a time grain is set the dimension is bucketed
 * in the given time zone (UTC when absent).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationDimension {
    
    @NotBlank
    private String name;
    private TimeGrain timeGrain;
    private String timeZone;
    
    public static AggregationDimension of(String name) {
        return AggregationDimension.builder().name(name).build();
    }
    
    public boolean isTimeBucket() {
        return timeGrain != null;
    }
}
