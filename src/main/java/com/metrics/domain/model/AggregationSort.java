package com.metrics.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationSort {
    
    @NotBlank
    private String name;
    private boolean desc;
    
    public static AggregationSort asc(String name) {
        return new AggregationSort(name, false);
    }
    
    public static AggregationSort desc(String name) {
        return new AggregationSort(name, true);
    }
}
