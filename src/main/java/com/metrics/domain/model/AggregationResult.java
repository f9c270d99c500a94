package com.metrics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result of an aggregation: column schema plus rows in schema order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationResult {
    
    @Builder.Default
    private List<ColumnSchema> schema = new ArrayList<>();
    
    @Builder.Default
    private List<Map<String, Object>> data = new ArrayList<>();
    
    private boolean cached;
    private long queryTimeMs;
}
