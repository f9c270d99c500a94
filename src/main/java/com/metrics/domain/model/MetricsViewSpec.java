package com.metrics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Semantic layer over a physical analytical table.
 * 
 * Loaded by the catalog and handed to the engine read-only; the engine
 * never modifies a view during a request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsViewSpec {
    
    private String name;
    private String table;
    private String timeDimension;
    
    @Builder.Default
    private List<Dimension> dimensions = new ArrayList<>();
    
    @Builder.Default
    private List<Measure> measures = new ArrayList<>();
    
    public boolean hasTimeDimension() {
        return timeDimension != null && !timeDimension.isEmpty();
    }
    
    public Optional<Dimension> findDimension(String dimensionName) {
        return dimensions.stream()
                .filter(d -> d.getName().equals(dimensionName))
                .findFirst();
    }
    
    public Optional<Measure> findMeasure(String measureName) {
        return measures.stream()
                .filter(m -> m.getName().equals(measureName))
                .findFirst();
    }
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Dimension {
        
        private String name;
        private String column;
        private String expression;
        
        // Array-typed column, exploded with a lateral unnest where the backend needs one
        private boolean unnest;
        
        public boolean hasExpression() {
            return expression != null && !expression.isEmpty();
        }
    }
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Measure {
        
        private String name;
        private String expression;
    }
}
