package com.metrics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative aggregation against a metrics view.
 * 
 * Built fresh per invocation by the API layer. The resolved security policy
 * travels with the request so that it is part of the cache key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AggregationRequest {
    
    private String metricsView;
    
    @Valid
    @Builder.Default
    private List<AggregationDimension> dimensions = new ArrayList<>();
    
    @Valid
    @Builder.Default
    private List<AggregationMeasure> measures = new ArrayList<>();
    
    @Valid
    @Builder.Default
    private List<AggregationSort> sort = new ArrayList<>();
    
    private TimeRange timeRange;
    private Expression where;
    private Expression having;
    
    // Legacy filter; mutually exclusive with where
    private MetricsViewFilter filter;
    
    private int priority;
    
    // null means unbounded, 0 means the default page size
    private Long limit;
    private long offset;
    
    @Builder.Default
    private List<String> pivotOn = new ArrayList<>();
    
    private ResolvedSecurityPolicy security;
    
    // Absent lists in a request body mean "none requested"
    public List<AggregationDimension> getDimensions() {
        return dimensions == null ? List.of() : dimensions;
    }
    
    public List<AggregationMeasure> getMeasures() {
        return measures == null ? List.of() : measures;
    }
    
    public List<AggregationSort> getSort() {
        return sort == null ? List.of() : sort;
    }
    
    public List<String> getPivotOn() {
        return pivotOn == null ? List.of() : pivotOn;
    }
    
    @JsonIgnore
    public boolean isPivot() {
        return !getPivotOn().isEmpty();
    }
    
    /**
     * Number of output columns before pivoting.
     */
    @JsonIgnore
    public int getColumnCount() {
        return getDimensions().size() + getMeasures().size();
    }
    
    @JsonIgnore
    public boolean isConstrained() {
        return !TimeRange.isEmpty(timeRange) || where != null || having != null || filter != null;
    }
}
