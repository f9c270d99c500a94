package com.metrics.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A requested measure: either a measure declared on the view, or a builtin
 * (COUNT, COUNT_DISTINCT) aliased to {@code name}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationMeasure {
    
    @NotBlank
    private String name;
    private BuiltinMeasure builtinMeasure;
    
    @Builder.Default
    private List<Object> builtinMeasureArgs = new ArrayList<>();
    
    public static AggregationMeasure of(String name) {
        return AggregationMeasure.builder().name(name).build();
    }
    
    public static AggregationMeasure count(String alias) {
        return AggregationMeasure.builder()
                .name(alias)
                .builtinMeasure(BuiltinMeasure.COUNT)
                .build();
    }
    
    public static AggregationMeasure countDistinct(String alias, String field) {
        return AggregationMeasure.builder()
                .name(alias)
                .builtinMeasure(BuiltinMeasure.COUNT_DISTINCT)
                .builtinMeasureArgs(new ArrayList<>(List.of(field)))
                .build();
    }
}
