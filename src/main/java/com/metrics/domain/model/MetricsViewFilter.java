package com.metrics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Older include/exclude filter representation, still accepted from clients
 * that predate structured expressions. Converted to an {@link Expression}
 * before compilation; a request may carry this or {@code where}, not both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsViewFilter {
    
    @Builder.Default
    private List<Cond> include = new ArrayList<>();
    
    @Builder.Default
    private List<Cond> exclude = new ArrayList<>();
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Cond {
        
        private String name;
        
        @Builder.Default
        private List<Object> in = new ArrayList<>();
        
        @Builder.Default
        private List<String> like = new ArrayList<>();
    }
}
