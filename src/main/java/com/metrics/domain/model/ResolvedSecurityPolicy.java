package com.metrics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Security rules already resolved for the caller.
 * 
 * The row filter is a backend SQL predicate validated upstream; it is
 * ANDed verbatim into every compiled query. Field access is enforced
 * upstream by masking which dimensions and measures are resolvable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedSecurityPolicy {
    
    private String rowFilter;
    
    public static ResolvedSecurityPolicy rowFilter(String predicate) {
        return new ResolvedSecurityPolicy(predicate);
    }
    
    public boolean hasRowFilter() {
        return rowFilter != null && !rowFilter.isBlank();
    }
}
