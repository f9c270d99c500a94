package com.metrics.domain.model;

import lombok.Value;

import java.util.List;

/**
 * SQL text plus positional arguments, aligned with the {@code ?}
 * placeholders in emission order.
 */
@Value
public class CompiledQuery {
    
    String sql;
    List<Object> args;
    
    public static CompiledQuery of(String sql) {
        return new CompiledQuery(sql, List.of());
    }
}
