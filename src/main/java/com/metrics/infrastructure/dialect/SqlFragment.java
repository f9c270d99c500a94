package com.metrics.infrastructure.dialect;

import lombok.Value;

import java.util.List;

/**
 * A piece of SQL plus the arguments bound to its placeholders, in order.
 */
@Value
public class SqlFragment {
    
    public static final SqlFragment EMPTY = new SqlFragment("", List.of());
    
    String sql;
    List<Object> args;
    
    public static SqlFragment of(String sql, Object... args) {
        return new SqlFragment(sql, List.of(args));
    }
    
    public boolean isEmpty() {
        return sql.isBlank();
    }
}
