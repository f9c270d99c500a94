package com.metrics.infrastructure.dialect;

import com.metrics.domain.exception.UnsupportedDialectException;

import java.util.Locale;

/**
 * Registry of known dialects.
 */
public final class Dialects {
    
    private Dialects() {
    }
    
    public static Dialect forName(String name) {
        if (name == null) {
            throw new UnsupportedDialectException("null");
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "duckdb" -> DuckDbDialect.INSTANCE;
            case "druid" -> DruidDialect.INSTANCE;
            default -> throw new UnsupportedDialectException(name);
        };
    }
}
