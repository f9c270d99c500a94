package com.metrics.infrastructure.dialect;

import java.util.UUID;

public final class Identifiers {
    
    private Identifiers() {
    }
    
    /**
     * Unique identifier for a temporary table or alias, safe to use unquoted.
     */
    public static String tempName(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }
}
