package com.metrics.domain.model;

/**
 * Operators of a boolean {@link Expression} condition.
 */
public enum Operation {
    EQ("="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    IN(null),
    NIN(null),
    LIKE(null),
    NLIKE(null),
    AND(null),
    OR(null),
    NOT(null);
    
    private final String comparator;
    
    Operation(String comparator) {
        this.comparator = comparator;
    }
    
    public String comparator() {
        return comparator;
    }
}
