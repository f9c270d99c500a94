package com.metrics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Boolean expression tree used for WHERE and HAVING.
 * 
 * A node is an identifier when {@code ident} is set, a condition when
 * {@code cond} is set, and otherwise a literal (which may be null).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Expression {
    
    private String ident;
    private Object val;
    private Condition cond;
    
    @JsonIgnore
    public boolean isIdentifier() {
        return ident != null;
    }
    
    @JsonIgnore
    public boolean isCondition() {
        return cond != null;
    }
    
    public static Expression identifier(String name) {
        return Expression.builder().ident(name).build();
    }
    
    public static Expression value(Object value) {
        return Expression.builder().val(value).build();
    }
    
    public static Expression condition(Operation op, List<Expression> operands) {
        return Expression.builder().cond(new Condition(op, new ArrayList<>(operands))).build();
    }
    
    public static Expression and(Expression... operands) {
        return condition(Operation.AND, Arrays.asList(operands));
    }
    
    public static Expression or(Expression... operands) {
        return condition(Operation.OR, Arrays.asList(operands));
    }
    
    public static Expression not(Expression operand) {
        return condition(Operation.NOT, List.of(operand));
    }
    
    public static Expression compare(Operation op, String field, Object value) {
        return condition(op, List.of(identifier(field), value(value)));
    }
    
    public static Expression in(String field, Object... values) {
        return inList(Operation.IN, field, Arrays.asList(values));
    }
    
    public static Expression notIn(String field, Object... values) {
        return inList(Operation.NIN, field, Arrays.asList(values));
    }
    
    public static Expression like(String field, String pattern) {
        return compare(Operation.LIKE, field, pattern);
    }
    
    static Expression inList(Operation op, String field, List<?> values) {
        List<Expression> operands = new ArrayList<>();
        operands.add(identifier(field));
        for (Object v : values) {
            operands.add(value(v));
        }
        return condition(op, operands);
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Condition {
        
        private Operation op;
        private List<Expression> exprs = new ArrayList<>();
    }
}
