package com.metrics.domain.service;

import com.metrics.domain.exception.InvalidExpressionException;
import com.metrics.domain.model.Expression;
import com.metrics.domain.model.Expression.Condition;
import com.metrics.domain.model.MetricsViewFilter;
import com.metrics.domain.model.MetricsViewSpec;
import com.metrics.domain.model.Operation;
import com.metrics.infrastructure.dialect.Dialect;
import com.metrics.infrastructure.dialect.SqlFragment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Lowers boolean expression trees into parameterised SQL.
 *
 * Identifiers resolve in this order:
 * 1. Aliases of measures requested in the same query (HAVING)
 * 2. Measures declared on the view, referenced by alias
 * 3. The view's time dimension column
 * 4. Dimensions, through the same expressions the SELECT list uses
 *
 * Literals are always bound as arguments.
 */
@Component
@RequiredArgsConstructor
public class ExpressionCompiler {
    
    private final MetricsViewResolver resolver;
    
    public SqlFragment compile(MetricsViewSpec view, Expression expression, Dialect dialect) {
        return compile(view, expression, dialect, Collections.emptySet());
    }
    
    /**
     * Compile an expression. An absent tree yields an empty fragment, which
     * callers treat as "no constraint".
     */
    public SqlFragment compile(MetricsViewSpec view, Expression expression, Dialect dialect, Set<String> aliases) {
        if (expression == null) {
            return SqlFragment.EMPTY;
        }
        Compilation compilation = new Compilation(view, dialect, aliases);
        String sql = compilation.build(expression);
        return new SqlFragment(sql, List.copyOf(compilation.args));
    }
    
    /**
     * Convert a legacy include/exclude filter. Values of one included
     * dimension are ORed, everything else is ANDed.
     */
    public static Expression fromFilter(MetricsViewFilter filter) {
        if (filter == null) {
            return null;
        }
        List<Expression> clauses = new ArrayList<>();
        for (MetricsViewFilter.Cond cond : nullToEmpty(filter.getInclude())) {
            List<Expression> alternatives = new ArrayList<>();
            if (!nullToEmpty(cond.getIn()).isEmpty()) {
                alternatives.add(Expression.in(cond.getName(), cond.getIn().toArray()));
            }
            for (String pattern : nullToEmpty(cond.getLike())) {
                alternatives.add(Expression.like(cond.getName(), pattern));
            }
            if (alternatives.size() == 1) {
                clauses.add(alternatives.get(0));
            } else if (!alternatives.isEmpty()) {
                clauses.add(Expression.condition(Operation.OR, alternatives));
            }
        }
        for (MetricsViewFilter.Cond cond : nullToEmpty(filter.getExclude())) {
            if (!nullToEmpty(cond.getIn()).isEmpty()) {
                clauses.add(Expression.notIn(cond.getName(), cond.getIn().toArray()));
            }
            for (String pattern : nullToEmpty(cond.getLike())) {
                clauses.add(Expression.compare(Operation.NLIKE, cond.getName(), pattern));
            }
        }
        if (clauses.isEmpty()) {
            return null;
        }
        return Expression.condition(Operation.AND, clauses);
    }
    
    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }
    
    private class Compilation {
        
        private final MetricsViewSpec view;
        private final Dialect dialect;
        private final Set<String> aliases;
        private final List<Object> args = new ArrayList<>();
        
        Compilation(MetricsViewSpec view, Dialect dialect, Set<String> aliases) {
            this.view = view;
            this.dialect = dialect;
            this.aliases = aliases;
        }
        
        String build(Expression expr) {
            if (expr.isIdentifier()) {
                return identifier(expr.getIdent());
            }
            if (expr.isCondition()) {
                return condition(expr.getCond());
            }
            return literal(expr.getVal());
        }
        
        private String literal(Object value) {
            if (value == null) {
                return "NULL";
            }
            args.add(value);
            return "?";
        }
        
        private String identifier(String name) {
            if (aliases.contains(name) || view.findMeasure(name).isPresent()) {
                return dialect.safeName(name);
            }
            if (name.equals(view.getTimeDimension()) && view.findDimension(name).isEmpty()) {
                return dialect.safeName(name);
            }
            if (view.findDimension(name).isPresent()) {
                return resolver.resolveDimension(view, name, dialect).getFilterExpression();
            }
            throw new InvalidExpressionException("unknown column filter: " + name);
        }
        
        private String condition(Condition cond) {
            Operation op = cond.getOp();
            if (op == null) {
                throw new InvalidExpressionException("unspecified operation");
            }
            List<Expression> operands = nullToEmpty(cond.getExprs());
            
            switch (op) {
                case AND:
                case OR:
                    return junction(operands, op.name());
                case NOT:
                    requireOperands(op, operands, 1);
                    String inner = build(operands.get(0));
                    return inner.isBlank() ? "" : "NOT (" + inner + ")";
                case IN:
                case NIN:
                    return inList(operands, op == Operation.NIN);
                case LIKE:
                case NLIKE:
                    requireOperands(op, operands, 2);
                    String left = build(operands.get(0));
                    return dialect.likeExpression(left, build(operands.get(1)), op == Operation.NLIKE);
                default:
                    return comparison(op, operands);
            }
        }
        
        private String junction(List<Expression> operands, String keyword) {
            List<String> parts = new ArrayList<>();
            for (Expression operand : operands) {
                String part = build(operand);
                if (!part.isBlank()) {
                    parts.add(part);
                }
            }
            if (parts.isEmpty()) {
                return "";
            }
            if (parts.size() == 1) {
                return parts.get(0);
            }
            return "(" + String.join(" " + keyword + " ", parts) + ")";
        }
        
        private String comparison(Operation op, List<Expression> operands) {
            requireOperands(op, operands, 2);
            String left = build(operands.get(0));
            Expression right = operands.get(1);
            if (isNullLiteral(right)) {
                switch (op) {
                    case EQ:
                        return left + " IS NULL";
                    case NEQ:
                        return left + " IS NOT NULL";
                    default:
                        throw new InvalidExpressionException("operation " + op + " cannot compare against NULL");
                }
            }
            return left + " " + op.comparator() + " " + build(right);
        }
        
        private String inList(List<Expression> operands, boolean negate) {
            if (operands.isEmpty()) {
                throw new InvalidExpressionException("IN requires a left operand");
            }
            Expression leftExpr = operands.get(0);
            String left = build(leftExpr);
            
            List<String> placeholders = new ArrayList<>();
            boolean hasNull = false;
            for (Expression operand : operands.subList(1, operands.size())) {
                if (operand.isIdentifier() || operand.isCondition()) {
                    throw new InvalidExpressionException("IN list accepts only values");
                }
                if (operand.getVal() == null) {
                    hasNull = true;
                } else {
                    placeholders.add(literal(operand.getVal()));
                }
            }
            
            if (isUnnested(leftExpr)) {
                if (placeholders.isEmpty()) {
                    return negate ? "1=1" : "1=0";
                }
                String clause = "list_has_any(" + left + ", list_value(" + String.join(", ", placeholders) + "))";
                return negate ? "NOT " + clause : clause;
            }
            
            if (placeholders.isEmpty()) {
                if (hasNull) {
                    return left + (negate ? " IS NOT NULL" : " IS NULL");
                }
                return negate ? "1=1" : "1=0";
            }
            
            String list = "(" + String.join(", ", placeholders) + ")";
            if (negate) {
                // NOT IN excludes nulls unless null itself was excluded
                return hasNull
                        ? "(" + left + " NOT IN " + list + " AND " + left + " IS NOT NULL)"
                        : "(" + left + " NOT IN " + list + " OR " + left + " IS NULL)";
            }
            return hasNull
                    ? "(" + left + " IN " + list + " OR " + left + " IS NULL)"
                    : left + " IN " + list;
        }
        
        private boolean isUnnested(Expression expr) {
            if (!expr.isIdentifier() || !dialect.requiresLateralUnnest()) {
                return false;
            }
            String name = expr.getIdent();
            if (aliases.contains(name) || view.findMeasure(name).isPresent()) {
                return false;
            }
            return view.findDimension(name).map(MetricsViewSpec.Dimension::isUnnest).orElse(false);
        }
        
        private boolean isNullLiteral(Expression expr) {
            return !expr.isIdentifier() && !expr.isCondition() && expr.getVal() == null;
        }
        
        private void requireOperands(Operation op, List<Expression> operands, int expected) {
            if (operands.size() != expected) {
                throw new InvalidExpressionException(
                        "operation " + op + " expects " + expected + " operands, got " + operands.size());
            }
        }
    }
}
