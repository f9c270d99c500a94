package com.metrics.domain.service;

import com.metrics.domain.exception.InvalidRequestException;
import com.metrics.domain.model.AggregationDimension;
import com.metrics.domain.model.AggregationMeasure;
import com.metrics.domain.model.AggregationRequest;
import com.metrics.domain.model.AggregationSort;
import com.metrics.domain.model.CompiledQuery;
import com.metrics.domain.model.Expression;
import com.metrics.domain.model.MetricsViewSpec;
import com.metrics.domain.model.ResolvedSecurityPolicy;
import com.metrics.domain.model.TimeRange;
import com.metrics.infrastructure.dialect.Dialect;
import com.metrics.infrastructure.dialect.SqlFragment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiles an aggregation request into dialect-specific SQL.
 *
 * Query shape:
 * SELECT dims..., measures... FROM table [, LATERAL UNNEST ...]
 * [WHERE 1=1 AND time range AND where AND (row filter)]
 * GROUP BY 1, 2, ... [HAVING ...] [ORDER BY ...] [LIMIT n] OFFSET m
 *
 * GROUP BY uses ordinals of the dimension columns. A timezone-adjusted
 * bucket cannot be grouped by its alias on every backend, and restating the
 * expression would duplicate its bound arguments.
 *
 * Arguments are emitted in placeholder order: time buckets, time range,
 * WHERE, HAVING.
 */
@Slf4j
@Component
public class AggregationSqlBuilder {
    
    public static final long DEFAULT_LIMIT = 100;
    
    private final MetricsViewResolver resolver;
    private final ExpressionCompiler expressionCompiler;
    private final int maxPivotCells;
    
    public AggregationSqlBuilder(
            MetricsViewResolver resolver,
            ExpressionCompiler expressionCompiler,
            @Value("${metrics.engine.max-pivot-cells:1000000}") int maxPivotCells) {
        this.resolver = resolver;
        this.expressionCompiler = expressionCompiler;
        this.maxPivotCells = maxPivotCells;
    }
    
    public CompiledQuery build(MetricsViewSpec view, AggregationRequest request, Dialect dialect,
                               ResolvedSecurityPolicy policy) {
        validate(view, request);
        
        List<String> selectCols = new ArrayList<>();
        List<String> groupCols = new ArrayList<>();
        List<String> unnestClauses = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        
        for (AggregationDimension d : request.getDimensions()) {
            if (!d.isTimeBucket()) {
                ResolvedDimension dim = resolver.resolveDimension(view, d.getName(), dialect);
                selectCols.add(dim.getSelectExpression() + " as " + dialect.safeName(d.getName()));
                if (!dim.getUnnestClause().isEmpty()) {
                    unnestClauses.add(dim.getUnnestClause());
                }
            } else {
                String column = resolver.resolveTimeColumn(view, d.getName(), dialect);
                SqlFragment bucket = dialect.timeBucketExpression(column, d.getTimeGrain(), d.getTimeZone());
                selectCols.add(bucket.getSql() + " as " + dialect.safeName(d.getName()));
                args.addAll(bucket.getArgs());
            }
            groupCols.add(String.valueOf(selectCols.size()));
        }
        
        Set<String> measureAliases = new HashSet<>();
        for (AggregationMeasure m : request.getMeasures()) {
            selectCols.add(measureExpression(view, m, dialect) + " as " + dialect.safeName(m.getName()));
            measureAliases.add(m.getName());
        }
        
        String whereClause = buildWhere(view, request, dialect, policy, args);
        
        String havingClause = "";
        if (request.getHaving() != null) {
            SqlFragment having = expressionCompiler.compile(view, request.getHaving(), dialect, measureAliases);
            if (!having.isEmpty()) {
                havingClause = "HAVING " + having.getSql();
                args.addAll(having.getArgs());
            }
        }
        
        String groupClause = groupCols.isEmpty() ? "" : "GROUP BY " + String.join(", ", groupCols);
        String orderClause = orderClause(request.getSort(), dialect);
        
        String limitClause;
        String offsetClause;
        if (request.isPivot()) {
            // One row past the budget is enough to detect overflow
            limitClause = "LIMIT " + (maxPivotCells / request.getColumnCount() + 1);
            offsetClause = "";
        } else {
            Long limit = effectiveLimit(request.getLimit());
            limitClause = limit == null ? "" : "LIMIT " + limit;
            offsetClause = "OFFSET " + request.getOffset();
        }
        
        String sql = join(
                "SELECT " + String.join(", ", selectCols),
                "FROM " + dialect.safeName(view.getTable()) + String.join("", unnestClauses),
                whereClause,
                groupClause,
                havingClause,
                orderClause,
                limitClause,
                offsetClause);
        
        log.debug("Compiled aggregation on {}: {}", view.getName(), sql);
        
        return new CompiledQuery(sql, List.copyOf(args));
    }
    
    /**
     * PIVOT statement over a materialised base aggregation. Measures use
     * LAST since the input already has one row per dimension combination.
     */
    public String buildPivot(AggregationRequest request, String table, Dialect pivotDialect) {
        List<String> measureCols = new ArrayList<>();
        for (AggregationMeasure m : request.getMeasures()) {
            String sn = pivotDialect.safeName(m.getName());
            measureCols.add("LAST(" + sn + ") as " + sn);
        }
        
        List<String> pivotCols = new ArrayList<>();
        for (String p : request.getPivotOn()) {
            pivotCols.add(pivotDialect.safeName(p));
        }
        
        Long limit = effectiveLimit(request.getLimit());
        
        // PIVOT t ON year USING LAST(ap) as ap
        return join(
                "PIVOT " + table,
                "ON " + String.join(", ", pivotCols),
                "USING " + String.join(", ", measureCols),
                orderClause(request.getSort(), pivotDialect),
                limit == null ? "" : "LIMIT " + limit,
                "OFFSET " + request.getOffset());
    }
    
    /**
     * Zero is the unset value of most clients, so it means the default page
     * size rather than "no rows".
     */
    public static Long effectiveLimit(Long limit) {
        if (limit != null && limit == 0) {
            return DEFAULT_LIMIT;
        }
        return limit;
    }
    
    public int getMaxPivotCells() {
        return maxPivotCells;
    }
    
    private void validate(MetricsViewSpec view, AggregationRequest request) {
        if (request.getColumnCount() == 0) {
            throw new InvalidRequestException("no dimensions or measures specified");
        }
        if (!view.hasTimeDimension() && !TimeRange.isEmpty(request.getTimeRange())) {
            throw new InvalidRequestException("metrics view '" + view.getName() + "' does not have a time dimension");
        }
        if (request.getFilter() != null && request.getWhere() != null) {
            throw new InvalidRequestException("both filter and where is provided");
        }
        if (request.getOffset() < 0) {
            throw new InvalidRequestException("offset must not be negative");
        }
        if (request.getLimit() != null && request.getLimit() < 0) {
            throw new InvalidRequestException("limit must not be negative");
        }
        if (request.isPivot()) {
            if (request.getOffset() != 0) {
                throw new InvalidRequestException("offset not supported for pivot queries");
            }
            for (String p : request.getPivotOn()) {
                boolean requested = request.getDimensions().stream().anyMatch(d -> d.getName().equals(p));
                if (!requested) {
                    throw new InvalidRequestException("pivot dimension '" + p + "' is not a requested dimension");
                }
            }
        }
    }
    
    private String measureExpression(MetricsViewSpec view, AggregationMeasure m, Dialect dialect) {
        if (m.getBuiltinMeasure() == null) {
            return resolver.resolveMeasureExpression(view, m.getName());
        }
        switch (m.getBuiltinMeasure()) {
            case COUNT:
                return "COUNT(*)";
            case COUNT_DISTINCT:
                List<Object> measureArgs = m.getBuiltinMeasureArgs();
                if (measureArgs == null || measureArgs.size() != 1) {
                    throw new InvalidRequestException("builtin measure 'COUNT_DISTINCT' expects 1 argument");
                }
                Object arg = measureArgs.get(0);
                if (!(arg instanceof String) || ((String) arg).isEmpty()) {
                    throw new InvalidRequestException(
                            "builtin measure 'COUNT_DISTINCT' expects non-empty string argument, got '" + arg + "'");
                }
                return "COUNT(DISTINCT " + dialect.safeName((String) arg) + ")";
            default:
                throw new InvalidRequestException("unknown builtin measure '" + m.getBuiltinMeasure() + "'");
        }
    }
    
    private String buildWhere(MetricsViewSpec view, AggregationRequest request, Dialect dialect,
                              ResolvedSecurityPolicy policy, List<Object> args) {
        StringBuilder where = new StringBuilder();
        
        TimeRange range = request.getTimeRange();
        if (view.hasTimeDimension() && !TimeRange.isEmpty(range)) {
            String timeCol = dialect.safeName(view.getTimeDimension());
            if (range.getStart() != null) {
                where.append(" AND ").append(timeCol).append(" >= ?");
                args.add(dialect.timestampArgument(range.getStart()));
            }
            if (range.getEnd() != null) {
                where.append(" AND ").append(timeCol).append(" < ?");
                args.add(dialect.timestampArgument(range.getEnd()));
            }
        }
        
        Expression filter = request.getFilter() != null
                ? ExpressionCompiler.fromFilter(request.getFilter())
                : request.getWhere();
        SqlFragment compiled = expressionCompiler.compile(view, filter, dialect);
        if (!compiled.isEmpty()) {
            where.append(" AND ").append(compiled.getSql());
            args.addAll(compiled.getArgs());
        }
        
        if (policy != null && policy.hasRowFilter()) {
            where.append(" AND (").append(policy.getRowFilter()).append(")");
        }
        
        return where.length() == 0 ? "" : "WHERE 1=1" + where;
    }
    
    private static String orderClause(List<AggregationSort> sort, Dialect dialect) {
        if (sort == null || sort.isEmpty()) {
            return "";
        }
        List<String> criteria = new ArrayList<>();
        for (AggregationSort s : sort) {
            String criterion = dialect.safeName(s.getName());
            if (s.isDesc()) {
                criterion += " DESC";
            }
            criteria.add(criterion + dialect.nullOrdering());
        }
        return "ORDER BY " + String.join(", ", criteria);
    }
    
    private static String join(String... clauses) {
        StringBuilder sql = new StringBuilder();
        for (String clause : clauses) {
            if (clause.isEmpty()) {
                continue;
            }
            if (sql.length() > 0) {
                sql.append(' ');
            }
            sql.append(clause);
        }
        return sql.toString();
    }
}
