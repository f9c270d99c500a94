package com.metrics.domain.service;

import com.metrics.domain.exception.InvalidRequestException;
import com.metrics.domain.exception.NotFoundException;
import com.metrics.domain.model.MetricsViewSpec;
import com.metrics.domain.model.MetricsViewSpec.Dimension;
import com.metrics.infrastructure.dialect.Dialect;
import com.metrics.infrastructure.dialect.Identifiers;
import org.springframework.stereotype.Component;

/**
 * Resolves dimension and measure names of a metrics view to SQL.
 */
@Component
public class MetricsViewResolver {
    
    public ResolvedDimension resolveDimension(MetricsViewSpec view, String name, Dialect dialect) {
        Dimension dim = view.findDimension(name)
                .orElseThrow(() -> NotFoundException.dimension(view.getName(), name));
        
        String expr = dimensionExpression(dim, dialect);
        if (!dim.isUnnest() || !dialect.requiresLateralUnnest()) {
            return new ResolvedDimension("(" + expr + ")", expr, "", false);
        }
        
        // select "unnested_x" as "x" from t, lateral unnest(t."x") tbl("unnested_x")
        String unnestCol = dialect.safeName(Identifiers.tempName("unnested_" + dim.getName() + "_"));
        String unnestTable = Identifiers.tempName("tbl");
        String arrayExpr = dim.hasExpression()
                ? dim.getExpression()
                : dialect.safeName(view.getTable()) + "." + expr;
        return new ResolvedDimension(unnestCol, expr,
                dialect.unnestClause(arrayExpr, unnestTable, unnestCol), true);
    }
    
    public String resolveMeasureExpression(MetricsViewSpec view, String name) {
        return view.findMeasure(name)
                .orElseThrow(() -> NotFoundException.measure(view.getName(), name))
                .getExpression();
    }
    
    /**
     * Column to bucket for a time dimension request. Either the view's time
     * dimension or a declared column dimension; expression dimensions are
     * not supported as time columns.
     */
    public String resolveTimeColumn(MetricsViewSpec view, String name, Dialect dialect) {
        if (name.equals(view.getTimeDimension())) {
            return dialect.safeName(name);
        }
        Dimension dim = view.findDimension(name)
                .orElseThrow(() -> NotFoundException.dimension(view.getName(), name));
        if (dim.hasExpression()) {
            throw new InvalidRequestException("expression dimension '" + name + "' not supported as time column");
        }
        return dimensionExpression(dim, dialect);
    }
    
    static String dimensionExpression(Dimension dim, Dialect dialect) {
        if (dim.hasExpression()) {
            return dim.getExpression();
        }
        if (dim.getColumn() != null && !dim.getColumn().isEmpty()) {
            return dialect.safeName(dim.getColumn());
        }
        return dialect.safeName(dim.getName());
    }
}
