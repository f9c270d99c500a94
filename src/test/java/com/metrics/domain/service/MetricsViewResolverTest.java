package com.metrics.domain.service;

import com.metrics.AdBidsTestData;
import com.metrics.domain.exception.InvalidRequestException;
import com.metrics.domain.exception.NotFoundException;
import com.metrics.domain.model.MetricsViewSpec;
import com.metrics.infrastructure.dialect.DruidDialect;
import com.metrics.infrastructure.dialect.DuckDbDialect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsViewResolverTest {
    
    private final MetricsViewSpec view = AdBidsTestData.view();
    private final MetricsViewResolver resolver = new MetricsViewResolver();
    
    @Test
    void testResolveDimension_Column() {
        ResolvedDimension dim = resolver.resolveDimension(view, "domain", DuckDbDialect.INSTANCE);
        
        assertEquals("(\"domain\")", dim.getSelectExpression());
        assertEquals("\"domain\"", dim.getFilterExpression());
        assertEquals("", dim.getUnnestClause());
        assertFalse(dim.isUnnested());
    }
    
    @Test
    void testResolveDimension_Expression() {
        ResolvedDimension dim = resolver.resolveDimension(view, "tld", DuckDbDialect.INSTANCE);
        
        assertEquals("(regexp_extract(domain, '[^.]+$'))", dim.getSelectExpression());
    }
    
    @Test
    void testResolveDimension_UnnestOnDuckDb() {
        ResolvedDimension dim = resolver.resolveDimension(view, "tags", DuckDbDialect.INSTANCE);
        
        assertTrue(dim.isUnnested());
        assertTrue(dim.getSelectExpression().startsWith("\"unnested_tags_"));
        assertTrue(dim.getUnnestClause().startsWith(", LATERAL UNNEST(\"ad_bids\".\"tags\") tbl"));
        assertTrue(dim.getUnnestClause().endsWith("(" + dim.getSelectExpression() + ")"));
        assertEquals("\"tags\"", dim.getFilterExpression());
    }
    
    @Test
    void testResolveDimension_NoUnnestOnDruid() {
        ResolvedDimension dim = resolver.resolveDimension(view, "tags", DruidDialect.INSTANCE);
        
        assertFalse(dim.isUnnested());
        assertEquals("(\"tags\")", dim.getSelectExpression());
    }
    
    @Test
    void testResolve_UnknownNames() {
        NotFoundException dimension = assertThrows(NotFoundException.class,
                () -> resolver.resolveDimension(view, "country", DuckDbDialect.INSTANCE));
        NotFoundException measure = assertThrows(NotFoundException.class,
                () -> resolver.resolveMeasureExpression(view, "revenue"));
        
        assertEquals("dimension 'country' not found in metrics view 'ad_bids_metrics'", dimension.getMessage());
        assertEquals("measure 'revenue' not found in metrics view 'ad_bids_metrics'", measure.getMessage());
    }
    
    @Test
    void testResolveTimeColumn() {
        assertEquals("\"timestamp\"", resolver.resolveTimeColumn(view, "timestamp", DuckDbDialect.INSTANCE));
        assertThrows(InvalidRequestException.class,
                () -> resolver.resolveTimeColumn(view, "tld", DuckDbDialect.INSTANCE));
    }
}
