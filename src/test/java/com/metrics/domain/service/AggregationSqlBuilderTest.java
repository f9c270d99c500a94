package com.metrics.domain.service;

import com.metrics.AdBidsTestData;
import com.metrics.domain.exception.InvalidRequestException;
import com.metrics.domain.exception.NotFoundException;
import com.metrics.domain.model.AggregationDimension;
import com.metrics.domain.model.AggregationMeasure;
import com.metrics.domain.model.AggregationRequest;
import com.metrics.domain.model.AggregationSort;
import com.metrics.domain.model.BuiltinMeasure;
import com.metrics.domain.model.CompiledQuery;
import com.metrics.domain.model.Expression;
import com.metrics.domain.model.MetricsViewFilter;
import com.metrics.domain.model.MetricsViewSpec;
import com.metrics.domain.model.Operation;
import com.metrics.domain.model.ResolvedSecurityPolicy;
import com.metrics.domain.model.TimeGrain;
import com.metrics.domain.model.TimeRange;
import com.metrics.infrastructure.dialect.DruidDialect;
import com.metrics.infrastructure.dialect.DuckDbDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregationSqlBuilderTest {
    
    private MetricsViewSpec view;
    private AggregationSqlBuilder builder;
    
    @BeforeEach
    void setUp() {
        view = AdBidsTestData.view();
        MetricsViewResolver resolver = new MetricsViewResolver();
        builder = new AggregationSqlBuilder(resolver, new ExpressionCompiler(resolver), 1000);
    }
    
    @Test
    void testBuild_ZeroLimitMeansDefaultPageSize() {
        // Given
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("domain")))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .limit(0L)
                .build();
        
        // When
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        // Then
        assertEquals("SELECT (\"domain\") as \"domain\", COUNT(*) as \"impressions\" FROM \"ad_bids\" "
                + "GROUP BY 1 LIMIT 100 OFFSET 0", query.getSql());
        assertTrue(query.getArgs().isEmpty());
    }
    
    @Test
    void testBuild_NoLimitMeansUnbounded() {
        AggregationRequest request = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.of("total_bid")))
                .offset(5)
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        assertEquals("SELECT SUM(bid_price) as \"total_bid\" FROM \"ad_bids\" OFFSET 5", query.getSql());
    }
    
    @Test
    void testBuild_NullDimensionsMeansMeasuresOnly() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(null)
                .measures(List.of(AggregationMeasure.of("impressions")))
                .sort(null)
                .pivotOn(null)
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        assertEquals("SELECT COUNT(*) as \"impressions\" FROM \"ad_bids\" OFFSET 0", query.getSql());
    }
    
    @Test
    void testBuild_NullMeasuresAndNullDimensionsRejected() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(null)
                .measures(null)
                .build();
        
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> builder.build(view, request, DuckDbDialect.INSTANCE, null));
        
        assertEquals("no dimensions or measures specified", e.getMessage());
    }
    
    @Test
    void testBuild_DimensionsOnlyWithNullMeasures() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("domain")))
                .measures(null)
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        assertEquals("SELECT (\"domain\") as \"domain\" FROM \"ad_bids\" GROUP BY 1 OFFSET 0", query.getSql());
    }
    
    @Test
    void testBuild_GroupsByOrdinals() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("publisher"), AggregationDimension.of("tld")))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        assertTrue(query.getSql().contains("(regexp_extract(domain, '[^.]+$')) as \"tld\""));
        assertTrue(query.getSql().contains("GROUP BY 1, 2"));
    }
    
    @Test
    void testBuild_ArgumentsFollowPlaceholderOrder() {
        // Given
        Instant start = Instant.parse("2022-01-01T00:00:00Z");
        Instant end = Instant.parse("2022-01-03T00:00:00Z");
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.builder()
                        .name("timestamp").timeGrain(TimeGrain.DAY).timeZone("Asia/Kolkata").build()))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .timeRange(new TimeRange(start, end))
                .where(Expression.compare(Operation.EQ, "domain", "msn.com"))
                .having(Expression.compare(Operation.GT, "impressions", 1))
                .build();
        
        // When
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        // Then
        assertEquals(List.of("Asia/Kolkata", "Asia/Kolkata",
                LocalDateTime.parse("2022-01-01T00:00:00"), LocalDateTime.parse("2022-01-03T00:00:00"),
                "msn.com", 1), query.getArgs());
        assertTrue(query.getSql().contains(
                "WHERE 1=1 AND \"timestamp\" >= ? AND \"timestamp\" < ? AND \"domain\" = ?"));
        assertTrue(query.getSql().contains("GROUP BY 1 HAVING \"impressions\" > ?"));
        assertEquals(query.getArgs().size(), query.getSql().chars().filter(c -> c == '?').count());
    }
    
    @Test
    void testBuild_RowFilterIsAndedInParentheses() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("domain")))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .where(Expression.in("publisher", "Yahoo"))
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE,
                ResolvedSecurityPolicy.rowFilter("domain = 'yahoo.com' OR domain = 'msn.com'"));
        
        assertTrue(query.getSql().contains(
                "WHERE 1=1 AND \"publisher\" IN (?) AND (domain = 'yahoo.com' OR domain = 'msn.com')"));
    }
    
    @Test
    void testBuild_RowFilterAloneStillProducesWhere() {
        AggregationRequest request = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.of("impressions")))
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE,
                ResolvedSecurityPolicy.rowFilter("domain = 'yahoo.com'"));
        
        assertTrue(query.getSql().contains("WHERE 1=1 AND (domain = 'yahoo.com')"));
    }
    
    @Test
    void testBuild_LegacyFilterIsConverted() {
        MetricsViewFilter filter = MetricsViewFilter.builder()
                .include(List.of(MetricsViewFilter.Cond.builder().name("domain").in(List.of("msn.com")).build()))
                .build();
        AggregationRequest request = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.of("impressions")))
                .filter(filter)
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        assertTrue(query.getSql().contains("WHERE 1=1 AND \"domain\" IN (?)"));
        assertEquals(List.of("msn.com"), query.getArgs());
    }
    
    @Test
    void testBuild_SortAppendsNullOrderingPerDialect() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("domain")))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .sort(List.of(AggregationSort.desc("impressions"), AggregationSort.asc("domain")))
                .build();
        
        String duckDb = builder.build(view, request, DuckDbDialect.INSTANCE, null).getSql();
        String druid = builder.build(view, request, DruidDialect.INSTANCE, null).getSql();
        
        assertTrue(duckDb.contains("ORDER BY \"impressions\" DESC NULLS LAST, \"domain\" NULLS LAST"));
        assertTrue(druid.contains("ORDER BY \"impressions\" DESC, \"domain\" OFFSET"));
    }
    
    @Test
    void testBuild_BuiltinMeasures() {
        AggregationRequest request = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.count("rows"), AggregationMeasure.countDistinct("domains", "domain")))
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        assertTrue(query.getSql().startsWith(
                "SELECT COUNT(*) as \"rows\", COUNT(DISTINCT \"domain\") as \"domains\" FROM"));
    }
    
    @Test
    void testBuild_CountDistinctArgumentErrors() {
        AggregationMeasure noArgs = AggregationMeasure.builder()
                .name("d").builtinMeasure(BuiltinMeasure.COUNT_DISTINCT).build();
        AggregationMeasure emptyArg = AggregationMeasure.countDistinct("d", "");
        
        InvalidRequestException e1 = assertThrows(InvalidRequestException.class, () -> builder.build(view,
                AggregationRequest.builder().measures(List.of(noArgs)).build(), DuckDbDialect.INSTANCE, null));
        InvalidRequestException e2 = assertThrows(InvalidRequestException.class, () -> builder.build(view,
                AggregationRequest.builder().measures(List.of(emptyArg)).build(), DuckDbDialect.INSTANCE, null));
        
        assertEquals("builtin measure 'COUNT_DISTINCT' expects 1 argument", e1.getMessage());
        assertTrue(e2.getMessage().contains("expects non-empty string argument"));
    }
    
    @Test
    void testBuild_PivotUsesCellBudgetAsLimitWithoutOffset() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("domain"), AggregationDimension.of("publisher")))
                .measures(List.of(AggregationMeasure.of("impressions"), AggregationMeasure.of("total_bid")))
                .pivotOn(List.of("publisher"))
                .limit(10L)
                .build();
        
        CompiledQuery query = builder.build(view, request, DuckDbDialect.INSTANCE, null);
        
        // 1000 cells / 4 columns + 1
        assertTrue(query.getSql().endsWith("GROUP BY 1, 2 LIMIT 251"));
        assertFalse(query.getSql().contains("OFFSET"));
    }
    
    @Test
    void testBuildPivot() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("domain"), AggregationDimension.of("publisher")))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .sort(List.of(AggregationSort.asc("domain")))
                .pivotOn(List.of("publisher"))
                .limit(0L)
                .build();
        
        String sql = builder.buildPivot(request, "_for_pivot_x", DuckDbDialect.INSTANCE);
        
        assertEquals("PIVOT _for_pivot_x ON \"publisher\" USING LAST(\"impressions\") as \"impressions\" "
                + "ORDER BY \"domain\" NULLS LAST LIMIT 100 OFFSET 0", sql);
    }
    
    @Test
    void testBuild_RejectsEmptyRequest() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> builder.build(view, new AggregationRequest(), DuckDbDialect.INSTANCE, null));
        
        assertEquals("no dimensions or measures specified", e.getMessage());
    }
    
    @Test
    void testBuild_RejectsTimeRangeWithoutTimeDimension() {
        view.setTimeDimension(null);
        AggregationRequest request = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.of("impressions")))
                .timeRange(TimeRange.builder().start(Instant.EPOCH).build())
                .build();
        
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> builder.build(view, request, DuckDbDialect.INSTANCE, null));
        
        assertTrue(e.getMessage().contains("does not have a time dimension"));
    }
    
    @Test
    void testBuild_RejectsFilterTogetherWithWhere() {
        AggregationRequest request = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.of("impressions")))
                .filter(new MetricsViewFilter())
                .where(Expression.in("domain", "msn.com"))
                .build();
        
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> builder.build(view, request, DuckDbDialect.INSTANCE, null));
        
        assertEquals("both filter and where is provided", e.getMessage());
    }
    
    @Test
    void testBuild_RejectsPivotWithOffset() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("domain")))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .pivotOn(List.of("domain"))
                .offset(10)
                .build();
        
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> builder.build(view, request, DuckDbDialect.INSTANCE, null));
        
        assertEquals("offset not supported for pivot queries", e.getMessage());
    }
    
    @Test
    void testBuild_RejectsPivotOnUnrequestedDimension() {
        AggregationRequest request = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("domain")))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .pivotOn(List.of("publisher"))
                .build();
        
        assertThrows(InvalidRequestException.class,
                () -> builder.build(view, request, DuckDbDialect.INSTANCE, null));
    }
    
    @Test
    void testBuild_RejectsNegativePaging() {
        AggregationRequest negativeOffset = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.of("impressions")))
                .offset(-1)
                .build();
        AggregationRequest negativeLimit = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.of("impressions")))
                .limit(-1L)
                .build();
        
        assertThrows(InvalidRequestException.class,
                () -> builder.build(view, negativeOffset, DuckDbDialect.INSTANCE, null));
        assertThrows(InvalidRequestException.class,
                () -> builder.build(view, negativeLimit, DuckDbDialect.INSTANCE, null));
    }
    
    @Test
    void testBuild_UnknownNamesAreNotFound() {
        AggregationRequest unknownDimension = AggregationRequest.builder()
                .dimensions(List.of(AggregationDimension.of("country")))
                .build();
        AggregationRequest unknownMeasure = AggregationRequest.builder()
                .measures(List.of(AggregationMeasure.of("revenue")))
                .build();
        
        assertThrows(NotFoundException.class,
                () -> builder.build(view, unknownDimension, DuckDbDialect.INSTANCE, null));
        assertThrows(NotFoundException.class,
                () -> builder.build(view, unknownMeasure, DuckDbDialect.INSTANCE, null));
    }
    
    @Test
    void testEffectiveLimit() {
        assertEquals(100L, AggregationSqlBuilder.effectiveLimit(0L));
        assertEquals(7L, AggregationSqlBuilder.effectiveLimit(7L));
        assertNull(AggregationSqlBuilder.effectiveLimit(null));
    }
}
