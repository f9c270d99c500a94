package com.metrics.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metrics.AdBidsTestData;
import com.metrics.domain.exception.InvalidRequestException;
import com.metrics.domain.exception.NotFoundException;
import com.metrics.domain.model.AggregationDimension;
import com.metrics.domain.model.AggregationMeasure;
import com.metrics.domain.model.AggregationRequest;
import com.metrics.domain.model.AggregationResult;
import com.metrics.domain.model.ColumnSchema;
import com.metrics.domain.model.ColumnType;
import com.metrics.domain.model.CompiledQuery;
import com.metrics.infrastructure.cache.QueryCacheService;
import com.metrics.infrastructure.dialect.DuckDbDialect;
import com.metrics.infrastructure.olap.QueryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AggregationService.
 * 
 * Tests caching behavior and routing between plain and pivot execution.
 */
@ExtendWith(MockitoExtension.class)
class AggregationServiceTest {
    
    private static final CompiledQuery BASE = CompiledQuery.of("SELECT 1");
    
    @Mock
    private AggregationSqlBuilder sqlBuilder;
    
    @Mock
    private QueryExecutor queryExecutor;
    
    @Mock
    private PivotService pivotService;
    
    @Mock
    private QueryCacheService cacheService;
    
    private MeterRegistry meterRegistry;
    private AggregationService aggregationService;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        MetricsViewCatalog catalog = new MetricsViewCatalog(Map.of("ad_bids", AdBidsTestData.view()));
        aggregationService = new AggregationService(catalog, sqlBuilder, queryExecutor, pivotService,
                cacheService, DuckDbDialect.INSTANCE, meterRegistry);
    }
    
    @Test
    void testResolve_CacheHit() {
        // Given
        AggregationRequest request = request();
        AggregationResult cachedResult = AggregationResult.builder().build();
        
        when(cacheService.generateCacheKey(eq("MetricsViewAggregation"), any())).thenReturn("key");
        when(cacheService.get("key", AggregationResult.class)).thenReturn(Optional.of(cachedResult));
        
        // When
        AggregationResult result = aggregationService.resolve(request);
        
        // Then
        assertTrue(result.isCached());
        
        // Verify nothing was compiled or executed (cache hit)
        verify(sqlBuilder, never()).build(any(), any(), any(), any());
        verify(queryExecutor, never()).execute(any(), anyInt(), any());
        assertEquals(1.0, meterRegistry.counter("query.cache", "result", "hit").count());
    }
    
    @Test
    void testResolve_CacheHitRestoresColumnTypes() throws Exception {
        // Given a result that went through the JSON cache encoding
        ObjectMapper mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ts", Instant.parse("2022-01-01T00:00:00Z"));
        row.put("day", LocalDate.parse("2022-01-01"));
        row.put("n", 5L);
        row.put("total", 2.0);
        AggregationResult stored = AggregationResult.builder()
                .schema(List.of(
                        ColumnSchema.builder().name("ts").type(ColumnType.TIMESTAMP).nullable(true).build(),
                        ColumnSchema.builder().name("day").type(ColumnType.DATE).nullable(true).build(),
                        ColumnSchema.builder().name("n").type(ColumnType.INTEGER).nullable(true).build(),
                        ColumnSchema.builder().name("total").type(ColumnType.FLOAT).nullable(true).build()))
                .data(List.of(row))
                .build();
        AggregationResult fromCache = mapper.readValue(mapper.writeValueAsString(stored), AggregationResult.class);
        
        when(cacheService.generateCacheKey(eq("MetricsViewAggregation"), any())).thenReturn("key");
        when(cacheService.get("key", AggregationResult.class)).thenReturn(Optional.of(fromCache));
        
        // When
        AggregationResult result = aggregationService.resolve(request());
        
        // Then
        Map<String, Object> restored = result.getData().get(0);
        assertEquals(Instant.parse("2022-01-01T00:00:00Z"), restored.get("ts"));
        assertEquals(LocalDate.parse("2022-01-01"), restored.get("day"));
        assertEquals(5L, restored.get("n"));
        assertEquals(2.0, restored.get("total"));
        assertEquals(row, restored);
    }
    
    @Test
    void testResolve_CacheMiss() {
        // Given
        AggregationRequest request = request();
        AggregationResult executed = AggregationResult.builder()
                .data(List.of(Map.of("domain", "msn.com", "impressions", 2L)))
                .build();
        
        when(cacheService.generateCacheKey(eq("MetricsViewAggregation"), any())).thenReturn("key");
        when(cacheService.get("key", AggregationResult.class)).thenReturn(Optional.empty());
        when(sqlBuilder.build(any(), eq(request), eq(DuckDbDialect.INSTANCE), isNull())).thenReturn(BASE);
        when(queryExecutor.getDefaultTimeout()).thenReturn(Duration.ofMinutes(2));
        when(queryExecutor.execute(BASE, 3, Duration.ofMinutes(2))).thenReturn(executed);
        
        // When
        AggregationResult result = aggregationService.resolve(request);
        
        // Then
        assertFalse(result.isCached());
        assertEquals(1, result.getData().size());
        
        // Verify result was cached
        verify(cacheService).set("key", executed, 300L);
        verify(pivotService, never()).pivot(any(), any(), any(), anyInt(), any());
        assertEquals(1.0, meterRegistry.counter("query.executed", "type", "aggregation", "result", "success").count());
    }
    
    @Test
    void testResolve_PivotGoesThroughPivotService() {
        // Given
        AggregationRequest request = request().toBuilder().pivotOn(List.of("domain")).build();
        AggregationResult pivoted = AggregationResult.builder().build();
        
        when(cacheService.generateCacheKey(anyString(), any())).thenReturn("key");
        when(cacheService.get("key", AggregationResult.class)).thenReturn(Optional.empty());
        when(sqlBuilder.build(any(), eq(request), any(), any())).thenReturn(BASE);
        when(queryExecutor.getDefaultTimeout()).thenReturn(Duration.ofMinutes(2));
        when(pivotService.pivot(request, BASE, DuckDbDialect.INSTANCE, 3, Duration.ofMinutes(2))).thenReturn(pivoted);
        
        // When
        AggregationResult result = aggregationService.resolve(request);
        
        // Then
        assertSame(pivoted, result);
        verify(queryExecutor, never()).execute(any(), anyInt(), any());
    }
    
    @Test
    void testResolve_InvalidRequestNeverReachesBackend() {
        // Given
        AggregationRequest request = request();
        
        when(cacheService.generateCacheKey(anyString(), any())).thenReturn("key");
        when(cacheService.get("key", AggregationResult.class)).thenReturn(Optional.empty());
        when(sqlBuilder.build(any(), any(), any(), any()))
                .thenThrow(new InvalidRequestException("both filter and where is provided"));
        
        // When / Then
        assertThrows(InvalidRequestException.class, () -> aggregationService.resolve(request));
        
        verify(queryExecutor, never()).execute(any(), anyInt(), any());
        verify(cacheService, never()).set(anyString(), any(), anyLong());
        assertEquals(1.0, meterRegistry.counter("query.executed", "type", "aggregation", "result", "error").count());
    }
    
    @Test
    void testResolve_UnknownView() {
        AggregationRequest request = request().toBuilder().metricsView("missing").build();
        
        assertThrows(NotFoundException.class, () -> aggregationService.resolve(request));
        
        verifyNoInteractions(cacheService, sqlBuilder, queryExecutor, pivotService);
    }
    
    private AggregationRequest request() {
        return AggregationRequest.builder()
                .metricsView("ad_bids")
                .dimensions(List.of(AggregationDimension.of("domain")))
                .measures(List.of(AggregationMeasure.of("impressions")))
                .priority(3)
                .build();
    }
}
