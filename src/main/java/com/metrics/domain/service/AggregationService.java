package com.metrics.domain.service;

import com.metrics.domain.exception.MetricsQueryException;
import com.metrics.domain.model.AggregationRequest;
import com.metrics.domain.model.AggregationResult;
import com.metrics.domain.model.CompiledQuery;
import com.metrics.domain.model.MetricsViewSpec;
import com.metrics.infrastructure.cache.QueryCacheService;
import com.metrics.infrastructure.dialect.Dialect;
import com.metrics.infrastructure.olap.QueryExecutor;
import com.metrics.infrastructure.olap.ResultSets;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for aggregation queries.
 *
 * Query Flow:
 * 1. Look up the metrics view
 * 2. Check cache (Redis), keyed by the full request
 * 3. Compile the request to SQL (validation errors stop here)
 * 4. Execute, or pivot when a pivot axis is requested
 * 5. Store result in cache
 * 6. Return result
 *
 * Failures reach the caller as one of the engine's exception kinds; there
 * is no retry here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {
    
    private static final String CACHE_PREFIX = "MetricsViewAggregation";
    
    private final MetricsViewCatalog catalog;
    private final AggregationSqlBuilder sqlBuilder;
    private final QueryExecutor queryExecutor;
    private final PivotService pivotService;
    private final QueryCacheService cacheService;
    private final Dialect dialect;
    private final MeterRegistry meterRegistry;
    
    @Value("${metrics.engine.cache.enabled:true}")
    private boolean cacheEnabled = true;
    
    @Value("${metrics.engine.cache.ttl-seconds:300}")
    private long cacheTtlSeconds = 300;
    
    public AggregationResult resolve(AggregationRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String type = request.isPivot() ? "pivot" : "aggregation";
        
        try {
            MetricsViewSpec view = catalog.get(request.getMetricsView());
            
            String cacheKey = null;
            if (cacheEnabled) {
                cacheKey = cacheService.generateCacheKey(CACHE_PREFIX, request);
                
                Optional<AggregationResult> cached = cacheService.get(cacheKey, AggregationResult.class);
                if (cached.isPresent()) {
                    log.debug("Cache hit for aggregation on {}", request.getMetricsView());
                    
                    Counter.builder("query.cache")
                            .tag("result", "hit")
                            .register(meterRegistry)
                            .increment();
                    
                    AggregationResult result = ResultSets.normalize(cached.get());
                    result.setCached(true);
                    return result;
                }
                
                log.debug("Cache miss for aggregation on {}", request.getMetricsView());
                
                Counter.builder("query.cache")
                        .tag("result", "miss")
                        .register(meterRegistry)
                        .increment();
            }
            
            CompiledQuery query = sqlBuilder.build(view, request, dialect, request.getSecurity());
            
            AggregationResult result = request.isPivot()
                    ? pivotService.pivot(request, query, dialect, request.getPriority(), queryExecutor.getDefaultTimeout())
                    : queryExecutor.execute(query, request.getPriority(), queryExecutor.getDefaultTimeout());
            
            if (cacheKey != null) {
                cacheService.set(cacheKey, result, cacheTtlSeconds);
            }
            
            sample.stop(Timer.builder("query.latency")
                    .tag("type", type)
                    .tag("cached", "false")
                    .register(meterRegistry));
            
            Counter.builder("query.executed")
                    .tag("type", type)
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            
            return result;
            
        } catch (MetricsQueryException e) {
            log.error("Error executing aggregation on {}: {}", request.getMetricsView(), e.getMessage(), e);
            
            Counter.builder("query.executed")
                    .tag("type", type)
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();
            
            throw e;
        }
    }
}
