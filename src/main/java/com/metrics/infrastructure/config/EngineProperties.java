package com.metrics.infrastructure.config;

import com.metrics.domain.model.MetricsViewSpec;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine configuration bound from {@code metrics.engine.*}.
 */
@Data
@ConfigurationProperties(prefix = "metrics.engine")
public class EngineProperties {
    
    /**
     * Backend dialect: duckdb or druid.
     */
    private String dialect = "duckdb";
    
    /**
     * Upper bound on rows x columns materialised by a pivot.
     */
    private int maxPivotCells = 1_000_000;
    
    private Duration executionTimeout = Duration.ofMinutes(2);
    
    /**
     * Concurrent backend connection leases handed out by priority.
     */
    private int maxConcurrentQueries = 8;
    
    private int pivotBatchSize = 10_000;
    
    private Cache cache = new Cache();
    
    private Map<String, MetricsViewSpec> views = new LinkedHashMap<>();
    
    @Data
    public static class Cache {
        
        private boolean enabled = true;
        private long ttlSeconds = 300;
    }
}
