package com.metrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Metrics Aggregation Engine
 * 
 * Compiles declarative aggregations over metrics views into backend SQL,
 * runs them, and optionally pivots the result.
 * 
 * Architecture:
 * - REST APIs for aggregation and export
 * - Dialect adapters for DuckDB and Druid
 * - Priority-aware connection leasing with execution timeouts
 * - Native or locally materialised PIVOT under a cell budget
 * - Redis caching of results keyed by the full request
 */
@SpringBootApplication
public class MetricsEngineApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(MetricsEngineApplication.class, args);
    }
}
