package com.metrics.infrastructure.config;

import com.metrics.infrastructure.dialect.Dialect;
import com.metrics.infrastructure.dialect.Dialects;
import com.metrics.infrastructure.olap.LocalPivotEngine;
import com.metrics.infrastructure.olap.OlapConnector;
import com.metrics.infrastructure.olap.PriorityConnectionGate;
import com.metrics.infrastructure.olap.QueryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import javax.sql.DataSource;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the backend connection, dialect and execution engine.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {
    
    // Fails start-up on an unknown dialect rather than emitting wrong SQL later
    @Bean
    public Dialect dialect(EngineProperties properties) {
        Dialect dialect = Dialects.forName(properties.getDialect());
        log.info("Metrics engine using {} dialect (native pivot: {})",
                dialect.name(), dialect.supportsNativePivot());
        return dialect;
    }
    
    @Bean
    public PriorityConnectionGate priorityConnectionGate(EngineProperties properties) {
        return new PriorityConnectionGate(properties.getMaxConcurrentQueries());
    }
    
    @Bean
    public OlapConnector olapConnector(DataSource dataSource, Dialect dialect, PriorityConnectionGate gate) {
        return new OlapConnector(dataSource, dialect, gate);
    }
    
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService olapQueryWorkers() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("olap-query-"));
    }
    
    @Bean
    public QueryExecutor queryExecutor(OlapConnector connector, ExecutorService olapQueryWorkers,
                                       EngineProperties properties) {
        return new QueryExecutor(connector, olapQueryWorkers, properties.getExecutionTimeout());
    }
    
    @Bean
    public LocalPivotEngine.ConnectionFactory localPivotEngineFactory() {
        return LocalPivotEngine.inMemoryDuckDb();
    }
}
