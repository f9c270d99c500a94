package com.metrics.domain.service;

import com.metrics.domain.exception.MetricsQueryException;
import com.metrics.domain.exception.Phase;
import com.metrics.domain.exception.PivotCellLimitExceededException;
import com.metrics.domain.exception.QueryExecutionException;
import com.metrics.domain.model.AggregationRequest;
import com.metrics.domain.model.AggregationResult;
import com.metrics.domain.model.ColumnSchema;
import com.metrics.domain.model.CompiledQuery;
import com.metrics.infrastructure.dialect.Dialect;
import com.metrics.infrastructure.dialect.DuckDbDialect;
import com.metrics.infrastructure.dialect.Identifiers;
import com.metrics.infrastructure.olap.LocalPivotEngine;
import com.metrics.infrastructure.olap.LocalPivotEngine.BatchAppender;
import com.metrics.infrastructure.olap.QueryExecutor;
import com.metrics.infrastructure.olap.ResultSets;
import com.metrics.infrastructure.olap.TemporaryTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reshapes an aggregation into a wide table with one column per distinct
 * value of the pivot dimensions.
 *
 * Native path (backend has PIVOT), on a single leased connection:
 * 1. CREATE TEMPORARY TABLE t AS (base aggregation)
 * 2. SELECT COUNT(*) FROM t, fail if over the cell budget
 * 3. PIVOT t ON ... USING LAST(m) AS m, ...
 * 4. Drop t on every exit path
 *
 * Manual path (no PIVOT on the backend):
 * 1. Stream the base aggregation from the backend
 * 2. Load it into a fresh local DuckDB in batches, failing as soon as the
 *    row count passes the budget
 * 3. PIVOT locally, then dispose the local instance on every exit path
 *
 * The budget is checked per appended row on the manual path, so a stream
 * never overshoots it by more than one row.
 */
@Slf4j
@Service
public class PivotService {
    
    private final QueryExecutor queryExecutor;
    private final AggregationSqlBuilder sqlBuilder;
    private final LocalPivotEngine.ConnectionFactory localEngineFactory;
    private final MeterRegistry meterRegistry;
    private final int batchSize;
    
    public PivotService(
            QueryExecutor queryExecutor,
            AggregationSqlBuilder sqlBuilder,
            LocalPivotEngine.ConnectionFactory localEngineFactory,
            MeterRegistry meterRegistry,
            @Value("${metrics.engine.pivot-batch-size:10000}") int batchSize) {
        this.queryExecutor = queryExecutor;
        this.sqlBuilder = sqlBuilder;
        this.localEngineFactory = localEngineFactory;
        this.meterRegistry = meterRegistry;
        this.batchSize = batchSize;
    }
    
    public AggregationResult pivot(AggregationRequest request, CompiledQuery base, Dialect dialect,
                                   int priority, Duration timeout) {
        String path = dialect.supportsNativePivot() ? "native" : "manual";
        long startTime = System.currentTimeMillis();
        
        try {
            AggregationResult result = dialect.supportsNativePivot()
                    ? nativePivot(request, base, dialect, priority, timeout)
                    : manualPivot(request, base, priority, timeout);
            
            long queryTime = System.currentTimeMillis() - startTime;
            result.setQueryTimeMs(queryTime);
            
            Counter.builder("pivot.executed")
                    .tag("path", path)
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            
            log.info("Pivot executed ({} path): {} rows, {} columns, {} ms",
                    path, result.getData().size(), result.getSchema().size(), queryTime);
            
            return result;
            
        } catch (MetricsQueryException e) {
            Counter.builder("pivot.executed")
                    .tag("path", path)
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();
            throw e;
        }
    }
    
    private AggregationResult nativePivot(AggregationRequest request, CompiledQuery base, Dialect dialect,
                                          int priority, Duration timeout) {
        return queryExecutor.getConnector().withConnection(priority, conn -> {
            String tableName = Identifiers.tempName("_for_pivot_");
            
            try (TemporaryTable table = new TemporaryTable(conn, tableName)) {
                queryExecutor.update(conn,
                        new CompiledQuery("CREATE TEMPORARY TABLE " + table.getName() + " AS " + base.getSql(),
                                base.getArgs()),
                        timeout, Phase.BASE_QUERY);
                
                // Separate statement; DuckDB mishandles this as a multi-statement query
                long count = queryExecutor.queryForLong(conn,
                        CompiledQuery.of("SELECT COUNT(*) FROM " + table.getName()),
                        timeout, Phase.COUNT_PROBE);
                
                if (count > maxRows(request)) {
                    log.warn("Pivot input of {} rows exceeds budget of {} cells", count, sqlBuilder.getMaxPivotCells());
                    throw new PivotCellLimitExceededException(sqlBuilder.getMaxPivotCells());
                }
                
                return queryExecutor.query(conn,
                        CompiledQuery.of(sqlBuilder.buildPivot(request, table.getName(), dialect)),
                        timeout, Phase.PIVOT_QUERY);
            }
        });
    }
    
    private AggregationResult manualPivot(AggregationRequest request, CompiledQuery base,
                                          int priority, Duration timeout) {
        String tableName = Identifiers.tempName("_for_pivot_");
        
        try (LocalPivotEngine local = LocalPivotEngine.open(localEngineFactory)) {
            long loaded = queryExecutor.getConnector().withConnection(priority,
                    conn -> queryExecutor.stream(conn, base, timeout, Phase.BASE_QUERY,
                            rs -> load(local, tableName, rs, maxRows(request))));
            
            log.debug("Loaded {} rows into local pivot table {}", loaded, tableName);
            
            return queryExecutor.query(local.getConnection(),
                    CompiledQuery.of(sqlBuilder.buildPivot(request, tableName, DuckDbDialect.INSTANCE)),
                    timeout, Phase.PIVOT_QUERY);
        }
    }
    
    /**
     * Copy the remote cursor into the local table. Reading the cursor can
     * fail with a backend error; writing locally is reported as PIVOT_LOAD.
     */
    private long load(LocalPivotEngine local, String tableName, ResultSet rs, long maxRows) throws SQLException {
        List<ColumnSchema> schema = ResultSets.schema(rs.getMetaData());
        
        try {
            local.createTable(tableName, schema);
        } catch (SQLException e) {
            throw new QueryExecutionException(Phase.PIVOT_LOAD, e);
        }
        
        BatchAppender appender;
        try {
            appender = local.appender(tableName, schema, batchSize);
        } catch (SQLException e) {
            throw new QueryExecutionException(Phase.PIVOT_LOAD, e);
        }
        
        try (appender) {
            while (rs.next()) {
                List<Object> values = new ArrayList<>(schema.size());
                for (int i = 0; i < schema.size(); i++) {
                    values.add(ResultSets.normalize(rs.getObject(i + 1), schema.get(i).getType()));
                }
                try {
                    appender.append(values);
                } catch (SQLException e) {
                    throw new QueryExecutionException(Phase.PIVOT_LOAD, e);
                }
                if (appender.getAppended() > maxRows) {
                    log.warn("Pivot stream passed budget of {} cells after {} rows",
                            sqlBuilder.getMaxPivotCells(), appender.getAppended());
                    throw new PivotCellLimitExceededException(sqlBuilder.getMaxPivotCells());
                }
            }
            try {
                appender.flush();
            } catch (SQLException e) {
                throw new QueryExecutionException(Phase.PIVOT_LOAD, e);
            }
            return appender.getAppended();
        }
    }
    
    private long maxRows(AggregationRequest request) {
        return sqlBuilder.getMaxPivotCells() / request.getColumnCount();
    }
}
