package com.metrics.infrastructure.olap;

import com.metrics.domain.exception.ExecutionTimeoutException;
import com.metrics.domain.exception.MetricsQueryException;
import com.metrics.domain.exception.Phase;
import com.metrics.domain.exception.QueryExecutionException;
import com.metrics.domain.model.AggregationResult;
import com.metrics.domain.model.CompiledQuery;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs compiled statements against a backend connection under a deadline.
 *
 * Execution Flow:
 * 1. Lease a connection through the priority gate (execute only)
 * 2. Prepare and bind the statement on the calling thread
 * 3. Run it on a worker and wait up to the timeout
 * 4. On timeout, cancel the statement and wait briefly for the worker to
 *    let go of the connection before it is reused
 *
 * Failures leave as {@link ExecutionTimeoutException} or
 * {@link QueryExecutionException} tagged with the phase, never as raw
 * driver exceptions.
 */
@Slf4j
public class QueryExecutor {
    
    private static final long CANCEL_GRACE_MILLIS = 5_000;
    
    private final OlapConnector connector;
    private final ExecutorService workers;
    private final Duration defaultTimeout;
    
    public QueryExecutor(OlapConnector connector, ExecutorService workers, Duration defaultTimeout) {
        this.connector = connector;
        this.workers = workers;
        this.defaultTimeout = defaultTimeout;
    }
    
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }
    
    public OlapConnector getConnector() {
        return connector;
    }
    
    /**
     * Execute a query on a freshly leased connection and return all rows.
     */
    public AggregationResult execute(CompiledQuery query, int priority, Duration timeout) {
        long startTime = System.currentTimeMillis();
        
        AggregationResult result = connector.withConnection(priority,
                conn -> query(conn, query, timeout, Phase.BASE_QUERY));
        
        long queryTime = System.currentTimeMillis() - startTime;
        result.setQueryTimeMs(queryTime);
        log.info("Query executed: {} rows, {} ms (priority {})", result.getData().size(), queryTime, priority);
        return result;
    }
    
    public AggregationResult query(Connection conn, CompiledQuery query, Duration timeout, Phase phase) {
        return run(conn, query, timeout, phase, ps -> {
            try (ResultSet rs = ps.executeQuery()) {
                return ResultSets.read(rs);
            }
        });
    }
    
    public long queryForLong(Connection conn, CompiledQuery query, Duration timeout, Phase phase) {
        return run(conn, query, timeout, phase, ps -> {
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }
    
    public void update(Connection conn, CompiledQuery query, Duration timeout, Phase phase) {
        run(conn, query, timeout, phase, ps -> {
            ps.execute();
            return null;
        });
    }
    
    /**
     * Execute a query and hand the open cursor to the handler, which runs
     * under the same deadline as the query itself.
     */
    public <T> T stream(Connection conn, CompiledQuery query, Duration timeout, Phase phase,
                        ResultSetHandler<T> handler) {
        return run(conn, query, timeout, phase, ps -> {
            try (ResultSet rs = ps.executeQuery()) {
                return handler.handle(rs);
            }
        });
    }
    
    private <T> T run(Connection conn, CompiledQuery query, Duration timeout, Phase phase,
                      StatementWork<T> work) {
        Duration deadline = timeout != null ? timeout : defaultTimeout;
        
        PreparedStatement ps;
        try {
            ps = conn.prepareStatement(query.getSql());
            bind(ps, query.getArgs());
        } catch (SQLException e) {
            throw new QueryExecutionException(phase, e);
        }
        
        try {
            Future<T> future = workers.submit(() -> work.apply(ps));
            try {
                return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("{} exceeded {} ms, cancelling", phase, deadline.toMillis());
                cancel(ps, future);
                throw new ExecutionTimeoutException(phase, deadline, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel(ps, future);
                throw new QueryExecutionException(phase, e);
            } catch (ExecutionException e) {
                throw classify(phase, deadline, e.getCause());
            }
        } finally {
            try {
                ps.close();
            } catch (SQLException e) {
                log.warn("Error closing statement after {}: {}", phase, e.getMessage());
            }
        }
    }
    
    private static void bind(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            ps.setObject(i + 1, args.get(i));
        }
    }
    
    private static MetricsQueryException classify(Phase phase, Duration deadline, Throwable cause) {
        if (cause instanceof MetricsQueryException) {
            return (MetricsQueryException) cause;
        }
        if (cause instanceof SQLTimeoutException) {
            return new ExecutionTimeoutException(phase, deadline, cause);
        }
        return new QueryExecutionException(phase, cause);
    }
    
    private void cancel(PreparedStatement ps, Future<?> future) {
        try {
            ps.cancel();
        } catch (SQLException e) {
            log.warn("Statement cancel failed: {}", e.getMessage());
        }
        try {
            future.get(CANCEL_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | CancellationException e) {
            log.debug("Cancelled statement finished with: {}", String.valueOf(e.getCause()));
        } catch (TimeoutException e) {
            log.warn("Cancelled statement still running after {} ms, interrupting worker", CANCEL_GRACE_MILLIS);
            future.cancel(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
        }
    }
    
    @FunctionalInterface
    public interface ResultSetHandler<T> {
        
        T handle(ResultSet rs) throws SQLException;
    }
    
    @FunctionalInterface
    private interface StatementWork<T> {
        
        T apply(PreparedStatement ps) throws SQLException;
    }
}
