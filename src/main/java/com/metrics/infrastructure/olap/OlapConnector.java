package com.metrics.infrastructure.olap;

import com.metrics.domain.exception.Phase;
import com.metrics.domain.exception.QueryExecutionException;
import com.metrics.infrastructure.dialect.Dialect;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Leases backend connections under the priority gate. A request holds at
 * most one lease at a time; the lease is returned when the callback exits.
 */
@Slf4j
@RequiredArgsConstructor
public class OlapConnector {
    
    private final DataSource dataSource;
    
    @Getter
    private final Dialect dialect;
    
    private final PriorityConnectionGate gate;
    
    public <T> T withConnection(int priority, ConnectionCallback<T> callback) {
        try {
            gate.acquire(priority);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException(Phase.CONNECTION, "interrupted while waiting for a connection");
        }
        
        try (Connection conn = dataSource.getConnection()) {
            return callback.doInConnection(conn);
        } catch (SQLException e) {
            log.error("Connection failure on {} backend: {}", dialect.name(), e.getMessage(), e);
            throw new QueryExecutionException(Phase.CONNECTION, e);
        } finally {
            gate.release();
        }
    }
    
    @FunctionalInterface
    public interface ConnectionCallback<T> {
        
        T doInConnection(Connection conn) throws SQLException;
    }
}
