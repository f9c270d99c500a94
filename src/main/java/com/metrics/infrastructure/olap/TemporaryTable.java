package com.metrics.infrastructure.olap;

import com.metrics.domain.exception.Phase;
import com.metrics.domain.exception.QueryExecutionException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Session-scoped table dropped when the scope closes, whether or not it
 * was ever created. A leaked table would stay visible to later queries on
 * the same pooled connection.
 *
 * The drop runs on the calling thread without a deadline, so it still
 * happens after the statement that used the table timed out.
 */
@Slf4j
public class TemporaryTable implements AutoCloseable {
    
    private final Connection connection;
    
    @Getter
    private final String name;
    
    public TemporaryTable(Connection connection, String name) {
        this.connection = connection;
        this.name = name;
    }
    
    @Override
    public void close() {
        try (Statement st = connection.createStatement()) {
            st.execute("DROP TABLE IF EXISTS \"" + name + "\"");
            log.debug("Dropped temporary table {}", name);
        } catch (SQLException e) {
            throw new QueryExecutionException(Phase.CLEANUP, e);
        }
    }
}
