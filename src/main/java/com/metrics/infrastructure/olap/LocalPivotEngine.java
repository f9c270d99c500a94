package com.metrics.infrastructure.olap;

import com.metrics.domain.exception.Phase;
import com.metrics.domain.exception.QueryExecutionException;
import com.metrics.domain.model.ColumnSchema;
import com.metrics.domain.model.ColumnType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Private embedded DuckDB instance used to pivot results of backends
 * without a PIVOT operator.
 * 
 * Created per pivot operation and never shared. Closing it drops the
 * loaded table and disposes the whole instance.
 */
@Slf4j
public class LocalPivotEngine implements AutoCloseable {
    
    @Getter
    private final Connection connection;
    
    private final List<String> tables = new ArrayList<>();
    
    private LocalPivotEngine(Connection connection) {
        this.connection = connection;
    }
    
    public static LocalPivotEngine open(ConnectionFactory factory) {
        try {
            return new LocalPivotEngine(factory.open());
        } catch (SQLException e) {
            throw new QueryExecutionException(Phase.PIVOT_LOAD, e);
        }
    }
    
    /**
     * In-memory DuckDB; each call opens a separate database.
     */
    public static ConnectionFactory inMemoryDuckDb() {
        return () -> DriverManager.getConnection("jdbc:duckdb:");
    }
    
    public void createTable(String name, List<ColumnSchema> schema) throws SQLException {
        List<String> columns = new ArrayList<>();
        for (ColumnSchema col : schema) {
            columns.add(quote(col.getName()) + " " + sqlType(col.getType()));
        }
        try (Statement st = connection.createStatement()) {
            st.execute("CREATE TABLE " + quote(name) + " (" + String.join(", ", columns) + ")");
        }
        tables.add(name);
    }
    
    public BatchAppender appender(String table, List<ColumnSchema> schema, int batchSize) throws SQLException {
        String placeholders = String.join(", ", Collections.nCopies(schema.size(), "?"));
        PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO " + quote(table) + " VALUES (" + placeholders + ")");
        return new BatchAppender(ps, schema, batchSize);
    }
    
    @Override
    public void close() {
        SQLException failure = null;
        for (String table : tables) {
            try (Statement st = connection.createStatement()) {
                st.execute("DROP TABLE IF EXISTS " + quote(table));
            } catch (SQLException e) {
                failure = e;
            }
        }
        try {
            connection.close();
        } catch (SQLException e) {
            if (failure != null) {
                e.addSuppressed(failure);
            }
            failure = e;
        }
        if (failure != null) {
            throw new QueryExecutionException(Phase.CLEANUP, failure);
        }
        log.debug("Local pivot engine disposed");
    }
    
    static String sqlType(ColumnType type) {
        switch (type) {
            case INTEGER:
                return "BIGINT";
            case FLOAT:
                return "DOUBLE";
            case BOOLEAN:
                return "BOOLEAN";
            case TIMESTAMP:
                return "TIMESTAMP";
            case DATE:
                return "DATE";
            default:
                return "VARCHAR";
        }
    }
    
    private static String quote(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
    
    /**
     * Appends rows in JDBC batches, flushing every {@code batchSize} rows.
     */
    public static class BatchAppender implements AutoCloseable {
        
        private static final DateTimeFormatter TIMESTAMP_TEXT =
                DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
        
        private final PreparedStatement ps;
        private final List<ColumnSchema> schema;
        private final int batchSize;
        private int pending;
        
        @Getter
        private long appended;
        
        BatchAppender(PreparedStatement ps, List<ColumnSchema> schema, int batchSize) {
            this.ps = ps;
            this.schema = schema;
            this.batchSize = batchSize;
        }
        
        public void append(List<Object> values) throws SQLException {
            for (int i = 0; i < schema.size(); i++) {
                ps.setObject(i + 1, toJdbcValue(values.get(i)));
            }
            ps.addBatch();
            pending++;
            appended++;
            if (pending >= batchSize) {
                flush();
            }
        }
        
        public void flush() throws SQLException {
            if (pending > 0) {
                ps.executeBatch();
                pending = 0;
            }
        }
        
        @Override
        public void close() throws SQLException {
            ps.close();
        }
        
        // Temporal values travel as ISO text and are cast by the column type
        private static Object toJdbcValue(Object value) {
            if (value instanceof Instant) {
                return TIMESTAMP_TEXT.format(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
            }
            if (value instanceof LocalDate) {
                return value.toString();
            }
            return value;
        }
    }
    
    @FunctionalInterface
    public interface ConnectionFactory {
        
        Connection open() throws SQLException;
    }
}
