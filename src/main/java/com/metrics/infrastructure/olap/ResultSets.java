package com.metrics.infrastructure.olap;

import com.metrics.domain.model.AggregationResult;
import com.metrics.domain.model.ColumnSchema;
import com.metrics.domain.model.ColumnType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates JDBC results into the portable schema and value taxonomy.
 *
 * Timestamps without a zone are read as UTC wall-clock values.
 */
public final class ResultSets {
    
    private ResultSets() {
    }
    
    public static AggregationResult read(ResultSet rs) throws SQLException {
        List<ColumnSchema> schema = schema(rs.getMetaData());
        List<Map<String, Object>> data = new ArrayList<>();
        while (rs.next()) {
            data.add(row(rs, schema));
        }
        return AggregationResult.builder()
                .schema(schema)
                .data(data)
                .build();
    }
    
    public static List<ColumnSchema> schema(ResultSetMetaData meta) throws SQLException {
        List<ColumnSchema> schema = new ArrayList<>(meta.getColumnCount());
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            schema.add(ColumnSchema.builder()
                    .name(meta.getColumnLabel(i))
                    .type(columnType(meta.getColumnType(i), meta.getColumnTypeName(i)))
                    .nullable(meta.isNullable(i) != ResultSetMetaData.columnNoNulls)
                    .build());
        }
        return schema;
    }
    
    public static Map<String, Object> row(ResultSet rs, List<ColumnSchema> schema) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < schema.size(); i++) {
            ColumnSchema col = schema.get(i);
            row.put(col.getName(), normalize(rs.getObject(i + 1), col.getType()));
        }
        return row;
    }
    
    /**
     * Map a JDBC type to the portable taxonomy, falling back to the backend's
     * type name for vendor types (HUGEINT, TIMESTAMP WITH TIME ZONE, ...).
     */
    public static ColumnType columnType(int jdbcType, String typeName) {
        switch (jdbcType) {
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
                return ColumnType.STRING;
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return ColumnType.INTEGER;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
            case Types.DECIMAL:
            case Types.NUMERIC:
                return ColumnType.FLOAT;
            case Types.BIT:
            case Types.BOOLEAN:
                return ColumnType.BOOLEAN;
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return ColumnType.TIMESTAMP;
            case Types.DATE:
                return ColumnType.DATE;
            default:
                return columnTypeFromName(typeName);
        }
    }
    
    static ColumnType columnTypeFromName(String typeName) {
        if (typeName == null) {
            return ColumnType.UNKNOWN;
        }
        String name = typeName.toUpperCase(Locale.ROOT);
        if (name.startsWith("TIMESTAMP")) {
            return ColumnType.TIMESTAMP;
        }
        if (name.equals("DATE")) {
            return ColumnType.DATE;
        }
        if (name.contains("INT")) {
            return ColumnType.INTEGER;
        }
        if (name.startsWith("DECIMAL") || name.equals("DOUBLE") || name.equals("FLOAT") || name.equals("REAL")) {
            return ColumnType.FLOAT;
        }
        if (name.startsWith("BOOL")) {
            return ColumnType.BOOLEAN;
        }
        if (name.equals("VARCHAR") || name.equals("STRING")) {
            return ColumnType.STRING;
        }
        return ColumnType.UNKNOWN;
    }
    
    /**
     * Re-apply the schema's value types to rows that went through a generic
     * encoding such as the JSON result cache, where timestamps come back as
     * strings and small integers as {@code Integer}.
     */
    public static AggregationResult normalize(AggregationResult result) {
        List<Map<String, Object>> data = new ArrayList<>(result.getData().size());
        for (Map<String, Object> row : result.getData()) {
            Map<String, Object> typed = new LinkedHashMap<>(row);
            for (ColumnSchema col : result.getSchema()) {
                if (typed.containsKey(col.getName())) {
                    typed.put(col.getName(), normalize(typed.get(col.getName()), col.getType()));
                }
            }
            data.add(typed);
        }
        result.setData(data);
        return result;
    }
    
    public static Object normalize(Object value, ColumnType type) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return toLong(value);
            case FLOAT:
                return value instanceof Number ? ((Number) value).doubleValue() : value;
            case TIMESTAMP:
                return toInstant(value);
            case DATE:
                return toLocalDate(value);
            case STRING:
            case UNKNOWN:
                return value instanceof String ? value : value.toString();
            default:
                return value;
        }
    }
    
    private static Object toLong(Object value) {
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).longValue();
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return value;
    }
    
    private static Object toInstant(Object value) {
        if (value instanceof Instant) {
            return value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof String) {
            return OffsetDateTime.parse((String) value).toInstant();
        }
        return value;
    }
    
    private static Object toLocalDate(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof String) {
            return LocalDate.parse((String) value);
        }
        return value;
    }
}
