package com.pumainbox.api.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;
import org.springframework.jdbc.core.ColumnMapRowMapper;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * Maps a row to a column-name keyed map whose values serialize as the stored data:
 * {@code json}/{@code jsonb} become Jackson trees, other driver objects (enums, intervals,
 * inet, money) become their text form, SQL arrays become Java arrays, and date/time columns
 * are read as {@code java.time} values so no JVM time zone is applied.
 */
public class JsonColumnRowMapper extends ColumnMapRowMapper {

    private final ObjectMapper objectMapper;

    public JsonColumnRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    protected Object getColumnValue(ResultSet rs, int index) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnType = metaData.getColumnType(index);

        // the driver reports timestamptz as TIMESTAMP, so the type name decides
        if (columnType == Types.TIMESTAMP_WITH_TIMEZONE || "timestamptz".equals(metaData.getColumnTypeName(index))) {
            return rs.getObject(index, OffsetDateTime.class);
        }
        if (columnType == Types.TIMESTAMP) {
            return rs.getObject(index, LocalDateTime.class);
        }
        if (columnType == Types.DATE) {
            return rs.getObject(index, LocalDate.class);
        }

        Object value = super.getColumnValue(rs, index);

        if (value instanceof PGobject) {
            PGobject pgObject = (PGobject) value;
            return isJsonType(pgObject.getType()) ? readJson(pgObject.getValue()) : pgObject.getValue();
        }
        if (value instanceof Array) {
            Array array = (Array) value;
            try {
                return array.getArray();
            } finally {
                array.free();
            }
        }
        return value;
    }

    private Object readJson(String json) throws SQLException {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable json column value", e);
        }
    }

    private static boolean isJsonType(String type) {
        return "json".equals(type) || "jsonb".equals(type);
    }
}
