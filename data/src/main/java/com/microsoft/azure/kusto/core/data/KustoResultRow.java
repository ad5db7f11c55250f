// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single result row. Values are decoded once, when the row is built: {@code datetime} columns become {@link Instant}s,
 * {@code timespan} columns become {@link Duration}s and every other column keeps the value decoded from the JSON payload.
 */
public class KustoResultRow {
    private static final ObjectMapper objectMapper = Utils.getObjectMapper();

    private final List<KustoResultColumn> columns;
    private final List<Object> raw;
    private final Map<String, Object> values = new LinkedHashMap<>();

    public KustoResultRow(List<KustoResultColumn> columns, List<Object> raw) {
        Ensure.argIsNotNull(columns, "columns");
        Ensure.argIsNotNull(raw, "raw");

        List<KustoResultColumn> sorted = new ArrayList<>(columns);
        sorted.sort(Comparator.comparingInt(KustoResultColumn::getOrdinal));
        this.columns = Collections.unmodifiableList(sorted);
        this.raw = Collections.unmodifiableList(raw);

        for (KustoResultColumn column : this.columns) {
            Object value = column.getOrdinal() < raw.size() ? raw.get(column.getOrdinal()) : null;
            values.put(column.getColumnName(), convert(column.getColumnType(), value));
        }
    }

    private static Object convert(String columnType, Object value) {
        if (!(value instanceof String) || columnType == null) {
            return value;
        }

        switch (columnType) {
            case "datetime":
            case "DateTime":
                return TimeUtils.parseDateTime((String) value);
            case "timespan":
            case "TimeSpan":
                return TimeUtils.parseTimespan((String) value);
            default:
                return value;
        }
    }

    public List<KustoResultColumn> getColumns() {
        return columns;
    }

    public List<Object> getRaw() {
        return raw;
    }

    public boolean hasColumn(String columnName) {
        return values.containsKey(columnName);
    }

    public Object getObject(String columnName) {
        if (!values.containsKey(columnName)) {
            throw new IllegalArgumentException(String.format("Column '%s' does not exist in the row, columns are %s", columnName, values.keySet()));
        }
        return values.get(columnName);
    }

    public Object getValueAt(int index) {
        if (index < 0 || index >= columns.size()) {
            throw new IndexOutOfBoundsException(String.format("Column index %d is out of range, row has %d columns", index, columns.size()));
        }
        return values.get(columns.get(index).getColumnName());
    }

    public String getString(String columnName) {
        Object value = getObject(columnName);
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode) {
            JsonNode node = (JsonNode) value;
            return node.isTextual() ? node.asText() : node.toString();
        }
        return value.toString();
    }

    public Instant getInstant(String columnName) {
        Object value = getObject(columnName);
        if (value == null || value instanceof Instant) {
            return (Instant) value;
        }
        return TimeUtils.parseDateTime(value.toString());
    }

    public Duration getDuration(String columnName) {
        Object value = getObject(columnName);
        if (value == null || value instanceof Duration) {
            return (Duration) value;
        }
        return TimeUtils.parseTimespan(value.toString());
    }

    public Long getLong(String columnName) {
        Object value = getObject(columnName);
        if (value == null) {
            return null;
        }
        return value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString());
    }

    public Integer getInt(String columnName) {
        Object value = getObject(columnName);
        if (value == null) {
            return null;
        }
        return value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(value.toString());
    }

    public Boolean getBoolean(String columnName) {
        Object value = getObject(columnName);
        if (value == null) {
            return null;
        }
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(value.toString());
    }

    /**
     * Column name to value map, in ordinal order.
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public ObjectNode toJson() {
        ObjectNode node = objectMapper.createObjectNode();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof JsonNode) {
                node.set(entry.getKey(), (JsonNode) value);
            } else if (value instanceof Instant || value instanceof Duration) {
                node.put(entry.getKey(), value.toString());
            } else {
                node.set(entry.getKey(), objectMapper.valueToTree(value));
            }
        }
        return node;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
