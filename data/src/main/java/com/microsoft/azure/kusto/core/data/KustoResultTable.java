// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.microsoft.azure.kusto.core.data.exceptions.KustoParseException;
import com.microsoft.azure.kusto.core.data.exceptions.KustoServiceQueryError;

// The table keeps the decoded positional rows; row objects are built on demand so every iteration starts fresh
public class KustoResultTable {
    static final String TABLE_NAME_PROPERTY_NAME = "TableName";
    static final String TABLE_ID_PROPERTY_NAME = "TableId";
    static final String TABLE_KIND_PROPERTY_NAME = "TableKind";
    static final String COLUMNS_PROPERTY_NAME = "Columns";
    static final String COLUMN_NAME_PROPERTY_NAME = "ColumnName";
    static final String COLUMN_TYPE_PROPERTY_NAME = "ColumnType";
    static final String COLUMN_TYPE_SECOND_PROPERTY_NAME = "DataType";
    static final String ROWS_PROPERTY_NAME = "Rows";
    static final String EXCEPTIONS_PROPERTY_NAME = "Exceptions";
    static final String ONE_API_ERRORS_PROPERTY_NAME = "OneApiErrors";

    private static final String EMPTY_STRING = "";
    private static final ObjectMapper objectMapper = Utils.getObjectMapper();

    private String name;
    private Integer id;
    private WellKnownDataSet kind;
    private final String kindName;
    private final List<KustoResultColumn> columns;
    private final List<List<Object>> rows;

    public KustoResultTable(String name, @Nullable Integer id, @Nullable String kindName, List<KustoResultColumn> columns, List<List<Object>> rows) {
        this.name = name;
        this.id = id;
        this.kindName = kindName;
        this.kind = WellKnownDataSet.fromKindName(kindName);
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static KustoResultTable fromJson(JsonNode jsonTable) {
        if (jsonTable == null || !jsonTable.isObject()) {
            throw new KustoParseException("Table payload must be a JSON object");
        }

        String tableName = jsonTable.has(TABLE_NAME_PROPERTY_NAME) ? jsonTable.get(TABLE_NAME_PROPERTY_NAME).asText() : EMPTY_STRING;
        Integer tableId = jsonTable.hasNonNull(TABLE_ID_PROPERTY_NAME) ? jsonTable.get(TABLE_ID_PROPERTY_NAME).asInt() : null;
        String tableKind = jsonTable.hasNonNull(TABLE_KIND_PROPERTY_NAME) ? jsonTable.get(TABLE_KIND_PROPERTY_NAME).asText() : null;

        List<KustoResultColumn> columns = new ArrayList<>();
        JsonNode columnsJson = jsonTable.get(COLUMNS_PROPERTY_NAME);
        if (columnsJson != null && columnsJson.getNodeType() == JsonNodeType.ARRAY) {
            for (int i = 0; i < columnsJson.size(); i++) {
                JsonNode jsonCol = columnsJson.get(i);
                if (!jsonCol.has(COLUMN_NAME_PROPERTY_NAME)) {
                    throw new KustoParseException(String.format("Column Name property is missing for column %d of table '%s'", i, tableName));
                }
                String columnType = jsonCol.has(COLUMN_TYPE_PROPERTY_NAME) ? jsonCol.get(COLUMN_TYPE_PROPERTY_NAME).asText() : EMPTY_STRING;
                if (columnType.isEmpty()) {
                    columnType = jsonCol.has(COLUMN_TYPE_SECOND_PROPERTY_NAME) ? jsonCol.get(COLUMN_TYPE_SECOND_PROPERTY_NAME).asText() : EMPTY_STRING;
                }
                columns.add(new KustoResultColumn(jsonCol.get(COLUMN_NAME_PROPERTY_NAME).asText(), columnType, i));
            }
        }

        List<List<Object>> rows = new ArrayList<>();
        JsonNode jsonRows = jsonTable.get(ROWS_PROPERTY_NAME);
        if (jsonRows != null && jsonRows.getNodeType() == JsonNodeType.ARRAY) {
            for (JsonNode row : jsonRows) {
                if (row.getNodeType() == JsonNodeType.OBJECT) {
                    throw errorFromRow(row);
                }
                List<Object> rowVector = new ArrayList<>(row.size());
                for (JsonNode value : row) {
                    rowVector.add(decodeValue(value));
                }
                rows.add(rowVector);
            }
        }

        return new KustoResultTable(tableName, tableId, tableKind, columns, rows);
    }

    // A row that is an object instead of an array reports a failure that happened while the results were streamed
    private static KustoServiceQueryError errorFromRow(JsonNode row) {
        if (row.has(EXCEPTIONS_PROPERTY_NAME) && row.get(EXCEPTIONS_PROPERTY_NAME).isArray()) {
            return KustoServiceQueryError.fromOneApiErrorArray((ArrayNode) row.get(EXCEPTIONS_PROPERTY_NAME), false);
        }
        if (row.has(ONE_API_ERRORS_PROPERTY_NAME) && row.get(ONE_API_ERRORS_PROPERTY_NAME).isArray()) {
            return KustoServiceQueryError.fromOneApiErrorArray((ArrayNode) row.get(ONE_API_ERRORS_PROPERTY_NAME), true);
        }
        return new KustoServiceQueryError("Unexpected object row in the result: " + row);
    }

    private static Object decodeValue(JsonNode obj) {
        if (obj == null || obj.isNull()) {
            return null;
        }
        switch (obj.getNodeType()) {
            case STRING:
                return obj.asText();
            case BOOLEAN:
                return obj.asBoolean();
            case NUMBER:
                if (obj.isInt()) {
                    return obj.asInt();
                } else if (obj.isLong()) {
                    return obj.asLong();
                } else if (obj.isBigDecimal()) {
                    return obj.decimalValue();
                } else if (obj.isDouble()) {
                    return obj.asDouble();
                } else if (obj.isBigInteger()) {
                    return obj.bigIntegerValue();
                }
                return obj;
            default:
                return obj;
        }
    }

    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    @Nullable
    public Integer getId() {
        return id;
    }

    void setId(Integer id) {
        this.id = id;
    }

    @Nullable
    public WellKnownDataSet getKind() {
        return kind;
    }

    void setKind(WellKnownDataSet kind) {
        this.kind = kind;
    }

    /**
     * @return the kind exactly as sent by the service, even when it is not a {@link WellKnownDataSet}
     */
    @Nullable
    public String getKindName() {
        return kind != null ? kind.name() : kindName;
    }

    public List<KustoResultColumn> getColumns() {
        return columns;
    }

    public int getRowsCount() {
        return rows.size();
    }

    public List<List<Object>> getRawRows() {
        return rows;
    }

    public KustoResultRow getRow(int index) {
        if (index < 0 || index >= rows.size()) {
            throw new IndexOutOfBoundsException(String.format("Row index %d is out of range, table '%s' has %d rows", index, name, rows.size()));
        }
        return new KustoResultRow(columns, rows.get(index));
    }

    public Iterable<KustoResultRow> rows() {
        return RowIterator::new;
    }

    public Stream<KustoResultRow> stream() {
        return IntStream.range(0, rows.size()).mapToObj(this::getRow);
    }

    public ObjectNode toJson() {
        ObjectNode table = objectMapper.createObjectNode();
        table.put("name", name);
        ArrayNode data = table.putArray("data");
        for (KustoResultRow row : rows()) {
            data.add(row.toJson());
        }
        return table;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

    String describe() {
        return String.format("%s(id=%s, kind=%s, columns=%s)", name, id, getKindName(),
                columns.stream().map(KustoResultColumn::getColumnName).collect(Collectors.toList()));
    }

    private class RowIterator implements Iterator<KustoResultRow> {
        private int next = 0;

        @Override
        public boolean hasNext() {
            return next < rows.size();
        }

        @Override
        @NotNull
        public KustoResultRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return getRow(next++);
        }
    }
}
