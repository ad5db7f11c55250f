// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.microsoft.azure.kusto.core.data.exceptions.KustoParseException;

/**
 * The tables of a single query or management command response.
 * <p>
 * V1 responses ({@code {"Tables": [...]}}) carry no table kinds, so they are classified by position or by a trailing
 * table of contents. V2 responses are a sequence of frames where every {@code DataTable} frame states its own kind.
 * In both cases {@link #getPrimaryResults()} holds the tables classified as {@link WellKnownDataSet#PrimaryResult} and
 * {@link #getStatusTable()} the {@link WellKnownDataSet#QueryCompletionInformation} table, if one was returned.
 */
public class KustoResponseDataSet {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final ObjectMapper objectMapper = Utils.getObjectMapper();

    static final String TABLES_PROPERTY_NAME = "Tables";
    static final String FRAME_TYPE_PROPERTY_NAME = "FrameType";
    static final String DATA_TABLE_FRAME_TYPE = "DataTable";
    static final String DATA_SET_HEADER_FRAME_TYPE = "DataSetHeader";
    static final String DATA_SET_COMPLETION_FRAME_TYPE = "DataSetCompletion";
    static final String HAS_ERRORS_PROPERTY_NAME = "HasErrors";
    static final String ONE_API_ERRORS_PROPERTY_NAME = "OneApiErrors";
    static final String TOC_NAME_COLUMN = "Name";
    static final String TOC_ID_COLUMN = "Id";
    static final String TOC_KIND_COLUMN = "Kind";

    // Severity levels below this value are errors; a lower level is more severe
    static final int ERROR_SEVERITY_THRESHOLD = 4;

    private static final Map<String, WellKnownDataSet> tablesKindsMap = new HashMap<String, WellKnownDataSet>() {
        {
            put("QueryResult", WellKnownDataSet.PrimaryResult);
            put("QueryProperties", WellKnownDataSet.QueryProperties);
            put("QueryStatus", WellKnownDataSet.QueryCompletionInformation);
        }
    };

    private final ResponseProtocol protocol;
    private final List<KustoResultTable> tables;
    private final List<KustoResultTable> primaryResults = new ArrayList<>();
    private KustoResultTable statusTable;
    private final JsonNode dataSetHeader;
    private final JsonNode dataSetCompletion;

    private KustoResponseDataSet(ResponseProtocol protocol, List<KustoResultTable> tables, @Nullable JsonNode dataSetHeader,
            @Nullable JsonNode dataSetCompletion) {
        this.protocol = protocol;
        this.tables = Collections.unmodifiableList(tables);
        this.dataSetHeader = dataSetHeader;
        this.dataSetCompletion = dataSetCompletion;

        for (KustoResultTable table : tables) {
            if (table.getKind() == WellKnownDataSet.PrimaryResult) {
                primaryResults.add(table);
            } else if (table.getKind() == WellKnownDataSet.QueryCompletionInformation) {
                statusTable = table;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Parsed {} response with tables {}", protocol, tables.stream().map(KustoResultTable::describe).collect(Collectors.toList()));
        }
    }

    public static KustoResponseDataSet fromJson(String response, ResponseProtocol protocol) {
        Ensure.argIsNotNull(protocol, "protocol");
        JsonNode json;
        try {
            json = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse {} response", protocol, e);
            throw new KustoParseException(String.format("Response is not valid JSON for protocol %s", protocol), e);
        }
        return protocol == ResponseProtocol.V1 ? fromV1(json) : fromV2(json);
    }

    public static KustoResponseDataSet fromV1(JsonNode response) {
        if (response == null || !response.has(TABLES_PROPERTY_NAME) || !response.get(TABLES_PROPERTY_NAME).isArray()) {
            throw new KustoParseException("V1 response must contain a 'Tables' array");
        }

        List<KustoResultTable> tables = new ArrayList<>();
        for (JsonNode table : response.get(TABLES_PROPERTY_NAME)) {
            tables.add(KustoResultTable.fromJson(table));
        }
        if (tables.isEmpty()) {
            throw new KustoParseException("V1 response contains no tables");
        }

        classifyV1Tables(tables);
        return new KustoResponseDataSet(ResponseProtocol.V1, tables, null, null);
    }

    private static void classifyV1Tables(List<KustoResultTable> tables) {
        if (tables.size() <= 2) {
            KustoResultTable first = tables.get(0);
            if (first.getKind() == null) {
                first.setKind(WellKnownDataSet.PrimaryResult);
            }
            first.setId(0);

            if (tables.size() == 2) {
                tables.get(1).setKind(WellKnownDataSet.QueryProperties);
                tables.get(1).setId(1);
            }
            return;
        }

        KustoResultTable toc = tables.get(tables.size() - 1);
        toc.setKind(WellKnownDataSet.TableOfContents);
        toc.setId(tables.size() - 1);
        if (toc.getRowsCount() < tables.size() - 1) {
            throw new KustoParseException(String.format("Table of contents describes %d tables but the response has %d", toc.getRowsCount(),
                    tables.size() - 1));
        }

        for (int i = 0; i < tables.size() - 1; i++) {
            KustoResultRow entry = toc.getRow(i);
            KustoResultTable table = tables.get(i);
            table.setName(entry.getString(TOC_NAME_COLUMN));
            table.setId(tableIdFromToc(entry, i));
            table.setKind(tablesKindsMap.get(entry.getString(TOC_KIND_COLUMN)));
        }
    }

    // The service may send a GUID as the table id, the table's position is used instead
    private static int tableIdFromToc(KustoResultRow entry, int position) {
        Object id = entry.hasColumn(TOC_ID_COLUMN) ? entry.getObject(TOC_ID_COLUMN) : null;
        if (id instanceof Number) {
            return ((Number) id).intValue();
        }
        if (id instanceof String && StringUtils.isNumeric((String) id)) {
            return Integer.parseInt((String) id);
        }
        return position;
    }

    public static KustoResponseDataSet fromV2(JsonNode response) {
        if (response == null || response.getNodeType() != JsonNodeType.ARRAY) {
            throw new KustoParseException("V2 response must be an array of frames");
        }

        List<KustoResultTable> tables = new ArrayList<>();
        JsonNode header = null;
        JsonNode completion = null;
        for (JsonNode frame : response) {
            String frameType = frame.has(FRAME_TYPE_PROPERTY_NAME) ? frame.get(FRAME_TYPE_PROPERTY_NAME).asText() : "";
            switch (frameType) {
                case DATA_TABLE_FRAME_TYPE:
                    tables.add(KustoResultTable.fromJson(frame));
                    break;
                case DATA_SET_HEADER_FRAME_TYPE:
                    header = frame;
                    break;
                case DATA_SET_COMPLETION_FRAME_TYPE:
                    completion = frame;
                    break;
                default:
                    log.debug("Skipping frame of type '{}'", frameType);
            }
        }

        return new KustoResponseDataSet(ResponseProtocol.V2, tables, header, completion);
    }

    public ResponseProtocol getProtocol() {
        return protocol;
    }

    public String getVersion() {
        return protocol.getVersion();
    }

    public List<KustoResultTable> getTables() {
        return tables;
    }

    public List<String> getTableNames() {
        return tables.stream().map(KustoResultTable::getName).collect(Collectors.toList());
    }

    public List<KustoResultTable> getPrimaryResults() {
        return Collections.unmodifiableList(primaryResults);
    }

    @Nullable
    public KustoResultTable getStatusTable() {
        return statusTable;
    }

    @Nullable
    public JsonNode getDataSetHeader() {
        return dataSetHeader;
    }

    @Nullable
    public JsonNode getDataSetCompletion() {
        return dataSetCompletion;
    }

    /**
     * Counts the status rows at the most severe level present, not every error row: levels [0, 1, 1] count as 1.
     * A V2 completion frame reporting errors adds one more.
     */
    public int getErrorsCount() {
        int errors = 0;
        if (statusTable != null && statusTable.getRowsCount() != 0 && statusTable.getColumns().stream()
                .anyMatch(c -> protocol.getErrorColumn().equals(c.getColumnName()))) {
            int minLevel = ERROR_SEVERITY_THRESHOLD;
            for (KustoResultRow row : statusTable.rows()) {
                Integer level = severityOf(row);
                if (level == null || level >= ERROR_SEVERITY_THRESHOLD) {
                    continue;
                }
                if (level < minLevel) {
                    minLevel = level;
                    errors = 1;
                } else if (level == minLevel) {
                    errors++;
                }
            }
        }

        if (completionHasErrors()) {
            errors++;
        }
        return errors;
    }

    public boolean hasErrors() {
        return getErrorsCount() > 0;
    }

    /**
     * One support-ready description per error row of the status table, followed by the OneApi error messages of the
     * completion frame.
     */
    public List<String> getExceptions() {
        List<String> result = new ArrayList<>();
        if (statusTable != null && statusTable.getRowsCount() != 0 && statusTable.getColumns().stream()
                .anyMatch(c -> protocol.getErrorColumn().equals(c.getColumnName()))) {
            for (KustoResultRow row : statusTable.rows()) {
                Integer level = severityOf(row);
                if (level != null && level < ERROR_SEVERITY_THRESHOLD) {
                    result.add(String.format("Please provide the following data to Kusto: CRID=%s Description: %s",
                            valueOrNull(row, protocol.getCridColumn()), valueOrNull(row, protocol.getStatusColumn())));
                }
            }
        }

        if (completionHasErrors() && dataSetCompletion.has(ONE_API_ERRORS_PROPERTY_NAME)) {
            for (JsonNode error : dataSetCompletion.get(ONE_API_ERRORS_PROPERTY_NAME)) {
                JsonNode inner = error.has("error") ? error.get("error") : error;
                result.add(inner.has("@message") ? inner.get("@message").asText() : inner.toString());
            }
        }
        return result;
    }

    private boolean completionHasErrors() {
        return dataSetCompletion != null && dataSetCompletion.has(HAS_ERRORS_PROPERTY_NAME) && dataSetCompletion.get(HAS_ERRORS_PROPERTY_NAME).asBoolean();
    }

    // Non-numeric levels are not errors
    private Integer severityOf(KustoResultRow row) {
        Object value = row.getObject(protocol.getErrorColumn());
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric severity '{}'", value);
                return null;
            }
        }
        return null;
    }

    private static String valueOrNull(KustoResultRow row, String column) {
        return row.hasColumn(column) ? row.getString(column) : null;
    }
}
