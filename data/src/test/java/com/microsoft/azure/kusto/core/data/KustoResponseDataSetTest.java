// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.microsoft.azure.kusto.core.data.exceptions.KustoParseException;

class KustoResponseDataSetTest {
    private final ObjectMapper objectMapper = Utils.getObjectMapper();

    static String readResource(String name) throws IOException {
        try (InputStream stream = KustoResponseDataSetTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(stream, "missing test resource " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void v2FramesKeepOnlyDataTables() throws IOException {
        KustoResponseDataSet dataSet = KustoResponseDataSet.fromJson(readResource("v2QueryResponse.json"), ResponseProtocol.V2);

        assertEquals(ResponseProtocol.V2, dataSet.getProtocol());
        assertEquals("2.0", dataSet.getVersion());
        assertEquals(3, dataSet.getTables().size());
        assertEquals(1, dataSet.getPrimaryResults().size());
        assertNotNull(dataSet.getStatusTable());
        assertEquals(Arrays.asList("@ExtendedProperties", "PrimaryResult", "QueryCompletionInformation"), dataSet.getTableNames());
        assertEquals(WellKnownDataSet.QueryProperties, dataSet.getTables().get(0).getKind());
        assertEquals(Integer.valueOf(1), dataSet.getPrimaryResults().get(0).getId());
        assertNotNull(dataSet.getDataSetHeader());
        assertNotNull(dataSet.getDataSetCompletion());
        assertEquals(0, dataSet.getErrorsCount());
        assertFalse(dataSet.hasErrors());
        assertTrue(dataSet.getExceptions().isEmpty());
    }

    @Test
    void v1SingleTableIsPrimaryResult() {
        ObjectNode response = v1Response(table("Table_0", "Value", "String", 1));

        KustoResponseDataSet dataSet = KustoResponseDataSet.fromV1(response);

        assertEquals(1, dataSet.getTables().size());
        KustoResultTable table = dataSet.getTables().get(0);
        assertEquals(WellKnownDataSet.PrimaryResult, table.getKind());
        assertEquals(Integer.valueOf(0), table.getId());
        assertSame(table, dataSet.getPrimaryResults().get(0));
        assertNull(dataSet.getStatusTable());
        assertEquals("1.0", dataSet.getVersion());
    }

    @Test
    void v1TwoTablesSecondIsQueryProperties() {
        ObjectNode response = v1Response(table("Table_0", "Value", "String", 2), table("Table_1", "Value", "String", 1));

        KustoResponseDataSet dataSet = KustoResponseDataSet.fromV1(response);

        assertEquals(WellKnownDataSet.PrimaryResult, dataSet.getTables().get(0).getKind());
        assertEquals(WellKnownDataSet.QueryProperties, dataSet.getTables().get(1).getKind());
        assertEquals(Integer.valueOf(1), dataSet.getTables().get(1).getId());
        assertEquals(1, dataSet.getPrimaryResults().size());
    }

    @Test
    void v1TableOfContentsClassifiesOtherTables() throws IOException {
        KustoResponseDataSet dataSet = KustoResponseDataSet.fromJson(readResource("v1TableOfContentsResponse.json"), ResponseProtocol.V1);

        List<KustoResultTable> tables = dataSet.getTables();
        assertEquals(4, tables.size());
        assertEquals(Arrays.asList("PrimaryResult", "@ExtendedProperties", "QueryStatus", "Table_3"), dataSet.getTableNames());
        assertEquals(WellKnownDataSet.TableOfContents, tables.get(3).getKind());
        assertEquals(Integer.valueOf(3), tables.get(3).getId());
        assertEquals(WellKnownDataSet.QueryProperties, tables.get(1).getKind());

        // ids that are not numeric fall back to the table's position
        assertEquals(Integer.valueOf(0), tables.get(0).getId());
        assertEquals(1, dataSet.getPrimaryResults().size());
        assertEquals("TempStorage", dataSet.getPrimaryResults().get(0).getRow(0).getString("ResourceTypeName"));
        assertSame(tables.get(2), dataSet.getStatusTable());
        assertEquals(0, dataSet.getErrorsCount());
    }

    // Only the most severe tier is counted. A total would be 3 here; keep this deliberate if the policy ever changes.
    @Test
    void errorsCountReportsOnlyMostSevereTier() {
        assertEquals(1, statusDataSet(0, 1, 1).getErrorsCount());
        assertEquals(2, statusDataSet(1, 1, 6).getErrorsCount());
        assertEquals(3, statusDataSet(2, 2, 2, 4).getErrorsCount());
        assertEquals(0, statusDataSet(4, 5, 6).getErrorsCount());
        assertEquals(0, statusDataSet().getErrorsCount());
    }

    @Test
    void exceptionsListEveryErrorRowWithCorrelationId() {
        KustoResponseDataSet dataSet = statusDataSet(0, 1, 6);

        List<String> exceptions = dataSet.getExceptions();

        assertEquals(2, exceptions.size());
        assertEquals("Please provide the following data to Kusto: CRID=crid-0 Description: status-0", exceptions.get(0));
        assertEquals("Please provide the following data to Kusto: CRID=crid-1 Description: status-1", exceptions.get(1));
    }

    @Test
    void completionWithErrorsAddsOneErrorAndItsMessages() {
        ArrayNode frames = objectMapper.createArrayNode();
        frames.add(objectMapper.createObjectNode().put("FrameType", "DataSetHeader"));
        ObjectNode primary = table("PrimaryResult", "x", "int", 1);
        primary.put("FrameType", "DataTable").put("TableKind", "PrimaryResult").put("TableId", 0);
        frames.add(primary);
        ObjectNode completion = objectMapper.createObjectNode().put("FrameType", "DataSetCompletion").put("HasErrors", true);
        ObjectNode error = objectMapper.createObjectNode();
        error.putObject("error").put("code", "LimitsExceeded").put("@message", "Query result set has exceeded the internal record count limit");
        completion.putArray("OneApiErrors").add(error);
        frames.add(completion);

        KustoResponseDataSet dataSet = KustoResponseDataSet.fromV2(frames);

        assertNull(dataSet.getStatusTable());
        assertEquals(1, dataSet.getErrorsCount());
        assertEquals(Arrays.asList("Query result set has exceeded the internal record count limit"), dataSet.getExceptions());
    }

    @Test
    void v1StatusTableUsesSeverityColumns() {
        ObjectNode status = objectMapper.createObjectNode().put("TableName", "Table_2");
        ArrayNode columns = status.putArray("Columns");
        columns.addObject().put("ColumnName", "Severity").put("DataType", "Int32");
        columns.addObject().put("ColumnName", "ClientActivityId").put("DataType", "String");
        columns.addObject().put("ColumnName", "StatusDescription").put("DataType", "String");
        status.putArray("Rows").addArray().add(2).add("KJC.execute;abc").add("Semantic error");
        ObjectNode toc = objectMapper.createObjectNode().put("TableName", "Table_3");
        ArrayNode tocColumns = toc.putArray("Columns");
        tocColumns.addObject().put("ColumnName", "Kind").put("DataType", "String");
        tocColumns.addObject().put("ColumnName", "Name").put("DataType", "String");
        tocColumns.addObject().put("ColumnName", "Id").put("DataType", "String");
        ArrayNode tocRows = toc.putArray("Rows");
        tocRows.addArray().add("QueryResult").add("PrimaryResult").add("0");
        tocRows.addArray().add("QueryStatus").add("QueryStatus").add("1");

        KustoResponseDataSet dataSet = KustoResponseDataSet.fromV1(v1Response(table("Table_0", "x", "Int32", 1), status, toc));

        assertEquals(1, dataSet.getErrorsCount());
        assertEquals(Arrays.asList("Please provide the following data to Kusto: CRID=KJC.execute;abc Description: Semantic error"),
                dataSet.getExceptions());
    }

    @Test
    void malformedPayloadsAreRejected() {
        assertThrows(KustoParseException.class, () -> KustoResponseDataSet.fromJson("{not json", ResponseProtocol.V1));
        assertThrows(KustoParseException.class, () -> KustoResponseDataSet.fromJson("{\"Tables\": []}", ResponseProtocol.V1));
        assertThrows(KustoParseException.class, () -> KustoResponseDataSet.fromJson("{\"Tables\": 1}", ResponseProtocol.V1));
        assertThrows(KustoParseException.class, () -> KustoResponseDataSet.fromJson("{}", ResponseProtocol.V2));
    }

    private KustoResponseDataSet statusDataSet(int... levels) {
        ArrayNode frames = objectMapper.createArrayNode();
        ObjectNode status = objectMapper.createObjectNode()
                .put("FrameType", "DataTable")
                .put("TableId", 1)
                .put("TableKind", "QueryCompletionInformation")
                .put("TableName", "QueryCompletionInformation");
        ArrayNode columns = status.putArray("Columns");
        columns.addObject().put("ColumnName", "ClientRequestId").put("ColumnType", "string");
        columns.addObject().put("ColumnName", "Level").put("ColumnType", "int");
        columns.addObject().put("ColumnName", "Payload").put("ColumnType", "string");
        ArrayNode rows = status.putArray("Rows");
        for (int i = 0; i < levels.length; i++) {
            rows.addArray().add("crid-" + i).add(levels[i]).add("status-" + i);
        }
        frames.add(status);
        return KustoResponseDataSet.fromV2(frames);
    }

    private ObjectNode v1Response(ObjectNode... tables) {
        ObjectNode response = objectMapper.createObjectNode();
        ArrayNode array = response.putArray("Tables");
        for (ObjectNode table : tables) {
            array.add(table);
        }
        return response;
    }

    private ObjectNode table(String name, String column, String type, int rowCount) {
        ObjectNode table = objectMapper.createObjectNode().put("TableName", name);
        table.putArray("Columns").addObject().put("ColumnName", column).put("ColumnType", type);
        ArrayNode rows = table.putArray("Rows");
        for (int i = 0; i < rowCount; i++) {
            rows.addArray().add(i);
        }
        return table;
    }
}
