package com.microsoft.azure.kusto.core.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.microsoft.azure.kusto.core.data.exceptions.KustoParseException;
import com.microsoft.azure.kusto.core.data.exceptions.KustoServiceQueryError;

class KustoResultTableTest {
    private final ObjectMapper objectMapper = Utils.getObjectMapper();
    private KustoResultTable primary;

    @BeforeEach
    void setUp() throws IOException {
        KustoResponseDataSet dataSet = KustoResponseDataSet.fromJson(KustoResponseDataSetTest.readResource("v2QueryResponse.json"), ResponseProtocol.V2);
        primary = dataSet.getPrimaryResults().get(0);
    }

    @Test
    void temporalColumnsAreConvertedWhenRowIsBuilt() {
        KustoResultRow first = primary.getRow(0);
        KustoResultRow second = primary.getRow(1);

        assertEquals(Instant.parse("2023-04-05T10:15:30.1234567Z"), first.getObject("Timestamp"));
        assertTrue(first.getInstant("Timestamp").isBefore(second.getInstant("Timestamp")));
        assertEquals(Duration.ofHours(1).plusMinutes(2).plusSeconds(3), first.getDuration("Elapsed"));
        assertEquals(Duration.ofDays(1).plusMillis(500), second.getObject("Elapsed"));
        assertTrue(second.getDuration("Elapsed").compareTo(first.getDuration("Elapsed")) > 0);
    }

    @Test
    void otherColumnsPassThroughDecodedJson() {
        KustoResultRow first = primary.getRow(0);
        KustoResultRow second = primary.getRow(1);

        assertEquals("first", first.getObject("Name"));
        assertEquals(5, first.getObject("Count"));
        assertEquals(9000000000L, second.getObject("Count"));
        assertEquals(Long.valueOf(5), first.getLong("Count"));
        assertEquals(new BigDecimal("1.25"), first.getObject("Price"));
        assertEquals(Boolean.TRUE, first.getBoolean("Succeeded"));
        assertInstanceOf(JsonNode.class, first.getObject("Props"));
        assertEquals("{\"a\":1}", first.getString("Props"));
        assertNull(second.getObject("Props"));
    }

    @Test
    void nullsStayNull() {
        KustoResultRow empty = primary.getRow(2);

        assertNull(empty.getObject("Timestamp"));
        assertNull(empty.getInstant("Timestamp"));
        assertNull(empty.getDuration("Elapsed"));
        assertNull(empty.getLong("Count"));
        assertNull(empty.getString("Name"));
    }

    @Test
    void positionalAccessFollowsOrdinals() {
        KustoResultRow first = primary.getRow(0);

        assertEquals("first", first.getValueAt(1));
        assertEquals(first.getObject("Elapsed"), first.getValueAt(2));
        assertEquals(7, first.getColumns().size());
        assertEquals("2023-04-05T10:15:30.1234567Z", first.getRaw().get(0));
        assertThrows(IndexOutOfBoundsException.class, () -> first.getValueAt(7));
        assertThrows(IllegalArgumentException.class, () -> first.getObject("Missing"));
    }

    @Test
    void columnsAreSortedByOrdinal() {
        List<KustoResultColumn> columns = Arrays.asList(new KustoResultColumn("b", "string", 1), new KustoResultColumn("a", "string", 0));

        KustoResultRow row = new KustoResultRow(columns, Arrays.asList("x", "y"));

        assertEquals("a", row.getColumns().get(0).getColumnName());
        assertEquals("x", row.getValueAt(0));
        assertEquals("y", row.getObject("b"));
        assertEquals(Arrays.asList("a", "b"), new ArrayList<>(row.asMap().keySet()));
    }

    @Test
    void everyIterationStartsFromTheFirstRow() {
        Iterable<KustoResultRow> rows = primary.rows();
        int firstPass = 0;
        for (KustoResultRow ignored : rows) {
            firstPass++;
        }
        Iterator<KustoResultRow> secondPass = primary.rows().iterator();

        assertEquals(3, firstPass);
        assertEquals("first", secondPass.next().getString("Name"));
        assertEquals(3, primary.stream().count());
        assertEquals(3, primary.getRowsCount());
    }

    @Test
    void toJsonUsesNameAndData() {
        ObjectNode json = primary.toJson();

        assertEquals("PrimaryResult", json.get("name").asText());
        assertEquals(3, json.get("data").size());
        JsonNode first = json.get("data").get(0);
        assertEquals("first", first.get("Name").asText());
        assertEquals("2023-04-05T10:15:30.123456700Z", first.get("Timestamp").asText());
        assertEquals("PT1H2M3S", first.get("Elapsed").asText());
        assertEquals(1, first.get("Props").get("a").asInt());
        assertTrue(json.get("data").get(2).get("Name").isNull());
        assertEquals(json.toString(), primary.toString());
    }

    @Test
    void objectRowFailsTheTable() throws IOException {
        JsonNode table = objectMapper.readTree("{\"TableName\":\"PrimaryResult\",\"TableKind\":\"PrimaryResult\","
                + "\"Columns\":[{\"ColumnName\":\"x\",\"ColumnType\":\"int\"}],"
                + "\"Rows\":[[1],{\"OneApiErrors\":[{\"error\":{\"code\":\"LimitsExceeded\",\"message\":\"Request is invalid\","
                + "\"@message\":\"Partial query failure\",\"@permanent\":true}}]}]}");

        KustoServiceQueryError error = assertThrows(KustoServiceQueryError.class, () -> KustoResultTable.fromJson(table));

        assertEquals("LimitsExceeded: Request is invalid\n", error.getMessage());
        assertEquals(1, error.getApiErrors().size());
        assertTrue(error.isPermanent());
    }

    @Test
    void missingColumnNameIsRejected() throws IOException {
        JsonNode table = objectMapper.readTree("{\"TableName\":\"t\",\"Columns\":[{\"ColumnType\":\"int\"}],\"Rows\":[]}");

        assertThrows(KustoParseException.class, () -> KustoResultTable.fromJson(table));
    }

    @Test
    void unknownKindIsKeptByName() throws IOException {
        JsonNode table = objectMapper.readTree("{\"TableName\":\"t\",\"TableKind\":\"QueryTraceLog\",\"Columns\":[],\"Rows\":[]}");

        KustoResultTable result = KustoResultTable.fromJson(table);

        assertNull(result.getKind());
        assertEquals("QueryTraceLog", result.getKindName());
    }
}
