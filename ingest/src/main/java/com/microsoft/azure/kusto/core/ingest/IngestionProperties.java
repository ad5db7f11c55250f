// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.microsoft.azure.kusto.core.data.Ensure;
import com.microsoft.azure.kusto.core.data.Utils;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;

public class IngestionProperties {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final String DROP_BY_PREFIX = "drop-by:";
    static final String INGEST_BY_PREFIX = "ingest-by:";

    private final String databaseName;
    private final String tableName;
    private boolean flushImmediately;
    private boolean ignoreFirstRecord;
    private ReportLevel reportLevel;
    private ReportMethod reportMethod;
    private List<String> dropByTags;
    private List<String> ingestByTags;
    private List<String> additionalTags;
    private List<String> ingestIfNotExists;
    private String ingestionMappingReference;
    private Map<String, String> additionalProperties;
    private DataFormat dataFormat;

    /**
     * Creates an initialized {@code IngestionProperties} instance with a given {@code databaseName} and {@code tableName}.
     * The default values of the rest of the properties are:
     * <blockquote>
     * <p>{@code reportLevel} : {@code ReportLevel.FAILURES_ONLY;}</p>
     * <p>{@code reportMethod} : {@code ReportMethod.QUEUE;}</p>
     * <p>{@code flushImmediately} : {@code false;}</p>
     * <p>{@code dataFormat} : {@code DataFormat.CSV;}</p>
     * </blockquote>
     *
     * @param databaseName the name of the database in the destination Kusto cluster.
     * @param tableName    the name of the table in the destination database.
     */
    public IngestionProperties(String databaseName, String tableName) {
        this.databaseName = databaseName;
        this.tableName = tableName;
        this.reportLevel = ReportLevel.FAILURES_ONLY;
        this.reportMethod = ReportMethod.QUEUE;
        this.flushImmediately = false;
        this.ignoreFirstRecord = false;
        this.additionalProperties = new HashMap<>();
        this.dropByTags = new ArrayList<>();
        this.ingestByTags = new ArrayList<>();
        this.ingestIfNotExists = new ArrayList<>();
        this.additionalTags = new ArrayList<>();
        this.dataFormat = DataFormat.CSV;
    }

    /**
     * Copy constructor for {@code IngestionProperties}.
     *
     * @param other the instance to copy from.
     */
    public IngestionProperties(IngestionProperties other) {
        this.databaseName = other.databaseName;
        this.tableName = other.tableName;
        this.reportLevel = other.reportLevel;
        this.reportMethod = other.reportMethod;
        this.flushImmediately = other.flushImmediately;
        this.ignoreFirstRecord = other.ignoreFirstRecord;
        this.dataFormat = other.dataFormat;
        this.ingestionMappingReference = other.ingestionMappingReference;
        this.additionalProperties = new HashMap<>(other.additionalProperties);
        this.dropByTags = new ArrayList<>(other.dropByTags);
        this.ingestByTags = new ArrayList<>(other.ingestByTags);
        this.ingestIfNotExists = new ArrayList<>(other.ingestIfNotExists);
        this.additionalTags = new ArrayList<>(other.additionalTags);
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getTableName() {
        return tableName;
    }

    public boolean getFlushImmediately() {
        return flushImmediately;
    }

    public void setFlushImmediately(boolean flushImmediately) {
        this.flushImmediately = flushImmediately;
    }

    public boolean isIgnoreFirstRecord() {
        return ignoreFirstRecord;
    }

    /**
     * @param ignoreFirstRecord whether the first record of every file is a header to skip
     */
    public void setIgnoreFirstRecord(boolean ignoreFirstRecord) {
        this.ignoreFirstRecord = ignoreFirstRecord;
    }

    public ReportLevel getReportLevel() {
        return reportLevel;
    }

    public void setReportLevel(ReportLevel reportLevel) {
        this.reportLevel = reportLevel;
    }

    public ReportMethod getReportMethod() {
        return reportMethod;
    }

    public void setReportMethod(ReportMethod reportMethod) {
        this.reportMethod = reportMethod;
    }

    public List<String> getDropByTags() {
        return dropByTags;
    }

    /**
     * Drop-by tags are tags added to the ingested data bulk in order to be able to delete it.
     *
     * @param dropByTags - suffixes of the tags, each resulting tag is prefixed by "drop-by:"
     */
    public void setDropByTags(List<String> dropByTags) {
        this.dropByTags = dropByTags;
    }

    public List<String> getIngestByTags() {
        return ingestByTags;
    }

    /**
     * Tags that start with an ingest-by: prefix can be used to ensure that data is only ingested once.
     *
     * @param ingestByTags - suffixes of the tags, each resulting tag is prefixed by "ingest-by:"
     */
    public void setIngestByTags(List<String> ingestByTags) {
        this.ingestByTags = ingestByTags;
    }

    public List<String> getAdditionalTags() {
        return additionalTags;
    }

    public void setAdditionalTags(List<String> additionalTags) {
        this.additionalTags = additionalTags;
    }

    public List<String> getIngestIfNotExists() {
        return ingestIfNotExists;
    }

    /**
     * Skips the ingestion if an extent with any of these "ingest-by" tags already exists.
     */
    public void setIngestIfNotExists(List<String> ingestIfNotExists) {
        this.ingestIfNotExists = ingestIfNotExists;
    }

    public String getIngestionMappingReference() {
        return ingestionMappingReference;
    }

    /**
     * @param ingestionMappingReference the name of a mapping declared on the destination table
     */
    public void setIngestionMappingReference(String ingestionMappingReference) {
        this.ingestionMappingReference = ingestionMappingReference;
    }

    public Map<String, String> getAdditionalProperties() {
        return additionalProperties;
    }

    public void setAdditionalProperties(Map<String, String> additionalProperties) {
        this.additionalProperties = additionalProperties;
    }

    @NotNull
    public DataFormat getDataFormat() {
        return dataFormat;
    }

    /**
     * @throws IllegalArgumentException if null argument is passed
     */
    public void setDataFormat(@NotNull DataFormat dataFormat) {
        Ensure.argIsNotNull(dataFormat, "dataFormat");
        this.dataFormat = dataFormat;
    }

    /**
     * Sets the data format by its name. If the name does not exist, then it does not set it.
     */
    public void setDataFormat(@NotNull String dataFormatName) {
        DataFormat format = DataFormat.fromKustoValue(dataFormatName);
        if (format == null) {
            log.warn("Invalid dataFormatName of {}, DataFormat property value wasn't set.", dataFormatName);
            return;
        }
        this.dataFormat = format;
    }

    /**
     * All tags of the ingestion: the additional tags, then the ingest-by tags, then the drop-by tags.
     */
    public List<String> getTags() {
        List<String> tags = new ArrayList<>(additionalTags);
        for (String t : ingestByTags) {
            tags.add(INGEST_BY_PREFIX + t);
        }
        for (String t : dropByTags) {
            tags.add(DROP_BY_PREFIX + t);
        }
        return tags;
    }

    /**
     * Builds the {@code AdditionalProperties} of the ingestion message. List values are JSON encoded, as the service
     * expects string values.
     */
    Map<String, String> getIngestionProperties(String authorizationContext) throws IngestionClientException {
        Map<String, String> fullAdditionalProperties = new HashMap<>(additionalProperties);
        fullAdditionalProperties.put("authorizationContext", authorizationContext);

        List<String> tags = getTags();
        if (!tags.isEmpty()) {
            fullAdditionalProperties.put("tags", toJson(tags));
        }
        if (!ingestIfNotExists.isEmpty()) {
            fullAdditionalProperties.put("ingestIfNotExists", toJson(ingestIfNotExists));
        }
        if (StringUtils.isNotBlank(ingestionMappingReference)) {
            fullAdditionalProperties.put("ingestionMappingReference", ingestionMappingReference);
        }
        if (ignoreFirstRecord) {
            fullAdditionalProperties.put("ignoreFirstRecord", "true");
        }
        fullAdditionalProperties.put("format", dataFormat.getKustoValue());
        return fullAdditionalProperties;
    }

    private static String toJson(List<String> values) throws IngestionClientException {
        try {
            return Utils.getObjectMapper().writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IngestionClientException("Failed to serialize ingestion properties", e);
        }
    }

    /**
     * Validate the minimum non-empty values needed for data ingestion and mappings.
     */
    public void validate() throws IngestionClientException {
        Ensure.stringIsNotBlank(databaseName, "databaseName");
        Ensure.stringIsNotBlank(tableName, "tableName");
        Ensure.argIsNotNull(reportLevel, "reportLevel");
        Ensure.argIsNotNull(reportMethod, "reportMethod");

        if (dataFormat.isMappingRequired() && StringUtils.isBlank(ingestionMappingReference)) {
            String message = String.format("Mapping must be specified for '%s' format.", dataFormat.getKustoValue());
            log.error(message);
            throw new IngestionClientException(message);
        }
    }

    public enum DataFormat {
        CSV("csv", false),
        TSV("tsv", false),
        SCSV("scsv", false),
        SOHSV("sohsv", false),
        PSV("psv", false),
        TXT("txt", false),
        RAW("raw", false),
        TSVE("tsve", false),
        JSON("json", true),
        SINGLEJSON("singlejson", true),
        MULTIJSON("multijson", true),
        AVRO("avro", true),
        PARQUET("parquet", false),
        SSTREAM("sstream", false),
        ORC("orc", false),
        APACHEAVRO("apacheavro", false),
        W3CLOGFILE("w3clogfile", false);

        private final String kustoValue;
        private final boolean mappingRequired;

        DataFormat(String kustoValue, boolean mappingRequired) {
            this.kustoValue = kustoValue;
            this.mappingRequired = mappingRequired;
        }

        public String getKustoValue() {
            return kustoValue;
        }

        public boolean isMappingRequired() {
            return mappingRequired;
        }

        public static DataFormat fromKustoValue(String kustoValue) {
            String lowered = kustoValue.toLowerCase(Locale.ROOT);
            for (DataFormat format : values()) {
                if (format.kustoValue.equals(lowered)) {
                    return format;
                }
            }
            return null;
        }
    }

    public enum ReportLevel {
        FAILURES_ONLY(0),
        DO_NOT_REPORT(1),
        FAILURES_AND_SUCCESSES(2);

        private final int kustoValue;

        ReportLevel(int kustoValue) {
            this.kustoValue = kustoValue;
        }

        @JsonValue
        public int getKustoValue() {
            return kustoValue;
        }
    }

    public enum ReportMethod {
        QUEUE(0),
        TABLE(1),
        QUEUE_AND_TABLE(2);

        private final int kustoValue;

        ReportMethod(int kustoValue) {
            this.kustoValue = kustoValue;
        }

        @JsonValue
        public int getKustoValue() {
            return kustoValue;
        }
    }
}
