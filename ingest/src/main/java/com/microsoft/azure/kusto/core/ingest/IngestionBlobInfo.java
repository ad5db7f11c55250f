// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.apache.commons.codec.binary.Base64;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.microsoft.azure.kusto.core.data.Utils;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;

/**
 * The message posted to an ingestion queue, telling the service which blob to ingest and how.
 */
@JsonPropertyOrder({"BlobPath", "RawDataSize", "DatabaseName", "TableName", "RetainBlobOnSuccess", "FlushImmediately", "IgnoreSizeLimit",
        "ReportLevel", "ReportMethod", "SourceMessageCreationTime", "Id", "AdditionalProperties"})
public final class IngestionBlobInfo {
    @JsonProperty("BlobPath")
    private final String blobPath;
    @JsonProperty("RawDataSize")
    private final Long rawDataSize;
    @JsonProperty("DatabaseName")
    private final String databaseName;
    @JsonProperty("TableName")
    private final String tableName;
    @JsonProperty("RetainBlobOnSuccess")
    private final boolean retainBlobOnSuccess;
    @JsonProperty("FlushImmediately")
    private final boolean flushImmediately;
    @JsonProperty("IgnoreSizeLimit")
    private final boolean ignoreSizeLimit;
    @JsonProperty("ReportLevel")
    private final IngestionProperties.ReportLevel reportLevel;
    @JsonProperty("ReportMethod")
    private final IngestionProperties.ReportMethod reportMethod;
    @JsonProperty("SourceMessageCreationTime")
    private final Instant sourceMessageCreationTime;
    @JsonProperty("Id")
    private final UUID id;
    @JsonProperty("AdditionalProperties")
    private final Map<String, String> additionalProperties;

    /**
     * @param rawDataSize the uncompressed size of the data, null when unknown
     * @param sourceId    the id of the ingestion, a random one is generated when null
     */
    public IngestionBlobInfo(String blobPath, Long rawDataSize, IngestionProperties properties, String authorizationContext, UUID sourceId)
            throws IngestionClientException {
        this.blobPath = blobPath;
        this.rawDataSize = rawDataSize;
        this.databaseName = properties.getDatabaseName();
        this.tableName = properties.getTableName();
        this.retainBlobOnSuccess = true;
        this.flushImmediately = properties.getFlushImmediately();
        this.ignoreSizeLimit = false;
        this.reportLevel = properties.getReportLevel();
        this.reportMethod = properties.getReportMethod();
        this.sourceMessageCreationTime = Instant.now();
        this.id = sourceId != null ? sourceId : UUID.randomUUID();
        this.additionalProperties = properties.getIngestionProperties(authorizationContext);
    }

    public String getBlobPath() {
        return blobPath;
    }

    public Long getRawDataSize() {
        return rawDataSize;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getTableName() {
        return tableName;
    }

    public boolean getRetainBlobOnSuccess() {
        return retainBlobOnSuccess;
    }

    public boolean getFlushImmediately() {
        return flushImmediately;
    }

    public boolean getIgnoreSizeLimit() {
        return ignoreSizeLimit;
    }

    public IngestionProperties.ReportLevel getReportLevel() {
        return reportLevel;
    }

    public IngestionProperties.ReportMethod getReportMethod() {
        return reportMethod;
    }

    public Instant getSourceMessageCreationTime() {
        return sourceMessageCreationTime;
    }

    public UUID getId() {
        return id;
    }

    public Map<String, String> getAdditionalProperties() {
        return additionalProperties;
    }

    public String toJson() throws IngestionClientException {
        try {
            return Utils.getObjectMapper().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IngestionClientException(blobPath, "Failed to serialize the ingestion message", new IllegalStateException(e));
        }
    }

    /**
     * @return the JSON message, base64 encoded as the ingestion queues expect it
     */
    public String toQueueMessage() throws IngestionClientException {
        return Base64.encodeBase64String(toJson().getBytes(StandardCharsets.UTF_8));
    }
}
