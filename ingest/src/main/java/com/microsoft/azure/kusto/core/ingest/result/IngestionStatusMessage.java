// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.result;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The fields shared by the notifications the service posts to the success and failure status queues.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class IngestionStatusMessage {
    @JsonProperty("OperationId")
    private UUID operationId;
    @JsonProperty("Database")
    private String database;
    @JsonProperty("Table")
    private String table;
    @JsonProperty("IngestionSourceId")
    private UUID ingestionSourceId;
    @JsonProperty("IngestionSourcePath")
    private String ingestionSourcePath;
    @JsonProperty("RootActivityId")
    private UUID rootActivityId;

    public UUID getOperationId() {
        return operationId;
    }

    public String getDatabase() {
        return database;
    }

    public String getTable() {
        return table;
    }

    /**
     * The source id sent with the ingestion message, see {@link IngestionStatus#getIngestionSourceId()}.
     */
    public UUID getIngestionSourceId() {
        return ingestionSourceId;
    }

    public String getIngestionSourcePath() {
        return ingestionSourcePath;
    }

    public UUID getRootActivityId() {
        return rootActivityId;
    }
}
