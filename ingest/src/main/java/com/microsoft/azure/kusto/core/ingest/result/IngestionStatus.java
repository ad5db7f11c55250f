// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.result;

import java.time.Instant;
import java.util.UUID;

/**
 * The status of a single ingestion, as known to the client.
 */
public class IngestionStatus {
    private OperationStatus status;
    private UUID ingestionSourceId;
    private String ingestionSourcePath;
    private String database;
    private String table;
    private Instant updatedOn;

    public OperationStatus getStatus() {
        return status;
    }

    public void setStatus(OperationStatus status) {
        this.status = status;
    }

    public UUID getIngestionSourceId() {
        return ingestionSourceId;
    }

    public void setIngestionSourceId(UUID ingestionSourceId) {
        this.ingestionSourceId = ingestionSourceId;
    }

    /**
     * The URI of the ingested blob, without its SAS token.
     */
    public String getIngestionSourcePath() {
        return ingestionSourcePath;
    }

    public void setIngestionSourcePath(String ingestionSourcePath) {
        this.ingestionSourcePath = ingestionSourcePath;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public Instant getUpdatedOn() {
        return updatedOn;
    }

    public void setUpdatedOn(Instant updatedOn) {
        this.updatedOn = updatedOn;
    }
}
