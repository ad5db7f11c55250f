package com.microsoft.azure.kusto.core.ingest.result;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

public class IngestionSuccessMessage extends IngestionStatusMessage {
    @JsonProperty("SucceededOn")
    private Instant succeededOn;

    public Instant getSucceededOn() {
        return succeededOn;
    }
}
