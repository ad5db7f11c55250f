// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.result;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class IngestionFailureMessage extends IngestionStatusMessage {
    @JsonProperty("FailedOn")
    private Instant failedOn;
    @JsonProperty("Details")
    private String details;
    @JsonProperty("ErrorCode")
    private String errorCode;
    @JsonProperty("FailureStatus")
    private FailureStatusValue failureStatus;
    @JsonProperty("OriginatesFromUpdatePolicy")
    private Boolean originatesFromUpdatePolicy;
    @JsonProperty("ShouldRetry")
    private Boolean shouldRetry;

    public Instant getFailedOn() {
        return failedOn;
    }

    public String getDetails() {
        return details;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public FailureStatusValue getFailureStatus() {
        return failureStatus;
    }

    /**
     * Whether the failure happened in an update policy of the target table rather than in the ingestion itself.
     */
    public Boolean getOriginatesFromUpdatePolicy() {
        return originatesFromUpdatePolicy;
    }

    public Boolean getShouldRetry() {
        return shouldRetry;
    }

    public enum FailureStatusValue {
        Unknown(0),
        Permanent(1),
        Transient(2),
        Exhausted(3);

        private final int value;

        FailureStatusValue(int v) {
            value = v;
        }

        public int getValue() {
            return value;
        }

        /**
         * The service writes the status by name, older messages by number. Anything else maps to {@link #Unknown}.
         */
        @JsonCreator
        public static FailureStatusValue fromJson(String status) {
            if (status == null) {
                return Unknown;
            }
            for (FailureStatusValue value : values()) {
                if (value.name().equalsIgnoreCase(status) || String.valueOf(value.value).equals(status.trim())) {
                    return value;
                }
            }
            return Unknown;
        }
    }
}
