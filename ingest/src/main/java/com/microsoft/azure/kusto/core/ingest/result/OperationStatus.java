// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.result;

/**
 * The state of an ingestion operation. A queued ingestion starts as {@link #Queued}.
 */
public enum OperationStatus {
    Pending,
    Succeeded,
    Failed,
    Queued,
    Skipped,
    PartiallySucceeded
}
