// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.result;

import java.util.List;

import reactor.core.publisher.Mono;

public interface IngestionResult {

    /**
     * Retrieves the statuses of all the ingestion operations associated with this result.
     */
    Mono<List<IngestionStatus>> getIngestionStatusCollectionAsync();

    List<IngestionStatus> getIngestionStatusCollection();

    int getIngestionStatusesLength();
}
