// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.result;

import java.util.Collections;
import java.util.List;

import reactor.core.publisher.Mono;

public class IngestionStatusResult implements IngestionResult {

    private final IngestionStatus ingestionStatus;

    public IngestionStatusResult(IngestionStatus ingestionStatus) {
        this.ingestionStatus = ingestionStatus;
    }

    @Override
    public Mono<List<IngestionStatus>> getIngestionStatusCollectionAsync() {
        if (ingestionStatus != null) {
            return Mono.just(Collections.singletonList(ingestionStatus));
        }

        return Mono.empty();
    }

    @Override
    public List<IngestionStatus> getIngestionStatusCollection() {
        return getIngestionStatusCollectionAsync().block();
    }

    @Override
    public int getIngestionStatusesLength() {
        return ingestionStatus == null ? 0 : 1;
    }
}
