// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import com.microsoft.azure.kusto.core.ingest.resources.ResourceURI;

/**
 * One snapshot of the ingestion resources of a cluster. A null list means the resource type was never fetched; an
 * empty list means the service listed none.
 */
public class IngestClientResources {
    private final List<ResourceURI> securedReadyForAggregationQueues;
    private final List<ResourceURI> failedIngestionsQueues;
    private final List<ResourceURI> successfulIngestionsQueues;
    private final List<ResourceURI> containers;
    private final List<ResourceURI> statusTables;

    public IngestClientResources(@Nullable List<ResourceURI> securedReadyForAggregationQueues,
            @Nullable List<ResourceURI> failedIngestionsQueues,
            @Nullable List<ResourceURI> successfulIngestionsQueues,
            @Nullable List<ResourceURI> containers,
            @Nullable List<ResourceURI> statusTables) {
        this.securedReadyForAggregationQueues = immutable(securedReadyForAggregationQueues);
        this.failedIngestionsQueues = immutable(failedIngestionsQueues);
        this.successfulIngestionsQueues = immutable(successfulIngestionsQueues);
        this.containers = immutable(containers);
        this.statusTables = immutable(statusTables);
    }

    static IngestClientResources fromResourceMap(Map<ResourceType, List<ResourceURI>> resources) {
        Map<ResourceType, List<ResourceURI>> byType = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            byType.put(type, resources.getOrDefault(type, new ArrayList<>()));
        }
        return new IngestClientResources(
                byType.get(ResourceType.SECURED_READY_FOR_AGGREGATION_QUEUE),
                byType.get(ResourceType.FAILED_INGESTIONS_QUEUE),
                byType.get(ResourceType.SUCCESSFUL_INGESTIONS_QUEUE),
                byType.get(ResourceType.TEMP_STORAGE),
                byType.get(ResourceType.INGESTIONS_STATUS_TABLE));
    }

    private static List<ResourceURI> immutable(@Nullable List<ResourceURI> list) {
        return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
    }

    /**
     * @return true when every list the queued ingestion needs is present, even if empty
     */
    public boolean valid() {
        return securedReadyForAggregationQueues != null
                && failedIngestionsQueues != null
                && successfulIngestionsQueues != null
                && containers != null;
    }

    @Nullable
    public List<ResourceURI> getSecuredReadyForAggregationQueues() {
        return securedReadyForAggregationQueues;
    }

    @Nullable
    public List<ResourceURI> getFailedIngestionsQueues() {
        return failedIngestionsQueues;
    }

    @Nullable
    public List<ResourceURI> getSuccessfulIngestionsQueues() {
        return successfulIngestionsQueues;
    }

    @Nullable
    public List<ResourceURI> getContainers() {
        return containers;
    }

    @Nullable
    public List<ResourceURI> getStatusTables() {
        return statusTables;
    }
}
