package com.microsoft.azure.kusto.core.ingest;

import org.jetbrains.annotations.Nullable;

enum ResourceType {
    SECURED_READY_FOR_AGGREGATION_QUEUE("SecuredReadyForAggregationQueue"),
    FAILED_INGESTIONS_QUEUE("FailedIngestionsQueue"),
    SUCCESSFUL_INGESTIONS_QUEUE("SuccessfulIngestionsQueue"),
    TEMP_STORAGE("TempStorage"),
    INGESTIONS_STATUS_TABLE("IngestionsStatusTable");

    private final String resourceTypeName;

    ResourceType(String resourceTypeName) {
        this.resourceTypeName = resourceTypeName;
    }

    /**
     * @return the matching type, or null for resource types this client does not use
     */
    @Nullable
    static ResourceType findByResourceTypeName(String resourceTypeName) {
        for (ResourceType resourceType : values()) {
            if (resourceType.resourceTypeName.equalsIgnoreCase(resourceTypeName)) {
                return resourceType;
            }
        }
        return null;
    }
}
