package com.microsoft.azure.kusto.core.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class ResourceTypeTest {

    @Test
    void testFindByResourceTypeNameIgnoresCase() {
        assertEquals(ResourceType.SECURED_READY_FOR_AGGREGATION_QUEUE, ResourceType.findByResourceTypeName("SecuredReadyForAggregationQueue"));
        assertEquals(ResourceType.TEMP_STORAGE, ResourceType.findByResourceTypeName("tempstorage"));
        assertEquals(ResourceType.SUCCESSFUL_INGESTIONS_QUEUE, ResourceType.findByResourceTypeName("SUCCESSFULINGESTIONSQUEUE"));
        assertNull(ResourceType.findByResourceTypeName("SomeFutureResourceType"));
    }
}
