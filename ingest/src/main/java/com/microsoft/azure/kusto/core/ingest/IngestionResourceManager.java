package com.microsoft.azure.kusto.core.ingest;

import java.util.List;

import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.core.ingest.resources.ResourceURI;

public interface IngestionResourceManager {

    /**
     * Returns the ingestion queues, ordered by the health of their storage accounts.
     * You should use this method for each ingestion operation.
     */
    List<ResourceURI> getRankedShuffledQueues() throws IngestionClientException, IngestionServiceException;

    /**
     * Returns the temporary storage containers, ordered by the health of their storage accounts.
     */
    List<ResourceURI> getRankedShuffledContainers() throws IngestionClientException, IngestionServiceException;

    /**
     * Returns the queues the service reports failed ingestions to.
     */
    List<ResourceURI> getFailedIngestionsQueues() throws IngestionClientException, IngestionServiceException;

    /**
     * Returns the queues the service reports successful ingestions to.
     */
    List<ResourceURI> getSuccessfulIngestionsQueues() throws IngestionClientException, IngestionServiceException;

    String getAuthorizationContext() throws IngestionClientException, IngestionServiceException;

    /**
     * Report the result of an operation against a storage resource.
     * @param resource The resource that was used. Can be a container or a queue.
     * @param success Whether the operation was successful.
     */
    void reportResourceUsageResult(ResourceURI resource, boolean success);
}
