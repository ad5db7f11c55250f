package com.microsoft.azure.kusto.core.ingest;

import com.microsoft.azure.kusto.core.ingest.result.IngestionFailureMessage;
import com.microsoft.azure.kusto.core.ingest.result.IngestionSuccessMessage;
import com.microsoft.azure.kusto.core.ingest.utils.DefaultRandomProvider;
import com.microsoft.azure.kusto.core.ingest.utils.RandomProvider;

/**
 * The success and failure notification queues of a cluster. The service only posts to them for ingestions sent with
 * {@link IngestionProperties.ReportMethod#QUEUE} reporting.
 */
public class IngestionStatusQueues {
    private final IngestionStatusQueue<IngestionSuccessMessage> success;
    private final IngestionStatusQueue<IngestionFailureMessage> failure;

    public IngestionStatusQueues(IngestionResourceManager resourceManager, StorageClient storageClient) {
        this(resourceManager, storageClient, new DefaultRandomProvider());
    }

    public IngestionStatusQueues(IngestionResourceManager resourceManager, StorageClient storageClient, RandomProvider randomProvider) {
        this.success = new IngestionStatusQueue<>(resourceManager::getSuccessfulIngestionsQueues, storageClient, IngestionSuccessMessage.class,
                randomProvider);
        this.failure = new IngestionStatusQueue<>(resourceManager::getFailedIngestionsQueues, storageClient, IngestionFailureMessage.class,
                randomProvider);
    }

    public IngestionStatusQueue<IngestionSuccessMessage> getSuccess() {
        return success;
    }

    public IngestionStatusQueue<IngestionFailureMessage> getFailure() {
        return failure;
    }
}
