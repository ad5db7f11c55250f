// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.core.ingest.result.IngestionResult;
import com.microsoft.azure.kusto.core.ingest.source.BlobSourceInfo;
import com.microsoft.azure.kusto.core.ingest.source.StreamSourceInfo;

import reactor.core.publisher.Mono;

/**
 * Ingests data by posting ingestion messages to the ingestion queues of a cluster. Data that is not already in a
 * blob is first uploaded to one of the cluster's temporary storage containers.
 */
public interface QueuedIngestClient {
    /**
     * <p>Ingest data from a blob storage into Kusto database.</p>
     *
     * @param blobSourceInfo      The specific SourceInfo to be ingested
     * @param ingestionProperties Settings used to customize the ingestion operation
     * @return {@link IngestionResult} object including the ingestion result
     * @throws IngestionClientException  An exception originating from a client activity
     * @throws IngestionServiceException An exception returned from the service
     */
    IngestionResult ingestFromBlob(BlobSourceInfo blobSourceInfo, IngestionProperties ingestionProperties)
            throws IngestionClientException, IngestionServiceException;

    Mono<IngestionResult> ingestFromBlobAsync(BlobSourceInfo blobSourceInfo, IngestionProperties ingestionProperties);

    /**
     * <p>Ingest data from an input stream into Kusto database.</p>
     * The stream is uploaded to a temporary blob and then ingested from there. It is closed afterwards unless
     * {@link StreamSourceInfo#isLeaveOpen()} is set.
     *
     * @param streamSourceInfo    The specific SourceInfo to be ingested
     * @param ingestionProperties Settings used to customize the ingestion operation
     * @return {@link IngestionResult} object including the ingestion result
     * @throws IngestionClientException  An exception originating from a client activity
     * @throws IngestionServiceException An exception returned from the service
     */
    IngestionResult ingestFromStream(StreamSourceInfo streamSourceInfo, IngestionProperties ingestionProperties)
            throws IngestionClientException, IngestionServiceException;

    Mono<IngestionResult> ingestFromStreamAsync(StreamSourceInfo streamSourceInfo, IngestionProperties ingestionProperties);

    IngestionResourceManager getResourceManager();

    /**
     * The queues the service reports ingestion outcomes to, for ingestions that asked for queue reporting.
     */
    IngestionStatusQueues getStatusQueues();
}
