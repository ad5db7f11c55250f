// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.time.Instant;
import java.util.AbstractMap;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.azure.kusto.core.data.Client;
import com.microsoft.azure.kusto.core.data.Ensure;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.core.ingest.resources.ResourceURI;
import com.microsoft.azure.kusto.core.ingest.result.IngestionResult;
import com.microsoft.azure.kusto.core.ingest.result.IngestionStatus;
import com.microsoft.azure.kusto.core.ingest.result.IngestionStatusResult;
import com.microsoft.azure.kusto.core.ingest.result.OperationStatus;
import com.microsoft.azure.kusto.core.ingest.source.BlobSourceInfo;
import com.microsoft.azure.kusto.core.ingest.source.StreamSourceInfo;

import reactor.core.publisher.Mono;

public class QueuedIngestClientImpl implements QueuedIngestClient {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final IngestionResourceManager resourceManager;
    private final StorageClient storageClient;
    private final IngestionStatusQueues statusQueues;

    /**
     * @param dmClient a client of the ingestion (data management) endpoint of the cluster
     */
    public QueuedIngestClientImpl(Client dmClient) {
        this(new ResourceManager(dmClient), new AzureStorageClient());
    }

    public QueuedIngestClientImpl(IngestionResourceManager resourceManager, StorageClient storageClient) {
        log.info("Creating a new IngestClient");
        this.resourceManager = resourceManager;
        this.storageClient = storageClient;
        this.statusQueues = new IngestionStatusQueues(resourceManager, storageClient);
    }

    @Override
    public IngestionResourceManager getResourceManager() {
        return resourceManager;
    }

    @Override
    public IngestionStatusQueues getStatusQueues() {
        return statusQueues;
    }

    @Override
    public IngestionResult ingestFromBlob(BlobSourceInfo blobSourceInfo, IngestionProperties ingestionProperties)
            throws IngestionClientException, IngestionServiceException {
        return ingestFromBlobAsync(blobSourceInfo, ingestionProperties).block();
    }

    @Override
    public Mono<IngestionResult> ingestFromBlobAsync(BlobSourceInfo blobSourceInfo, IngestionProperties ingestionProperties) {
        return Mono.defer(() -> {
            Ensure.argIsNotNull(blobSourceInfo, "blobSourceInfo");
            Ensure.argIsNotNull(ingestionProperties, "ingestionProperties");
            blobSourceInfo.validate();
            ingestionProperties.validate();

            String urlWithoutSecrets = removeSecretsFromUrl(blobSourceInfo.getBlobPath());
            Long rawDataSize = blobSourceInfo.getRawSizeInBytes() > 0L ? blobSourceInfo.getRawSizeInBytes() : null;
            if (rawDataSize == null) {
                log.warn("Blob '{}' was sent for ingestion without specifying its raw data size", urlWithoutSecrets);
            }

            return Mono.fromCallable(resourceManager::getAuthorizationContext)
                    .map(authorizationContext -> new IngestionBlobInfo(blobSourceInfo.getBlobPath(), rawDataSize, ingestionProperties,
                            authorizationContext, blobSourceInfo.getSourceId()))
                    .flatMap(ingestionBlobInfo -> postToQueueWithRetriesAsync(ingestionBlobInfo)
                            .thenReturn(createQueuedResult(ingestionBlobInfo, urlWithoutSecrets)));
        });
    }

    @Override
    public IngestionResult ingestFromStream(StreamSourceInfo streamSourceInfo, IngestionProperties ingestionProperties)
            throws IngestionClientException, IngestionServiceException {
        return ingestFromStreamAsync(streamSourceInfo, ingestionProperties).block();
    }

    @Override
    public Mono<IngestionResult> ingestFromStreamAsync(StreamSourceInfo streamSourceInfo, IngestionProperties ingestionProperties) {
        return Mono.defer(() -> {
            Ensure.argIsNotNull(streamSourceInfo, "streamSourceInfo");
            Ensure.argIsNotNull(ingestionProperties, "ingestionProperties");
            streamSourceInfo.validate();
            ingestionProperties.validate();

            UUID sourceId = streamSourceInfo.getSourceId() != null ? streamSourceInfo.getSourceId() : UUID.randomUUID();
            String blobName = genBlobName(ingestionProperties, sourceId, streamSourceInfo.isGzipCompressed());

            // The content is read once so every upload attempt starts from its beginning
            return Mono.fromCallable(() -> streamSourceInfo.getStream().readAllBytes())
                    .onErrorMap(IOException.class, e -> new IngestionClientException("Failed to read the stream to ingest", e))
                    .flatMap(bytes -> {
                        if (bytes.length == 0) {
                            return Mono.error(new IngestionClientException("The provided stream is empty."));
                        }
                        long rawDataSize = streamSourceInfo.getRawSizeInBytes() > 0L ? streamSourceInfo.getRawSizeInBytes()
                                : (streamSourceInfo.isGzipCompressed() ? 0L : bytes.length);
                        return uploadToBlobWithRetriesAsync(bytes, blobName)
                                .flatMap(blobPath -> ingestFromBlobAsync(new BlobSourceInfo(blobPath, rawDataSize, sourceId), ingestionProperties));
                    })
                    .doFinally(signalType -> closeStream(streamSourceInfo));
        });
    }

    private Mono<Void> postToQueueWithRetriesAsync(IngestionBlobInfo ingestionBlobInfo) {
        return Mono.fromCallable(() -> new AbstractMap.SimpleImmutableEntry<>(ingestionBlobInfo.toQueueMessage(), resourceManager.getRankedShuffledQueues()))
                .flatMap(entry -> {
                    String message = entry.getKey();
                    List<ResourceURI> shuffledQueues = entry.getValue();
                    return ResourceAlgorithms.resourceActionWithRetriesAsync(resourceManager,
                            shuffledQueues,
                            queue -> storageClient.postMessageToQueue(queue, message),
                            "QueuedIngestClient.postToQueueWithRetriesAsync");
                });
    }

    private Mono<String> uploadToBlobWithRetriesAsync(byte[] bytes, String blobName) {
        return Mono.fromCallable(resourceManager::getRankedShuffledContainers)
                .flatMap(containers -> ResourceAlgorithms.resourceActionWithRetriesAsync(resourceManager,
                        containers,
                        container -> storageClient.uploadStreamToBlob(container, blobName, new ByteArrayInputStream(bytes))
                                .then(Mono.fromCallable(() -> container.toBlobUri(blobName))),
                        "QueuedIngestClient.uploadToBlobWithRetriesAsync"));
    }

    private static IngestionResult createQueuedResult(IngestionBlobInfo ingestionBlobInfo, String urlWithoutSecrets) {
        IngestionStatus status = new IngestionStatus();
        status.setDatabase(ingestionBlobInfo.getDatabaseName());
        status.setTable(ingestionBlobInfo.getTableName());
        status.setStatus(OperationStatus.Queued);
        status.setUpdatedOn(Instant.now());
        status.setIngestionSourceId(ingestionBlobInfo.getId());
        status.setIngestionSourcePath(urlWithoutSecrets);
        return new IngestionStatusResult(status);
    }

    static String genBlobName(IngestionProperties ingestionProperties, UUID sourceId, boolean gzipCompressed) {
        return String.format("%s__%s__%s.%s%s",
                ingestionProperties.getDatabaseName(),
                ingestionProperties.getTableName(),
                sourceId,
                ingestionProperties.getDataFormat().getKustoValue(),
                gzipCompressed ? ".gz" : "");
    }

    static String removeSecretsFromUrl(String url) {
        int queryStart = url.indexOf('?');
        return queryStart < 0 ? url : url.substring(0, queryStart);
    }

    private static void closeStream(StreamSourceInfo streamSourceInfo) {
        if (!streamSourceInfo.isLeaveOpen()) {
            try {
                streamSourceInfo.getStream().close();
            } catch (IOException e) {
                // the ingestion outcome is already decided at this point
                log.warn("Failed to close the stream after ingestion", e);
            }
        }
    }
}
