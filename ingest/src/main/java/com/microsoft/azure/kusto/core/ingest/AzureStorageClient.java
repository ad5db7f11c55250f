// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.util.List;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.azure.core.http.HttpClient;
import com.azure.core.util.BinaryData;
import com.azure.storage.blob.BlobAsyncClient;
import com.azure.storage.blob.BlobContainerAsyncClient;
import com.azure.storage.blob.BlobContainerClientBuilder;
import com.azure.storage.queue.QueueAsyncClient;
import com.azure.storage.queue.QueueClientBuilder;
import com.microsoft.azure.kusto.core.data.Ensure;
import com.microsoft.azure.kusto.core.ingest.resources.ResourceURI;

import reactor.core.publisher.Mono;

/**
 * {@link StorageClient} over the Azure storage SDKs. Clients are built per call from the SAS connection string of
 * the resource, as the resources and their tokens change on every refresh.
 */
public class AzureStorageClient implements StorageClient {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final HttpClient httpClient;

    public AzureStorageClient() {
        this(null);
    }

    /**
     * @param httpClient the transport for the storage clients, the SDK default when null
     */
    public AzureStorageClient(@Nullable HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Mono<Void> postMessageToQueue(ResourceURI queue, String message) {
        Ensure.argIsNotNull(queue, "queue");
        Ensure.stringIsNotBlank(message, "message");

        return Mono.fromCallable(() -> buildQueueClient(queue))
                .flatMap(queueAsyncClient -> {
                    log.debug("postMessageToQueue: queue: {}", queue);
                    return queueAsyncClient.sendMessage(message);
                })
                .then();
    }

    @Override
    public Mono<List<StorageQueueMessage>> peekMessages(ResourceURI queue, int maxMessages) {
        Ensure.argIsNotNull(queue, "queue");
        ensureMaxMessages(maxMessages);

        return Mono.fromCallable(() -> buildQueueClient(queue))
                .flatMapMany(queueAsyncClient -> {
                    log.debug("peekMessages: queue: {}, maxMessages: {}", queue, maxMessages);
                    return queueAsyncClient.peekMessages(maxMessages);
                })
                .map(item -> new StorageQueueMessage(item.getMessageId(), null, item.getBody().toString()))
                .collectList();
    }

    @Override
    public Mono<List<StorageQueueMessage>> receiveMessages(ResourceURI queue, int maxMessages) {
        Ensure.argIsNotNull(queue, "queue");
        ensureMaxMessages(maxMessages);

        return Mono.fromCallable(() -> buildQueueClient(queue))
                .flatMapMany(queueAsyncClient -> {
                    log.debug("receiveMessages: queue: {}, maxMessages: {}", queue, maxMessages);
                    return queueAsyncClient.receiveMessages(maxMessages);
                })
                .map(item -> new StorageQueueMessage(item.getMessageId(), item.getPopReceipt(), item.getBody().toString()))
                .collectList();
    }

    @Override
    public Mono<Void> deleteMessage(ResourceURI queue, String messageId, String popReceipt) {
        Ensure.argIsNotNull(queue, "queue");
        Ensure.stringIsNotBlank(messageId, "messageId");
        Ensure.stringIsNotBlank(popReceipt, "popReceipt");

        return Mono.fromCallable(() -> buildQueueClient(queue))
                .flatMap(queueAsyncClient -> queueAsyncClient.deleteMessage(messageId, popReceipt));
    }

    private static void ensureMaxMessages(int maxMessages) {
        Ensure.isTrue(maxMessages > 0 && maxMessages <= MAX_MESSAGES_PER_REQUEST,
                String.format("maxMessages must be between 1 and %d", MAX_MESSAGES_PER_REQUEST));
    }

    @Override
    public Mono<Long> uploadStreamToBlob(ResourceURI container, String blobName, InputStream stream) {
        Ensure.argIsNotNull(container, "container");
        Ensure.stringIsNotBlank(blobName, "blobName");
        Ensure.argIsNotNull(stream, "stream");

        return Mono.fromCallable(stream::readAllBytes)
                .flatMap(bytes -> {
                    log.debug("uploadStreamToBlob: blobName: {}, container: {}", blobName, container);
                    BlobAsyncClient blobAsyncClient = buildContainerClient(container).getBlobAsyncClient(blobName);
                    return blobAsyncClient.getBlockBlobAsyncClient()
                            .upload(BinaryData.fromBytes(bytes), true)
                            .thenReturn((long) bytes.length);
                });
    }

    private QueueAsyncClient buildQueueClient(ResourceURI queue) {
        QueueClientBuilder builder = new QueueClientBuilder()
                .connectionString(queue.toConnectionString())
                .queueName(queue.getObjectName());
        if (httpClient != null) {
            builder.httpClient(httpClient);
        }
        return builder.buildAsyncClient();
    }

    private BlobContainerAsyncClient buildContainerClient(ResourceURI container) {
        BlobContainerClientBuilder builder = new BlobContainerClientBuilder()
                .connectionString(container.toConnectionString())
                .containerName(container.getObjectName());
        if (httpClient != null) {
            builder.httpClient(httpClient);
        }
        return builder.buildAsyncClient();
    }
}
