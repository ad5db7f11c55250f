package com.microsoft.azure.kusto.core.ingest;

import java.io.InputStream;
import java.util.List;

import com.microsoft.azure.kusto.core.ingest.resources.ResourceURI;

import reactor.core.publisher.Mono;

/**
 * The storage operations of the queued ingestion.
 */
public interface StorageClient {
    /**
     * The most messages a single peek or receive call can return.
     */
    int MAX_MESSAGES_PER_REQUEST = 32;

    /**
     * Posts a message to an ingestion queue.
     *
     * @param queue   the queue, with its SAS token
     * @param message the message content, already encoded the way the queue readers expect it
     */
    Mono<Void> postMessageToQueue(ResourceURI queue, String message);

    /**
     * Reads up to {@code maxMessages} messages from the front of a queue without changing their visibility.
     */
    Mono<List<StorageQueueMessage>> peekMessages(ResourceURI queue, int maxMessages);

    /**
     * Dequeues up to {@code maxMessages} messages. They stay hidden from other readers until their visibility
     * timeout expires, unless deleted with {@link #deleteMessage} first.
     */
    Mono<List<StorageQueueMessage>> receiveMessages(ResourceURI queue, int maxMessages);

    Mono<Void> deleteMessage(ResourceURI queue, String messageId, String popReceipt);

    /**
     * Uploads the remaining content of {@code stream} to a block blob, overwriting any existing blob.
     *
     * @return the number of bytes uploaded
     */
    Mono<Long> uploadStreamToBlob(ResourceURI container, String blobName, InputStream stream);
}
