// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.azure.kusto.core.data.Ensure;
import com.microsoft.azure.kusto.core.data.Utils;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.core.ingest.resources.ResourceURI;
import com.microsoft.azure.kusto.core.ingest.result.IngestionStatusMessage;
import com.microsoft.azure.kusto.core.ingest.utils.RandomProvider;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reads the ingestion notifications of one kind (successes or failures) from all the status queues of a cluster.
 * <p>
 * A read spreads over the queues in random order: each queue is first asked for an equal share of the requested
 * messages, then the queues that were not drained make up for the ones that were.
 *
 * @param <T> the notification type the queue messages are read as
 */
public class IngestionStatusQueue<T extends IngestionStatusMessage> {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Supplier<List<ResourceURI>> queuesSupplier;
    private final StorageClient storageClient;
    private final Class<T> messageClass;
    private final RandomProvider randomProvider;

    /**
     * @param queuesSupplier returns the current status queues, called once per read
     */
    public IngestionStatusQueue(Supplier<List<ResourceURI>> queuesSupplier, StorageClient storageClient, Class<T> messageClass,
            RandomProvider randomProvider) {
        Ensure.argIsNotNull(queuesSupplier, "queuesSupplier");
        Ensure.argIsNotNull(storageClient, "storageClient");
        Ensure.argIsNotNull(messageClass, "messageClass");
        Ensure.argIsNotNull(randomProvider, "randomProvider");
        this.queuesSupplier = queuesSupplier;
        this.storageClient = storageClient;
        this.messageClass = messageClass;
        this.randomProvider = randomProvider;
    }

    /**
     * Returns up to {@code maxMessages} notifications, leaving them in their queues.
     */
    public List<T> peek(int maxMessages) {
        return peekAsync(maxMessages).block();
    }

    public Mono<List<T>> peekAsync(int maxMessages) {
        return readAsync(maxMessages, false);
    }

    /**
     * Returns up to {@code maxMessages} notifications and deletes them from their queues.
     */
    public List<T> pop(int maxMessages) {
        return popAsync(maxMessages).block();
    }

    public Mono<List<T>> popAsync(int maxMessages) {
        return readAsync(maxMessages, true);
    }

    public boolean isEmpty() {
        return Boolean.TRUE.equals(isEmptyAsync().block());
    }

    public Mono<Boolean> isEmptyAsync() {
        return Mono.fromCallable(this::shuffledQueues)
                .flatMapMany(Flux::fromIterable)
                .concatMap(queue -> storageClient.peekMessages(queue, 1))
                .any(messages -> !messages.isEmpty())
                .map(found -> !found);
    }

    private Mono<List<T>> readAsync(int maxMessages, boolean remove) {
        return Mono.<List<T>>defer(() -> {
            Ensure.isTrue(maxMessages > 0, "maxMessages must be positive");
            List<ResourceURI> queues = shuffledQueues();
            if (queues.isEmpty()) {
                log.warn("No status queues to read {} from", messageClass.getSimpleName());
                List<T> none = new ArrayList<>();
                return Mono.just(none);
            }

            ReadState state = new ReadState(maxMessages);
            int share = Math.max(1, maxMessages / queues.size());
            return readPass(queues, share, state, remove)
                    .then(Mono.defer(() -> readPass(state.notDrained(queues), maxMessages, state, remove)))
                    .then(Mono.fromCallable(() -> state.results));
        });
    }

    private Mono<Void> readPass(List<ResourceURI> queues, int perQueue, ReadState state, boolean remove) {
        return Flux.fromIterable(queues)
                .concatMap(queue -> Mono.defer(() -> {
                    int wanted = Math.min(perQueue, state.remaining());
                    return wanted > 0 ? readQueue(queue, wanted, state, remove) : Mono.<Void>empty();
                }))
                .then();
    }

    private Mono<Void> readQueue(ResourceURI queue, int wanted, ReadState state, boolean remove) {
        // a peek sees the messages taken in the previous pass again, so they are requested and skipped
        int skip = remove ? 0 : state.takenFrom(queue);
        int requested = Math.min(StorageClient.MAX_MESSAGES_PER_REQUEST, skip + wanted);
        if (requested <= skip) {
            state.drained.add(queue);
            return Mono.empty();
        }

        Mono<List<StorageQueueMessage>> messages = remove ? storageClient.receiveMessages(queue, requested)
                : storageClient.peekMessages(queue, requested);
        return messages.flatMap(received -> {
            if (received.size() < requested) {
                state.drained.add(queue);
            }
            List<StorageQueueMessage> fresh = received.subList(Math.min(skip, received.size()), received.size());
            for (StorageQueueMessage message : fresh) {
                state.add(queue, parse(queue, message));
            }
            if (!remove) {
                return Mono.<Void>empty();
            }
            return Flux.fromIterable(fresh)
                    .concatMap(message -> storageClient.deleteMessage(queue, message.getMessageId(), message.getPopReceipt()))
                    .then();
        });
    }

    private T parse(ResourceURI queue, StorageQueueMessage message) {
        try {
            String json = new String(Base64.decodeBase64(message.getMessageText()), StandardCharsets.UTF_8);
            return Utils.getObjectMapper().readValue(json, messageClass);
        } catch (IOException e) {
            throw new IngestionServiceException(String.format("Failed to read message '%s' of queue '%s' as %s",
                    message.getMessageId(), queue, messageClass.getSimpleName()), e);
        }
    }

    private List<ResourceURI> shuffledQueues() {
        List<ResourceURI> queues = new ArrayList<>(queuesSupplier.get());
        randomProvider.shuffle(queues);
        return queues;
    }

    private class ReadState {
        private final int maxMessages;
        private final List<T> results = new ArrayList<>();
        private final Map<ResourceURI, Integer> taken = new HashMap<>();
        private final Set<ResourceURI> drained = new LinkedHashSet<>();

        ReadState(int maxMessages) {
            this.maxMessages = maxMessages;
        }

        int remaining() {
            return maxMessages - results.size();
        }

        int takenFrom(ResourceURI queue) {
            return taken.getOrDefault(queue, 0);
        }

        void add(ResourceURI queue, T message) {
            results.add(message);
            taken.merge(queue, 1, Integer::sum);
        }

        List<ResourceURI> notDrained(List<ResourceURI> queues) {
            List<ResourceURI> open = new ArrayList<>();
            for (ResourceURI queue : queues) {
                if (!drained.contains(queue)) {
                    open.add(queue);
                }
            }
            return open;
        }
    }
}
