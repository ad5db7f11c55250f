package com.microsoft.azure.kusto.core.ingest;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.core.ingest.resources.RankedStorageAccount;
import com.microsoft.azure.kusto.core.ingest.resources.ResourceURI;

import reactor.core.publisher.Mono;

public class ResourceAlgorithms {
    static final int RETRY_COUNT = 3;
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private ResourceAlgorithms() {
    }

    /**
     * Runs {@code action} against the given resources in order, one resource per attempt, until it succeeds or
     * {@link #RETRY_COUNT} attempts failed. Each outcome is reported to the resource manager so the ranking of the
     * storage account follows it.
     */
    public static <T> Mono<T> resourceActionWithRetriesAsync(
            IngestionResourceManager resourceManager,
            List<ResourceURI> resources,
            Function<ResourceURI, Mono<T>> action,
            String actionName) {

        if (resources == null || resources.isEmpty()) {
            return Mono.error(new IngestionClientException(String.format("%s: No resources were provided.", actionName)));
        }

        return attemptAction(1, resources, resourceManager, action, actionName, null, new ArrayList<>());
    }

    private static <T> Mono<T> attemptAction(
            int attempt,
            List<ResourceURI> resources,
            IngestionResourceManager resourceManager,
            Function<ResourceURI, Mono<T>> action,
            String actionName,
            Throwable lastError,
            List<ResourceURI> usedResources) {

        if (attempt > RETRY_COUNT) {
            String errorMessage = String.format("%s: All %d retries failed with last error: %s\n. Used resources: %s",
                    actionName,
                    RETRY_COUNT,
                    lastError != null ? lastError.getMessage() : "",
                    usedResources.stream()
                            .map(r -> String.format("%s (%s)", r, r.getStorageAccountName()))
                            .collect(Collectors.joining(", ")));
            return Mono.error(new IngestionClientException(errorMessage, lastError));
        }

        ResourceURI resource = resources.get((attempt - 1) % resources.size());
        usedResources.add(resource);

        log.info("Attempt {} of {} for {}.", attempt, RETRY_COUNT, actionName);
        return Mono.defer(() -> action.apply(resource))
                .doOnSuccess(ignored -> resourceManager.reportResourceUsageResult(resource, true))
                .onErrorResume(e -> {
                    log.warn(String.format("Error during attempt %d of %d for %s.", attempt, RETRY_COUNT, actionName), e);
                    resourceManager.reportResourceUsageResult(resource, false);
                    return attemptAction(attempt + 1, resources, resourceManager, action, actionName, e, usedResources);
                });
    }

    /**
     * Blocking form of {@link #resourceActionWithRetriesAsync}.
     */
    public static <T> T resourceActionWithRetries(
            IngestionResourceManager resourceManager,
            List<ResourceURI> resources,
            Function<ResourceURI, Mono<T>> action,
            String actionName) throws IngestionClientException {
        return resourceActionWithRetriesAsync(resourceManager, resources, action, actionName).block();
    }

    @NotNull
    public static <T> List<T> roundRobinNestedList(@NotNull List<List<T>> validResources) {
        int longestResourceList = validResources.stream().mapToInt(List::size).max().orElse(0);

        // Take the first element of every list, then the second element of every list, and so on
        return IntStream.range(0, longestResourceList).boxed()
                .flatMap(i -> validResources.stream().map(r -> r.size() > i ? r.get(i) : null)
                        .filter(Objects::nonNull))
                .collect(Collectors.toList());
    }

    /**
     * Interleaves the resources of the ranked accounts: the first resource of every account in rank order, then the
     * second one, and so on. Resources of accounts that are not in {@code shuffledAccounts} are left out.
     */
    public static List<ResourceURI> getShuffledResources(List<RankedStorageAccount> shuffledAccounts, List<ResourceURI> resourceOfType) {
        Map<String, List<ResourceURI>> accountToResourcesMap = groupResourceByAccountName(resourceOfType);

        List<List<ResourceURI>> validResources = shuffledAccounts.stream()
                .map(account -> accountToResourcesMap.get(account.getAccountName()))
                .filter(resourceList -> resourceList != null && !resourceList.isEmpty())
                .collect(Collectors.toList());

        return roundRobinNestedList(validResources);
    }

    private static Map<String, List<ResourceURI>> groupResourceByAccountName(List<ResourceURI> resourceSet) {
        if (resourceSet == null || resourceSet.isEmpty()) {
            return Collections.emptyMap();
        }
        return resourceSet.stream().collect(Collectors.groupingBy(ResourceURI::getStorageAccountName, Collectors.toList()));
    }
}
