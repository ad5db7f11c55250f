// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.azure.core.exception.AzureException;
import com.microsoft.azure.kusto.core.data.Client;
import com.microsoft.azure.kusto.core.data.Ensure;
import com.microsoft.azure.kusto.core.data.ExponentialRetry;
import com.microsoft.azure.kusto.core.data.KustoResponseDataSet;
import com.microsoft.azure.kusto.core.data.KustoResultRow;
import com.microsoft.azure.kusto.core.data.KustoResultTable;
import com.microsoft.azure.kusto.core.data.exceptions.DataClientException;
import com.microsoft.azure.kusto.core.data.exceptions.DataServiceException;
import com.microsoft.azure.kusto.core.data.exceptions.KustoServiceQueryError;
import com.microsoft.azure.kusto.core.data.exceptions.RetriesExhaustedException;
import com.microsoft.azure.kusto.core.data.exceptions.ThrottleException;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionServiceException;
import com.microsoft.azure.kusto.core.ingest.resources.RankedStorageAccountSet;
import com.microsoft.azure.kusto.core.ingest.resources.ResourceURI;
import com.microsoft.azure.kusto.core.ingest.utils.SystemTimeProvider;
import com.microsoft.azure.kusto.core.ingest.utils.TimeProvider;

/**
 * Caches the ingestion resources and the authorization context of a cluster.
 * <p>
 * Each cache slot is refreshed lazily, on the first access after it went stale, through a management command.
 * Throttled commands are retried with exponential backoff; any other failure is raised immediately. Concurrent
 * callers of a stale slot share a single refresh. If a refresh fails while a valid snapshot is cached, the stale
 * snapshot is served and the next refresh is attempted after {@code refreshOnFailureMillis}.
 */
public class ResourceManager implements IngestionResourceManager {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final int MAX_RETRY_ATTEMPTS = 4;
    public static final long REFRESH_INGESTION_RESOURCES_PERIOD = TimeUnit.HOURS.toMillis(1);
    public static final long REFRESH_INGESTION_RESOURCES_PERIOD_ON_FAILURE = TimeUnit.MINUTES.toMillis(1);
    private static final double BASE_INTERVAL_SECS = 1.0;
    private static final double MAX_JITTER_SECS = 1.0;

    private final Client client;
    private final long refreshPeriodMillis;
    private final long refreshOnFailureMillis;
    private final ExponentialRetry retryTemplate;
    private final RankedStorageAccountSet storageAccountSet;
    private final TimeProvider timeProvider;

    private final ReentrantLock ingestClientResourcesLock = new ReentrantLock();
    private final ReentrantLock authorizationContextLock = new ReentrantLock();

    private volatile IngestClientResources ingestClientResources;
    private volatile long ingestClientResourcesLastUpdate;
    private volatile String authorizationContext;
    private volatile long authorizationContextLastUpdate;

    public ResourceManager(Client client,
            long refreshPeriodMillis,
            long refreshOnFailureMillis,
            ExponentialRetry retryTemplate,
            RankedStorageAccountSet storageAccountSet,
            TimeProvider timeProvider) {
        Ensure.argIsNotNull(client, "client");
        Ensure.isTrue(refreshPeriodMillis > 0, "refreshPeriodMillis must be positive");
        Ensure.isTrue(refreshOnFailureMillis >= 0 && refreshOnFailureMillis <= refreshPeriodMillis,
                "refreshOnFailureMillis must be between 0 and refreshPeriodMillis");
        Ensure.argIsNotNull(retryTemplate, "retryTemplate");
        Ensure.argIsNotNull(storageAccountSet, "storageAccountSet");
        Ensure.argIsNotNull(timeProvider, "timeProvider");
        this.client = client;
        this.refreshPeriodMillis = refreshPeriodMillis;
        this.refreshOnFailureMillis = refreshOnFailureMillis;
        this.retryTemplate = retryTemplate;
        this.storageAccountSet = storageAccountSet;
        this.timeProvider = timeProvider;
    }

    public ResourceManager(Client client) {
        this(client,
                REFRESH_INGESTION_RESOURCES_PERIOD,
                REFRESH_INGESTION_RESOURCES_PERIOD_ON_FAILURE,
                new ExponentialRetry(MAX_RETRY_ATTEMPTS, BASE_INTERVAL_SECS, MAX_JITTER_SECS),
                new RankedStorageAccountSet(),
                new SystemTimeProvider());
    }

    public List<ResourceURI> getIngestionQueues() throws IngestionClientException, IngestionServiceException {
        return refreshIngestClientResources().getSecuredReadyForAggregationQueues();
    }

    @Override
    public List<ResourceURI> getFailedIngestionsQueues() throws IngestionClientException, IngestionServiceException {
        return refreshIngestClientResources().getFailedIngestionsQueues();
    }

    @Override
    public List<ResourceURI> getSuccessfulIngestionsQueues() throws IngestionClientException, IngestionServiceException {
        return refreshIngestClientResources().getSuccessfulIngestionsQueues();
    }

    public List<ResourceURI> getContainers() throws IngestionClientException, IngestionServiceException {
        return refreshIngestClientResources().getContainers();
    }

    public List<ResourceURI> getStatusTables() throws IngestionClientException, IngestionServiceException {
        return refreshIngestClientResources().getStatusTables();
    }

    @Override
    public List<ResourceURI> getRankedShuffledQueues() throws IngestionClientException, IngestionServiceException {
        List<ResourceURI> queues = getIngestionQueues();
        return ResourceAlgorithms.getShuffledResources(storageAccountSet.getRankedShuffledAccounts(), queues);
    }

    @Override
    public List<ResourceURI> getRankedShuffledContainers() throws IngestionClientException, IngestionServiceException {
        List<ResourceURI> containers = getContainers();
        return ResourceAlgorithms.getShuffledResources(storageAccountSet.getRankedShuffledAccounts(), containers);
    }

    @Override
    public String getAuthorizationContext() throws IngestionClientException, IngestionServiceException {
        return refreshAuthorizationContext();
    }

    @Override
    public void reportResourceUsageResult(ResourceURI resource, boolean success) {
        String accountName = resource.getStorageAccountName();
        if (!storageAccountSet.containsStorageAccount(accountName)) {
            log.warn("Ignoring result for storage account '{}' which is not part of the current ingestion resources", accountName);
            return;
        }
        storageAccountSet.logResultToAccount(accountName, success);
    }

    /**
     * Returns the cached ingestion resources, fetching them first when they were never fetched, are older than the
     * refresh period or are not {@link IngestClientResources#valid()}.
     */
    public IngestClientResources refreshIngestClientResources() throws IngestionClientException, IngestionServiceException {
        IngestClientResources current = ingestClientResources;
        if (!resourcesNeedRefresh(current)) {
            return current;
        }

        ingestClientResourcesLock.lock();
        try {
            // Another caller may have refreshed while this one waited for the lock
            current = ingestClientResources;
            if (!resourcesNeedRefresh(current)) {
                return current;
            }

            long now = timeProvider.currentTimeMillis();
            try {
                log.info("Refreshing Ingestion Resources");
                IngestClientResources fresh = fetchIngestClientResources();
                populateStorageAccounts(fresh);
                ingestClientResources = fresh;
                ingestClientResourcesLastUpdate = now;
                log.info("Refreshing Ingestion Resources Finished");
                return fresh;
            } catch (AzureException e) {
                if (current != null && current.valid()) {
                    log.warn("Error refreshing ingestion resources, serving the cached resources until the next attempt", e);
                    ingestClientResourcesLastUpdate = now - refreshPeriodMillis + refreshOnFailureMillis;
                    return current;
                }
                throw e;
            }
        } finally {
            ingestClientResourcesLock.unlock();
        }
    }

    /**
     * Returns the cached authorization context, fetching it first when it is missing or older than the refresh
     * period.
     */
    public String refreshAuthorizationContext() throws IngestionClientException, IngestionServiceException {
        String current = authorizationContext;
        if (!authorizationContextNeedsRefresh(current)) {
            return current;
        }

        authorizationContextLock.lock();
        try {
            current = authorizationContext;
            if (!authorizationContextNeedsRefresh(current)) {
                return current;
            }

            long now = timeProvider.currentTimeMillis();
            try {
                log.info("Refreshing Ingestion Auth Token");
                String fresh = fetchAuthorizationContext();
                authorizationContext = fresh;
                authorizationContextLastUpdate = now;
                log.info("Refreshing Ingestion Auth Token Finished");
                return fresh;
            } catch (AzureException e) {
                if (StringUtils.isNotBlank(current)) {
                    log.warn("Error refreshing the authorization context, serving the cached one until the next attempt", e);
                    authorizationContextLastUpdate = now - refreshPeriodMillis + refreshOnFailureMillis;
                    return current;
                }
                throw e;
            }
        } finally {
            authorizationContextLock.unlock();
        }
    }

    private boolean resourcesNeedRefresh(IngestClientResources resources) {
        return resources == null
                || !resources.valid()
                || ingestClientResourcesLastUpdate + refreshPeriodMillis <= timeProvider.currentTimeMillis();
    }

    private boolean authorizationContextNeedsRefresh(String context) {
        return StringUtils.isBlank(context)
                || authorizationContextLastUpdate + refreshPeriodMillis <= timeProvider.currentTimeMillis();
    }

    private IngestClientResources fetchIngestClientResources() throws IngestionClientException, IngestionServiceException {
        KustoResponseDataSet response = executeWithRetries(Commands.INGESTION_RESOURCES_SHOW_COMMAND, "IngestionResources");
        Map<ResourceType, List<ResourceURI>> resources = new EnumMap<>(ResourceType.class);

        KustoResultTable table = firstPrimaryResult(response);
        if (table != null) {
            for (KustoResultRow row : table.rows()) {
                String resourceTypeName = row.getString(Commands.RESOURCE_TYPE_NAME_COLUMN);
                ResourceType resourceType = ResourceType.findByResourceTypeName(resourceTypeName);
                if (resourceType == null) {
                    log.debug("Skipping ingestion resource of unknown type '{}'", resourceTypeName);
                    continue;
                }
                ResourceURI resource = ResourceURI.parse(row.getString(Commands.STORAGE_ROOT_COLUMN));
                resources.computeIfAbsent(resourceType, type -> new ArrayList<>()).add(resource);
            }
        }

        return IngestClientResources.fromResourceMap(resources);
    }

    private String fetchAuthorizationContext() throws IngestionClientException, IngestionServiceException {
        KustoResponseDataSet response = executeWithRetries(Commands.IDENTITY_GET_COMMAND, "IngestionAuthToken");

        KustoResultTable table = firstPrimaryResult(response);
        if (table == null || table.getRowsCount() == 0) {
            throw new IngestionServiceException(client.getClusterUrl(),
                    String.format("Error refreshing IngestionAuthToken. '%s' returned no rows", Commands.IDENTITY_GET_COMMAND), null);
        }

        String context = table.getRow(0).getString(Commands.AUTHORIZATION_CONTEXT_COLUMN);
        if (StringUtils.isBlank(context)) {
            throw new IngestionServiceException(client.getClusterUrl(),
                    String.format("Error refreshing IngestionAuthToken. '%s' returned an empty authorization context", Commands.IDENTITY_GET_COMMAND), null);
        }
        return context;
    }

    private static KustoResultTable firstPrimaryResult(KustoResponseDataSet response) {
        List<KustoResultTable> primaryResults = response.getPrimaryResults();
        return primaryResults.isEmpty() ? null : primaryResults.get(0);
    }

    /**
     * Runs a management command against the default database, retrying only when it is throttled.
     *
     * @throws RetriesExhaustedException if every attempt was throttled
     */
    private KustoResponseDataSet executeWithRetries(String command, String resourceName)
            throws IngestionClientException, IngestionServiceException {
        ExponentialRetry retry = new ExponentialRetry(retryTemplate);
        ThrottleException lastThrottle = null;

        while (retry.shouldTry()) {
            try {
                return client.executeMgmt(Commands.DEFAULT_DATABASE, command);
            } catch (ThrottleException e) {
                lastThrottle = e;
                log.warn("'{}' was throttled on attempt {} of {}", command, retry.getCurrentAttempt() + 1, retry.getMaxRetries());
                if (retry.getCurrentAttempt() + 1 >= retry.getMaxRetries()) {
                    break;
                }
                sleepBeforeRetry(retry, resourceName);
            } catch (DataServiceException e) {
                throw new IngestionServiceException(e.getIngestionSource(), String.format("Error refreshing %s. %s", resourceName, e.getMessage()), e);
            } catch (DataClientException e) {
                throw new IngestionClientException(e.getIngestionSource(), String.format("Error refreshing %s. %s", resourceName, e.getMessage()), e);
            } catch (KustoServiceQueryError e) {
                throw new IngestionServiceException(client.getClusterUrl(), String.format("Error refreshing %s. %s", resourceName, e.getMessage()), e);
            }
        }

        throw new RetriesExhaustedException(client.getClusterUrl(),
                String.format("Error refreshing %s. '%s' was throttled %d times", resourceName, command, retry.getMaxRetries()),
                lastThrottle,
                retry.getMaxRetries());
    }

    private static void sleepBeforeRetry(ExponentialRetry retry, String resourceName) throws IngestionClientException {
        try {
            retry.backoff();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionClientException(String.format("Interrupted while refreshing %s", resourceName), e);
        }
    }

    private void populateStorageAccounts(IngestClientResources resources) {
        Stream.concat(resources.getSecuredReadyForAggregationQueues().stream(), resources.getContainers().stream())
                .map(ResourceURI::getStorageAccountName)
                .distinct()
                .forEach(storageAccountSet::registerStorageAccount);
    }
}
