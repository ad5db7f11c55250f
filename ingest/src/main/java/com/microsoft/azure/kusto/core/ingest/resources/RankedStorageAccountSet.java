package com.microsoft.azure.kusto.core.ingest.resources;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.azure.kusto.core.data.Ensure;
import com.microsoft.azure.kusto.core.ingest.utils.DefaultRandomProvider;
import com.microsoft.azure.kusto.core.ingest.utils.RandomProvider;
import com.microsoft.azure.kusto.core.ingest.utils.SystemTimeProvider;
import com.microsoft.azure.kusto.core.ingest.utils.TimeProvider;

public class RankedStorageAccountSet {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final int DEFAULT_NUMBER_OF_BUCKETS = 6;
    public static final long DEFAULT_BUCKET_DURATION_MILLIS = 10_000;
    private static final int[] DEFAULT_TIERS = new int[] {90, 70, 30, 0};

    private final Map<String, RankedStorageAccount> accounts = new ConcurrentHashMap<>();
    private final int numberOfBuckets;
    private final long bucketDurationMillis;
    private final int[] tiers;
    private final TimeProvider timeProvider;
    private final RandomProvider randomProvider;

    /**
     * @param tiers rank percentage thresholds in descending order; an account lands in the first tier it reaches
     */
    public RankedStorageAccountSet(int numberOfBuckets, long bucketDurationMillis, int[] tiers, TimeProvider timeProvider, RandomProvider randomProvider) {
        Ensure.isTrue(numberOfBuckets > 0, "numberOfBuckets must be positive");
        Ensure.isTrue(bucketDurationMillis > 0, "bucketDurationMillis must be positive");
        Ensure.argIsNotNull(tiers, "tiers");
        Ensure.isTrue(tiers.length > 0, "at least one tier is required");
        for (int i = 1; i < tiers.length; i++) {
            Ensure.isTrue(tiers[i - 1] > tiers[i], "tiers must be in descending order");
        }
        Ensure.argIsNotNull(timeProvider, "timeProvider");
        Ensure.argIsNotNull(randomProvider, "randomProvider");
        this.numberOfBuckets = numberOfBuckets;
        this.bucketDurationMillis = bucketDurationMillis;
        this.tiers = tiers.clone();
        this.timeProvider = timeProvider;
        this.randomProvider = randomProvider;
    }

    public RankedStorageAccountSet(TimeProvider timeProvider, RandomProvider randomProvider) {
        this(DEFAULT_NUMBER_OF_BUCKETS, DEFAULT_BUCKET_DURATION_MILLIS, DEFAULT_TIERS, timeProvider, randomProvider);
    }

    public RankedStorageAccountSet() {
        this(new SystemTimeProvider(), new DefaultRandomProvider());
    }

    /**
     * Registers an account. Registering a known account keeps its statistics.
     */
    public void registerStorageAccount(String accountName) {
        accounts.computeIfAbsent(accountName, name -> {
            log.debug("Registering storage account {}", name);
            return new RankedStorageAccount(name, numberOfBuckets, bucketDurationMillis, timeProvider);
        });
    }

    public void logResultToAccount(String accountName, boolean success) {
        getStorageAccount(accountName).logResult(success);
    }

    @NotNull
    public RankedStorageAccount getStorageAccount(String accountName) {
        RankedStorageAccount account = accounts.get(accountName);
        if (account == null) {
            throw new IllegalArgumentException("Account " + accountName + " does not exist");
        }
        return account;
    }

    public boolean containsStorageAccount(String accountName) {
        return accounts.containsKey(accountName);
    }

    public Set<String> getAccountNames() {
        return new TreeSet<>(accounts.keySet());
    }

    public int size() {
        return accounts.size();
    }

    /**
     * Orders every registered account by rank tier, best tier first. The order inside a tier is random.
     */
    @NotNull
    public List<RankedStorageAccount> getRankedShuffledAccounts() {
        List<List<RankedStorageAccount>> tiersList = new ArrayList<>();
        for (int i = 0; i < tiers.length; i++) {
            tiersList.add(new ArrayList<>());
        }

        for (RankedStorageAccount account : accounts.values()) {
            double rankPercentage = account.getRank() * 100.0;
            int tier = tiers.length - 1;
            for (int i = 0; i < tiers.length; i++) {
                if (rankPercentage >= tiers[i]) {
                    tier = i;
                    break;
                }
            }
            tiersList.get(tier).add(account);
        }

        for (List<RankedStorageAccount> tier : tiersList) {
            randomProvider.shuffle(tier);
        }

        // flatten tiers
        return tiersList.stream().flatMap(Collection::stream).collect(Collectors.toList());
    }
}
