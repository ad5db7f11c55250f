package com.microsoft.azure.kusto.core.ingest.resources;

import com.microsoft.azure.kusto.core.data.Ensure;
import com.microsoft.azure.kusto.core.ingest.utils.TimeProvider;

/**
 * Success statistics of one storage account over a rolling time window. The window is a ring of
 * {@code numberOfBuckets} buckets, each covering {@code bucketDurationMillis}; results always land in the current
 * bucket and buckets are zeroed as the ring advances over them.
 */
public class RankedStorageAccount {
    static class StorageAccountStats {
        int successCount;
        int totalCount;

        void logResult(boolean success) {
            totalCount++;
            if (success) {
                successCount++;
            }
        }

        void reset() {
            successCount = 0;
            totalCount = 0;
        }
    }

    private final StorageAccountStats[] buckets;
    private final String accountName;
    private final int numberOfBuckets;
    private final long bucketDurationMillis;
    private final TimeProvider timeProvider;

    private int currentBucketIndex = 0;
    private long lastUpdateTime;

    public RankedStorageAccount(String accountName, int numberOfBuckets, long bucketDurationMillis, TimeProvider timeProvider) {
        Ensure.stringIsNotBlank(accountName, "accountName");
        Ensure.isTrue(numberOfBuckets > 0, "numberOfBuckets must be positive");
        Ensure.isTrue(bucketDurationMillis > 0, "bucketDurationMillis must be positive");
        Ensure.argIsNotNull(timeProvider, "timeProvider");
        this.accountName = accountName;
        this.numberOfBuckets = numberOfBuckets;
        this.bucketDurationMillis = bucketDurationMillis;
        this.timeProvider = timeProvider;
        this.buckets = new StorageAccountStats[numberOfBuckets];
        for (int i = 0; i < numberOfBuckets; i++) {
            buckets[i] = new StorageAccountStats();
        }
        this.lastUpdateTime = timeProvider.currentTimeMillis();
    }

    public synchronized void logResult(boolean success) {
        adjustForTimePassed();
        buckets[currentBucketIndex].logResult(success);
    }

    private void adjustForTimePassed() {
        long now = timeProvider.currentTimeMillis();
        long timeDelta = now - lastUpdateTime;
        if (timeDelta < bucketDurationMillis) {
            return;
        }

        // A long idle gap resets the whole ring once, not once per elapsed bucket
        int window = (int) Math.min(timeDelta / bucketDurationMillis, numberOfBuckets);
        for (int i = 1; i <= window; i++) {
            buckets[(currentBucketIndex + i) % numberOfBuckets].reset();
        }
        currentBucketIndex = (currentBucketIndex + window) % numberOfBuckets;
        lastUpdateTime = now;
    }

    /**
     * Weighted success rate over the window. The current bucket has weight {@code numberOfBuckets} and the oldest
     * weight 1; empty buckets are left out entirely.
     *
     * @return a rank in [0, 1], 1 when there is no data
     */
    public synchronized double getRank() {
        double rank = 0;
        int totalWeight = 0;

        for (int i = 1; i <= numberOfBuckets; i++) {
            StorageAccountStats bucket = buckets[(currentBucketIndex + i) % numberOfBuckets];
            if (bucket.totalCount == 0) {
                continue;
            }
            rank += ((double) bucket.successCount / bucket.totalCount) * i;
            totalWeight += i;
        }

        if (totalWeight == 0) {
            return 1;
        }
        return rank / totalWeight;
    }

    public String getAccountName() {
        return accountName;
    }

    int getCurrentBucketIndex() {
        return currentBucketIndex;
    }

    @Override
    public String toString() {
        return String.format("%s (rank %.2f)", accountName, getRank());
    }
}
