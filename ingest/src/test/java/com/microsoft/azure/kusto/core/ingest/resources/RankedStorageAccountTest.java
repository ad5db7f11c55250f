package com.microsoft.azure.kusto.core.ingest.resources;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.microsoft.azure.kusto.core.ingest.MockTimeProvider;

class RankedStorageAccountTest {
    private static final int BUCKETS = 5;
    private static final long BUCKET_DURATION = 10_000;

    private final MockTimeProvider timeProvider = new MockTimeProvider(System.currentTimeMillis());

    private RankedStorageAccount newAccount() {
        return new RankedStorageAccount("testAccount", BUCKETS, BUCKET_DURATION, timeProvider);
    }

    @Test
    void testGetRankWithNoData() {
        // A new account is assumed to be healthy
        assertEquals(1.0, newAccount().getRank());
    }

    @Test
    void testGetRankWithAllSuccesses() {
        RankedStorageAccount account = newAccount();
        for (int i = 0; i < 10; i++) {
            account.logResult(true);
        }

        assertEquals(1.0, account.getRank(), 0.001);
    }

    @Test
    void testGetRankWithAllFailures() {
        RankedStorageAccount account = newAccount();
        for (int i = 0; i < 10; i++) {
            account.logResult(false);
        }

        assertEquals(0.0, account.getRank(), 0.001);
    }

    @Test
    void testSingleBucketIsPlainSuccessRatio() {
        RankedStorageAccount account = newAccount();
        for (int i = 0; i < 3; i++) {
            account.logResult(true);
        }
        account.logResult(false);
        timeProvider.advance(BUCKET_DURATION - 1);
        account.logResult(false);

        assertEquals(3.0 / 5.0, account.getRank(), 0.001);
    }

    @Test
    void testNewerBucketWeighsMore() {
        RankedStorageAccount account = newAccount();
        account.logResult(false);
        account.logResult(false);
        assertEquals(0.0, account.getRank(), 0.001);

        timeProvider.advance(11_000);
        account.logResult(true);

        // the failures sit in the bucket before the current one: weights 4 and 5
        assertEquals(5.0 / 9.0, account.getRank(), 0.001);
    }

    @Test
    void testSkippedBucketIsLeftOut() {
        RankedStorageAccount account = newAccount();
        account.logResult(false);
        account.logResult(false);

        timeProvider.advance(21_000);
        account.logResult(true);

        // the empty bucket in between takes no weight: weights 3 and 5
        assertEquals(5.0 / 8.0, account.getRank(), 0.001);
    }

    @Test
    void testWholeWindowPassedClearsAllBuckets() {
        RankedStorageAccount account = newAccount();
        account.logResult(false);
        account.logResult(false);

        timeProvider.advance(51_000);
        account.logResult(true);

        assertEquals(1.0, account.getRank(), 0.001);
    }

    @Test
    void testLongIdleGapWrapsTheRingOnce() {
        RankedStorageAccount account = newAccount();
        for (int i = 0; i < BUCKETS; i++) {
            account.logResult(false);
            timeProvider.advance(BUCKET_DURATION);
        }
        int indexBeforeGap = account.getCurrentBucketIndex();

        timeProvider.advance(1_000 * BUCKET_DURATION);
        account.logResult(true);

        assertEquals(1.0, account.getRank(), 0.001);
        assertEquals(indexBeforeGap, account.getCurrentBucketIndex());
    }

    @Test
    void testGetRankDoesNotAdvanceTheWindow() {
        RankedStorageAccount account = newAccount();
        account.logResult(false);

        timeProvider.advance(100 * BUCKET_DURATION);

        assertEquals(0.0, account.getRank(), 0.001);
    }

    @Test
    void testRejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new RankedStorageAccount("a", 0, BUCKET_DURATION, timeProvider));
        assertThrows(IllegalArgumentException.class, () -> new RankedStorageAccount("a", BUCKETS, 0, timeProvider));
        assertThrows(IllegalArgumentException.class, () -> new RankedStorageAccount(" ", BUCKETS, BUCKET_DURATION, timeProvider));
    }
}
