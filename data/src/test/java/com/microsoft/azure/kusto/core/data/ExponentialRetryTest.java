package com.microsoft.azure.kusto.core.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import com.microsoft.azure.kusto.core.data.exceptions.RetriesExhaustedException;

import reactor.test.StepVerifier;

class ExponentialRetryTest {
    @Test
    void shouldTryTurnsFalseAfterMaxRetriesBackoffs() throws InterruptedException {
        ExponentialRetry retry = new ExponentialRetry(3, 0, 0);

        for (int i = 0; i < 3; i++) {
            assertTrue(retry.shouldTry());
            retry.backoff();
        }

        assertFalse(retry.shouldTry());
        assertEquals(3, retry.getCurrentAttempt());
        RetriesExhaustedException e = assertThrows(RetriesExhaustedException.class, retry::backoff);
        assertEquals(3, e.getAttempts());
    }

    @Test
    void sleepDoublesWithEveryAttempt() throws InterruptedException {
        ExponentialRetry retry = new ExponentialRetry(4, 0.001, 0);

        assertEquals(1, retry.computeSleepMillis());
        retry.backoff();
        assertEquals(2, retry.computeSleepMillis());
        retry.backoff();
        assertEquals(4, retry.computeSleepMillis());
    }

    @Test
    void jitterStaysWithinBound() {
        ExponentialRetry retry = new ExponentialRetry(1, 1, 0.5, new Random(42));

        for (int i = 0; i < 100; i++) {
            long sleep = retry.computeSleepMillis();
            assertTrue(sleep >= 1000 && sleep <= 1500, "unexpected sleep " + sleep);
        }
    }

    @Test
    void zeroRetriesNeverTries() {
        ExponentialRetry retry = new ExponentialRetry(0, 0, 0);

        assertFalse(retry.shouldTry());
        assertThrows(RetriesExhaustedException.class, retry::backoff);
    }

    @Test
    void asyncBackoffCountsTheAttempt() {
        ExponentialRetry retry = new ExponentialRetry(1, 0, 0);

        StepVerifier.create(retry.backoffAsync()).verifyComplete();
        assertEquals(1, retry.getCurrentAttempt());
        StepVerifier.create(retry.backoffAsync()).expectError(RetriesExhaustedException.class).verify();
    }

    @Test
    void negativeConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExponentialRetry(-1));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialRetry(1, -1, 0));
    }
}
