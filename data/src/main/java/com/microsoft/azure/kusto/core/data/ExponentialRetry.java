package com.microsoft.azure.kusto.core.data;

import java.lang.invoke.MethodHandles;
import java.time.Duration;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.azure.kusto.core.data.exceptions.RetriesExhaustedException;

import reactor.core.publisher.Mono;

/**
 * Attempt counter with exponential backoff and jitter. The n-th backoff (zero based) waits
 * {@code sleepBaseSecs * 2^n + U(0, maxJitterSecs)} seconds; after {@code maxRetries} backoffs {@link #shouldTry()}
 * is false and any further backoff fails.
 * <p>
 * Instances are stateful and meant for a single retry loop.
 */
public class ExponentialRetry {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final int maxRetries;
    private final double sleepBaseSecs;
    private final double maxJitterSecs;
    private final Random random;
    private int currentAttempt = 0;

    public ExponentialRetry(int maxRetries) {
        this(maxRetries, 1.0, 1.0);
    }

    public ExponentialRetry(int maxRetries, double sleepBaseSecs, double maxJitterSecs) {
        this(maxRetries, sleepBaseSecs, maxJitterSecs, new Random());
    }

    public ExponentialRetry(int maxRetries, double sleepBaseSecs, double maxJitterSecs, Random random) {
        Ensure.isTrue(maxRetries >= 0, "maxRetries must not be negative");
        Ensure.isTrue(sleepBaseSecs >= 0 && maxJitterSecs >= 0, "sleep base and jitter must not be negative");
        Ensure.argIsNotNull(random, "random");
        this.maxRetries = maxRetries;
        this.sleepBaseSecs = sleepBaseSecs;
        this.maxJitterSecs = maxJitterSecs;
        this.random = random;
    }

    public ExponentialRetry(ExponentialRetry other) {
        this(other.maxRetries, other.sleepBaseSecs, other.maxJitterSecs, other.random);
    }

    public boolean shouldTry() {
        return currentAttempt < maxRetries;
    }

    public int getCurrentAttempt() {
        return currentAttempt;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * @return the wait before the next attempt, in milliseconds
     */
    public long computeSleepMillis() {
        double base = sleepBaseSecs * Math.pow(2, currentAttempt);
        double jitter = maxJitterSecs * random.nextDouble();
        return Math.round((base + jitter) * 1000);
    }

    /**
     * Sleeps for the current backoff and moves to the next attempt.
     *
     * @throws RetriesExhaustedException if all attempts were used
     * @throws InterruptedException if the sleeping thread is interrupted
     */
    public void backoff() throws RetriesExhaustedException, InterruptedException {
        ensureNotExhausted();
        long sleepMillis = computeSleepMillis();
        log.info("Attempt {} of {} failed, backing off for {} ms", currentAttempt + 1, maxRetries, sleepMillis);
        if (sleepMillis > 0) {
            Thread.sleep(sleepMillis);
        }
        currentAttempt++;
    }

    /**
     * Non-blocking form of {@link #backoff()}: completes after the backoff delay and then counts the attempt.
     */
    public Mono<Void> backoffAsync() {
        return Mono.defer(() -> {
            ensureNotExhausted();
            long sleepMillis = computeSleepMillis();
            log.info("Attempt {} of {} failed, backing off for {} ms", currentAttempt + 1, maxRetries, sleepMillis);
            return Mono.delay(Duration.ofMillis(sleepMillis))
                    .doOnNext(ignored -> currentAttempt++)
                    .then();
        });
    }

    private void ensureNotExhausted() {
        if (!shouldTry()) {
            throw new RetriesExhaustedException(String.format("Max retries exceeded (%d attempts)", maxRetries), currentAttempt);
        }
    }
}
