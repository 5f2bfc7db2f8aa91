package com.inboxsync.common;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with ±jitter around remote calls. Only {@link FailureKind#TRANSIENT}
 * failures are retried; everything else propagates on the first occurrence.
 * The policy does not know whether the wrapped call is safe to repeat; callers decide what to wrap.
 */
@Slf4j
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Runs the operation, retrying transient failures up to {@code maxAttempts} total attempts.
     * The last transient failure is rethrown once attempts are exhausted.
     */
    public <T> T execute(String operationName, RemoteOperation<T> operation) {
        for (int attempt = 0; ; attempt++) {
            try {
                return operation.call();
            } catch (RemoteCallException e) {
                if (!e.isRetryable() || attempt + 1 >= maxAttempts) {
                    throw e;
                }
                long delay = delayMs(attempt);
                log.warn("{} failed ({}): retrying in {} ms (attempt {}/{})",
                        operationName, e.getMessage(), delay, attempt + 1, maxAttempts);
                sleep(operationName, delay);
            }
        }
    }

    /** Void variant for calls with no result (appends, acknowledgments). */
    public void run(String operationName, Runnable operation) {
        execute(operationName, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: baseDelay * 2^attempt, then ±jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    private static void sleep(String operationName, long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RemoteCallException.transientFailure("Interrupted while backing off " + operationName, e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * Default: 500 ms base, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }
}
