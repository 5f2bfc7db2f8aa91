package com.inboxsync.common;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy noDelay = new RetryPolicy(0L, 0, 3);

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(0);
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(100L, 0, 5); // no jitter for deterministic test
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void defaultPolicy_hasExpectedSettings() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();
        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.getBaseDelayMs()).isEqualTo(500L);
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void execute_transientThenSuccess_returnsResult() {
        AtomicInteger calls = new AtomicInteger();
        String result = noDelay.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw RemoteCallException.transientFailure("HTTP 503", null);
            }
            return "ok";
        });
        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void execute_transientExhausted_rethrowsLastFailure() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> noDelay.execute("op", () -> {
            throw RemoteCallException.transientFailure("attempt " + calls.incrementAndGet(), null);
        }))
                .isInstanceOf(RemoteCallException.class)
                .hasMessage("attempt 3");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void execute_permanent_notRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> noDelay.execute("op", () -> {
            calls.incrementAndGet();
            throw RemoteCallException.permanent("HTTP 403");
        }))
                .isInstanceOfSatisfying(RemoteCallException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.PERMANENT));
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void execute_notFound_notRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> noDelay.execute("op", () -> {
            calls.incrementAndGet();
            throw RemoteCallException.notFound("gone");
        })).isInstanceOf(RemoteCallException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void execute_unclassifiedException_propagatesImmediately() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> noDelay.execute("op", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void execute_interruptedDuringBackoff_failsTransientAndKeepsFlag() {
        RetryPolicy slow = new RetryPolicy(10_000L, 0, 2);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> slow.execute("op", () -> {
                throw RemoteCallException.transientFailure("HTTP 429", null);
            }))
                    .isInstanceOfSatisfying(RemoteCallException.class, e -> assertThat(e.isRetryable()).isTrue())
                    .hasMessageContaining("Interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
