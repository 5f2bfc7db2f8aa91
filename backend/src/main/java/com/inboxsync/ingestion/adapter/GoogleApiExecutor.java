package com.inboxsync.ingestion.adapter;

import com.inboxsync.common.RemoteCallException;
import com.inboxsync.ingestion.config.GoogleApiProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Single gate for blocking Google API calls: local rate limiter, request timeout and error translation.
 * Retries are not done here; the orchestrator wraps adapter calls in its RetryPolicy.
 */
@Component
@Slf4j
public class GoogleApiExecutor {

    private final RateLimiter googleApiRateLimiter;
    private final GoogleApiProperties properties;

    public GoogleApiExecutor(@Qualifier("googleApiRateLimiter") RateLimiter googleApiRateLimiter,
                             GoogleApiProperties properties) {
        this.googleApiRateLimiter = googleApiRateLimiter;
        this.properties = properties;
    }

    public <T> T call(String description, Supplier<Mono<T>> request) {
        long acquireStart = System.nanoTime();
        boolean permitted = googleApiRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw RemoteCallException.transientFailure("Local limiter timeout before " + description, null);
        }
        if (waitedMs >= Math.max(1L, properties.getLocalLimiterLogThresholdMs())) {
            log.info("Local Google API limiter delayed {} ms before {}", waitedMs, description);
        }
        try {
            return request.get()
                    .timeout(Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())))
                    .block();
        } catch (RuntimeException e) {
            throw GoogleApiErrors.translate(description, e);
        }
    }
}
