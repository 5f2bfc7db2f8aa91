package com.inboxsync.ingestion.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy for Gmail and Sheets calls (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "inboxsync.retry")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. Default 500. */
    @Min(0)
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.2;

    /** Total attempts per call, including the first one. Default 3. */
    @Min(1)
    private int maxAttempts = 3;
}
