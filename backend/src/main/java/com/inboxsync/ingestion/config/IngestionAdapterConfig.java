package com.inboxsync.ingestion.config;

import com.inboxsync.common.RetryPolicy;
import com.inboxsync.ingestion.auth.AccessTokenProvider;
import com.inboxsync.ingestion.sink.SheetsClient;
import com.inboxsync.ingestion.sink.WebClientSheetsClient;
import com.inboxsync.ingestion.source.GmailClient;
import com.inboxsync.ingestion.source.WebClientGmailClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Gmail and Sheets clients, the shared retry policy and the Google API rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ IngestionRetryProperties.class, SheetsProperties.class, GmailProperties.class,
        SubjectFilterProperties.class, GoogleApiProperties.class, SyncJobProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy retryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                Math.max(1, retryProperties.getMaxAttempts()));
    }

    @Bean(name = "googleApiRateLimiter")
    public RateLimiter googleApiRateLimiter(GoogleApiProperties googleApiProperties) {
        int rps = Math.max(1, googleApiProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, googleApiProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("google-api", config);
    }

    @Bean
    public GmailClient gmailClient(WebClient.Builder webClientBuilder, GoogleApiProperties googleApiProperties,
                                   AccessTokenProvider accessTokenProvider) {
        return new WebClientGmailClient(webClientBuilder.clone(), googleApiProperties.getGmailBaseUrl(), accessTokenProvider);
    }

    @Bean
    public SheetsClient sheetsClient(WebClient.Builder webClientBuilder, GoogleApiProperties googleApiProperties,
                                     AccessTokenProvider accessTokenProvider) {
        return new WebClientSheetsClient(webClientBuilder.clone(), googleApiProperties.getSheetsBaseUrl(), accessTokenProvider);
    }
}
