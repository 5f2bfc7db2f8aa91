package com.inboxsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Google REST endpoints, OAuth credentials and client-side throttling.
 * Either {@code accessToken} or the refresh-token triple must be set.
 */
@ConfigurationProperties(prefix = "inboxsync.google")
@NoArgsConstructor
@Getter
@Setter
public class GoogleApiProperties {

    private String gmailBaseUrl = "https://gmail.googleapis.com/gmail/v1";

    private String sheetsBaseUrl = "https://sheets.googleapis.com/v4";

    private String tokenUri = "https://oauth2.googleapis.com/token";

    /** Pre-issued bearer token; when set, no refresh is attempted. */
    private String accessToken;

    private String clientId;

    private String clientSecret;

    private String refreshToken;

    /** Cache lifetime of a refreshed token. Google tokens live 60 minutes. */
    private long tokenTtlMinutes = 50;

    /** Client-side budget across Gmail and Sheets for this instance. */
    private int maxRequestsPerSecond = 10;

    /** How long the local limiter may wait for a permit before the call fails as transient. */
    private long localLimiterTimeoutMs = 5_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 250;

    /** Per-request timeout; a timeout counts as a transient failure. */
    private long requestTimeoutMs = 30_000;
}
