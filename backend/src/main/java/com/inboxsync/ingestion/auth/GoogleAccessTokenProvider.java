package com.inboxsync.ingestion.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxsync.common.RemoteCallException;
import com.inboxsync.ingestion.adapter.GoogleApiErrors;
import com.inboxsync.ingestion.config.GoogleApiProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Bearer tokens for Gmail and Sheets: the configured static token, or an OAuth2 refresh-token grant.
 * Refreshed tokens are cached in accessTokenCache (TTL below Google's 60 min token lifetime).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GoogleAccessTokenProvider implements AccessTokenProvider {

    private final GoogleApiProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    @Override
    @Cacheable(cacheNames = "accessTokenCache", key = "'google'")
    public String accessToken() {
        String staticToken = properties.getAccessToken();
        if (staticToken != null && !staticToken.isBlank()) {
            return staticToken.strip();
        }
        if (isBlank(properties.getRefreshToken()) || isBlank(properties.getClientId()) || isBlank(properties.getClientSecret())) {
            throw RemoteCallException.permanent(
                    "No Google credentials: set inboxsync.google.access-token or client-id, client-secret and refresh-token");
        }
        log.debug("Refreshing Google OAuth access token");
        String json;
        try {
            json = webClientBuilder.build()
                    .post()
                    .uri(properties.getTokenUri())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData("grant_type", "refresh_token")
                            .with("client_id", properties.getClientId())
                            .with("client_secret", properties.getClientSecret())
                            .with("refresh_token", properties.getRefreshToken()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())))
                    .block();
        } catch (RuntimeException e) {
            throw GoogleApiErrors.translate("oauth token refresh", e);
        }
        String token = parseAccessToken(json);
        log.info("OAuth access token refreshed");
        return token;
    }

    String parseAccessToken(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "{}" : json);
        } catch (JsonProcessingException e) {
            throw RemoteCallException.transientFailure("Unparseable token response", e);
        }
        String token = root.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            throw RemoteCallException.permanent("Token response has no access_token: " + root.path("error").asText("unknown error"));
        }
        return token;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
