package com.inboxsync.ingestion.auth;

/**
 * Supplies OAuth bearer tokens for Google API calls.
 */
public interface AccessTokenProvider {

    String accessToken();
}
