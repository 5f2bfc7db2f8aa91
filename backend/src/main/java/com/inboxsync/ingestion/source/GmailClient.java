package com.inboxsync.ingestion.source;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Gmail REST v1 client abstraction for testing. One HTTP request per method; no retries.
 */
public interface GmailClient {

    /**
     * users.messages.list. Returns the raw JSON page ({@code messages[].id}, {@code nextPageToken}).
     *
     * @param pageToken  null for the first page
     * @param maxResults page size, null for the server default
     */
    Mono<String> listMessages(String userId, String query, String pageToken, Integer maxResults);

    /**
     * users.messages.get with format=full. Returns the raw message JSON.
     */
    Mono<String> getMessage(String userId, String messageId);

    /**
     * users.messages.batchModify removing the given labels.
     */
    Mono<Void> removeLabels(String userId, List<String> messageIds, List<String> labelIds);
}
