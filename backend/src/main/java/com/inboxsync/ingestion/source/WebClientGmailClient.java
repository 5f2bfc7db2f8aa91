package com.inboxsync.ingestion.source;

import com.inboxsync.ingestion.auth.AccessTokenProvider;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gmail REST client using WebClient. Used by GmailSourceAdapter.
 */
public class WebClientGmailClient implements GmailClient {

    private final WebClient webClient;
    private final AccessTokenProvider tokenProvider;

    public WebClientGmailClient(WebClient.Builder builder, String baseUrl, AccessTokenProvider tokenProvider) {
        this.webClient = builder.baseUrl(baseUrl).build();
        this.tokenProvider = tokenProvider;
    }

    @Override
    public reactor.core.publisher.Mono<String> listMessages(String userId, String query, String pageToken, Integer maxResults) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("userId", userId);
        vars.put("q", query);
        vars.put("pageToken", pageToken);
        vars.put("maxResults", maxResults);
        return webClient.get()
                .uri(b -> {
                    b.path("/users/{userId}/messages").queryParam("q", "{q}");
                    if (pageToken != null) {
                        b.queryParam("pageToken", "{pageToken}");
                    }
                    if (maxResults != null) {
                        b.queryParam("maxResults", "{maxResults}");
                    }
                    return b.build(vars);
                })
                .headers(h -> h.setBearerAuth(tokenProvider.accessToken()))
                .retrieve()
                .bodyToMono(String.class);
    }

    @Override
    public reactor.core.publisher.Mono<String> getMessage(String userId, String messageId) {
        return webClient.get()
                .uri("/users/{userId}/messages/{id}?format=full", userId, messageId)
                .headers(h -> h.setBearerAuth(tokenProvider.accessToken()))
                .retrieve()
                .bodyToMono(String.class);
    }

    @Override
    public reactor.core.publisher.Mono<Void> removeLabels(String userId, List<String> messageIds, List<String> labelIds) {
        Map<String, Object> body = Map.of(
                "ids", messageIds,
                "removeLabelIds", labelIds
        );
        return webClient.post()
                .uri("/users/{userId}/messages/batchModify", userId)
                .headers(h -> h.setBearerAuth(tokenProvider.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(Void.class);
    }
}
