package com.inboxsync.ingestion.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxsync.common.RemoteCallException;
import com.inboxsync.domain.ItemIdentity;
import com.inboxsync.ingestion.adapter.GoogleApiExecutor;
import com.inboxsync.ingestion.config.GmailProperties;
import com.inboxsync.ingestion.filter.SubjectFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Gmail source: unread Inbox messages, full-format fetch, acknowledgment by removing the UNREAD label.
 * Subject include keywords are pushed into the search query; exclude keywords are left to the caller
 * because Gmail matches whole words, not substrings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GmailSourceAdapter implements SourceAdapter {

    static final String UNREAD_LABEL = "UNREAD";
    private static final int MAX_PAGE_SIZE = 500;
    private static final Pattern QUERY_SYNTAX = Pattern.compile("[()\"]");

    private final GmailClient gmailClient;
    private final GoogleApiExecutor googleApi;
    private final GmailProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public List<ItemIdentity> list(SubjectFilter filter) {
        String query = buildQuery(properties.getBaseQuery(), filter);
        log.debug("Listing Gmail messages with query: {}", query);
        int cap = properties.getMaxResults();
        List<ItemIdentity> ids = new ArrayList<>();
        String pageToken = null;
        do {
            Integer pageSize = cap > 0 ? Math.min(MAX_PAGE_SIZE, cap - ids.size()) : null;
            String token = pageToken;
            String json = googleApi.call("gmail.messages.list",
                    () -> gmailClient.listMessages(properties.getUserId(), query, token, pageSize));
            JsonNode root = parse(json, "messages.list");
            for (JsonNode m : root.path("messages")) {
                String id = m.path("id").asText(null);
                if (id != null && !id.isBlank()) {
                    ids.add(ItemIdentity.of(id));
                }
            }
            pageToken = root.path("nextPageToken").asText(null);
        } while (pageToken != null && !pageToken.isBlank() && (cap <= 0 || ids.size() < cap));
        return cap > 0 && ids.size() > cap ? List.copyOf(ids.subList(0, cap)) : ids;
    }

    @Override
    public RawItem fetch(ItemIdentity id) {
        String json = googleApi.call("gmail.messages.get " + id,
                () -> gmailClient.getMessage(properties.getUserId(), id.value()));
        if (json == null || json.isBlank()) {
            throw RemoteCallException.notFound("Gmail returned no content for message " + id);
        }
        return new RawItem(id, parse(json, "messages.get " + id));
    }

    @Override
    public void acknowledge(List<ItemIdentity> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        if (ids.size() > maxAcknowledgeBatch()) {
            throw new IllegalArgumentException("batchModify accepts at most " + maxAcknowledgeBatch() + " ids, got " + ids.size());
        }
        List<String> values = ids.stream().map(ItemIdentity::value).toList();
        googleApi.call("gmail.messages.batchModify",
                () -> gmailClient.removeLabels(properties.getUserId(), values, List.of(UNREAD_LABEL)));
    }

    @Override
    public int maxAcknowledgeBatch() {
        return GmailProperties.MAX_BATCH_MODIFY_IDS;
    }

    /**
     * Base query plus {@code subject:(a OR b)} when include keywords are configured.
     * Multi-word keywords are quoted.
     */
    static String buildQuery(String baseQuery, SubjectFilter filter) {
        if (filter == null || !filter.hasInclude()) {
            return baseQuery;
        }
        // quotes and parentheses would let a keyword escape the subject group
        String keywords = filter.include().stream()
                .map(k -> QUERY_SYNTAX.matcher(k).replaceAll("").strip())
                .filter(k -> !k.isEmpty())
                .map(k -> "\"" + k + "\"")
                .collect(Collectors.joining(" OR "));
        if (keywords.isEmpty()) {
            return baseQuery;
        }
        return baseQuery + " subject:(" + keywords + ")";
    }

    private JsonNode parse(String json, String what) {
        try {
            return objectMapper.readTree(json == null ? "{}" : json);
        } catch (JsonProcessingException e) {
            throw RemoteCallException.transientFailure("Unparseable Gmail response for " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
