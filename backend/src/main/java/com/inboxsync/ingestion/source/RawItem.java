package com.inboxsync.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxsync.domain.ItemIdentity;

/**
 * Full content of one source item as returned by the source API, before transformation.
 */
public record RawItem(ItemIdentity id, JsonNode content) {
}
