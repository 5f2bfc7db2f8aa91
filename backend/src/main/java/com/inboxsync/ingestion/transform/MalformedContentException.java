package com.inboxsync.ingestion.transform;

import com.inboxsync.domain.ItemIdentity;

/**
 * Raw item content could not be turned into a row. The item is skipped for this run.
 */
public class MalformedContentException extends RuntimeException {

    private final transient ItemIdentity itemId;

    public MalformedContentException(ItemIdentity itemId, String message) {
        this(itemId, message, null);
    }

    public MalformedContentException(ItemIdentity itemId, String message, Throwable cause) {
        super("Malformed content for " + itemId + ": " + message, cause);
        this.itemId = itemId;
    }

    public ItemIdentity getItemId() {
        return itemId;
    }
}
