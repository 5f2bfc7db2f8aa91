package com.inboxsync.domain;

/**
 * Opaque, source-assigned key of one mailbox item (Gmail message id). Sole deduplication key.
 */
public record ItemIdentity(String value) {

    public ItemIdentity {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ItemIdentity value must not be blank");
        }
        value = value.strip();
    }

    public static ItemIdentity of(String value) {
        return new ItemIdentity(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
