package com.inboxsync.ingestion.store;

import com.inboxsync.domain.ItemIdentity;

import java.util.List;

/**
 * Durable, append-only record of identities whose rows are already in the sink.
 */
public interface IdentityStore {

    /**
     * All persisted identities, in stored order. Empty on first run.
     */
    List<ItemIdentity> readIdentities();

    /**
     * Append identities in the given order. Returns only after the write is durable.
     */
    void appendIdentities(List<ItemIdentity> identities);
}
