package com.inboxsync.ingestion.store;

import com.inboxsync.common.RetryPolicy;
import com.inboxsync.domain.ItemIdentity;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dedupe oracle for one run: identities loaded once from the {@link IdentityStore}, then only appended to.
 * An identity enters the in-memory set only after the store confirmed its append, so membership here
 * always implies the identity is durable.
 */
@Slf4j
public final class IdentitySet {

    private final IdentityStore store;
    private final RetryPolicy retryPolicy;
    private final Set<ItemIdentity> known;

    private IdentitySet(IdentityStore store, RetryPolicy retryPolicy, Set<ItemIdentity> known) {
        this.store = store;
        this.retryPolicy = retryPolicy;
        this.known = known;
    }

    /**
     * Reads every persisted identity. Any failure (after transient retries) becomes {@link StoreUnavailableException}.
     */
    public static IdentitySet load(IdentityStore store, RetryPolicy retryPolicy) {
        List<ItemIdentity> persisted;
        try {
            persisted = retryPolicy.execute("identities.read", store::readIdentities);
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Cannot read synchronized identities: " + e.getMessage(), e);
        }
        Set<ItemIdentity> known = new HashSet<>(persisted == null ? List.of() : persisted);
        log.debug("Identity set loaded: {} stored, {} distinct", persisted == null ? 0 : persisted.size(), known.size());
        return new IdentitySet(store, retryPolicy, known);
    }

    public boolean contains(ItemIdentity id) {
        return known.contains(id);
    }

    /**
     * Appends the identities to the store in order, as one call. On failure nothing is added to this set.
     */
    public void record(List<ItemIdentity> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        List<ItemIdentity> batch = List.copyOf(ids);
        try {
            retryPolicy.run("identities.append", () -> store.appendIdentities(batch));
        } catch (RuntimeException e) {
            throw new StoreWriteFailedException("Identity append of " + batch.size() + " id(s) failed: " + e.getMessage(), e);
        }
        known.addAll(batch);
    }

    public int size() {
        return known.size();
    }
}
