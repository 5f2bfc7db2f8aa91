package com.inboxsync.ingestion.sink;

import com.inboxsync.domain.RowRecord;
import com.inboxsync.ingestion.store.IdentityStore;

import java.util.List;

/**
 * Durable destination: append-only, order-preserving rows plus the identity ledger behind the IdentitySet.
 * Every append returns only after the write is durable.
 */
public interface SinkAdapter extends IdentityStore {

    void appendRows(List<RowRecord> rows);
}
