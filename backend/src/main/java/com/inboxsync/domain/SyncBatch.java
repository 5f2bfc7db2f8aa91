package com.inboxsync.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Working set of one run: (identity, row) pairs in discovery order. Never persisted as a unit.
 */
public final class SyncBatch {

    public record Entry(ItemIdentity identity, RowRecord row) {
    }

    private final List<Entry> entries = new ArrayList<>();

    public void add(ItemIdentity identity, RowRecord row) {
        entries.add(new Entry(identity, row));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<RowRecord> rows() {
        return entries.stream().map(Entry::row).toList();
    }

    public List<ItemIdentity> identities() {
        return entries.stream().map(Entry::identity).toList();
    }
}
