package com.inboxsync.domain;

/**
 * Terminal classification of one sync run.
 */
public enum SyncOutcome {
    /** Every new candidate was persisted and acknowledged (also when there was nothing new). */
    FULLY_SYNCED,
    /** Batch persisted, but some items were skipped or could not be acknowledged. */
    PARTIALLY_SYNCED,
    /** Row or identity append failed; nothing was acknowledged. */
    PERSIST_FAILED,
    /** Stopped before any write to the sink (identity load, listing, or a permanent fetch error). */
    ABORTED
}
