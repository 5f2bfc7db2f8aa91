package com.inboxsync.ingestion.job;

import com.inboxsync.domain.SyncOutcome;

/**
 * Terminal summary of one run. Every run produces one, whatever its outcome.
 *
 * @param discovered        distinct candidates listed by the source
 * @param skippedDuplicate  candidates already recorded in the identity set (never fetched)
 * @param filteredOut       fetched items whose subject failed the local filter (left untouched)
 * @param fetched           items whose content was fetched
 * @param persisted         rows appended and identities recorded
 * @param acknowledged      items acknowledged at the source
 * @param acknowledgeFailed recorded items whose acknowledgment failed
 * @param errored           items skipped because fetch or transform failed
 */
public record SyncRunReport(
        SyncOutcome outcome,
        int discovered,
        int skippedDuplicate,
        int filteredOut,
        int fetched,
        int persisted,
        int acknowledged,
        int acknowledgeFailed,
        int errored,
        String failureReason
) {

    static Tally tally() {
        return new Tally();
    }

    /** Mutable counters for a run in progress. */
    static final class Tally {
        int discovered;
        int skippedDuplicate;
        int filteredOut;
        int fetched;
        int persisted;
        int acknowledged;
        int acknowledgeFailed;
        int errored;

        SyncRunReport aborted(String reason) {
            return build(SyncOutcome.ABORTED, reason);
        }

        SyncRunReport persistFailed(String reason) {
            return build(SyncOutcome.PERSIST_FAILED, reason);
        }

        SyncRunReport finish() {
            boolean partial = errored > 0 || acknowledgeFailed > 0;
            return build(partial ? SyncOutcome.PARTIALLY_SYNCED : SyncOutcome.FULLY_SYNCED, null);
        }

        private SyncRunReport build(SyncOutcome outcome, String reason) {
            return new SyncRunReport(outcome, discovered, skippedDuplicate, filteredOut, fetched,
                    persisted, acknowledged, acknowledgeFailed, errored, reason);
        }
    }
}
