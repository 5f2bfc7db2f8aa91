package com.inboxsync.api.dto;

import com.inboxsync.domain.SyncRun;

import java.time.Instant;

/**
 * One sync run as returned by /api/v1/sync.
 */
public record SyncRunResponse(
        String id,
        String trigger,
        Instant startedAt,
        Instant finishedAt,
        String outcome,
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

    public static SyncRunResponse from(SyncRun run) {
        return new SyncRunResponse(
                run.getId(),
                run.getTrigger() != null ? run.getTrigger().name() : null,
                run.getStartedAt(),
                run.getFinishedAt(),
                run.getOutcome() != null ? run.getOutcome().name() : null,
                run.getDiscovered(),
                run.getSkippedDuplicate(),
                run.getFilteredOut(),
                run.getFetched(),
                run.getPersisted(),
                run.getAcknowledged(),
                run.getAcknowledgeFailed(),
                run.getErrored(),
                run.getFailureReason());
    }
}
