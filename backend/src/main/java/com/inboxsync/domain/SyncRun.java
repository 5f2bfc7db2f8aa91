package com.inboxsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * History entry for one finished sync run. Written after the run; never consulted for deduplication.
 */
@Document(collection = "sync_runs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SyncRun {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private SyncTrigger trigger;
    @Indexed
    private Instant startedAt;
    private Instant finishedAt;
    private SyncOutcome outcome;
    private int discovered;
    private int skippedDuplicate;
    private int filteredOut;
    private int fetched;
    private int persisted;
    private int acknowledged;
    private int acknowledgeFailed;
    private int errored;
    private String failureReason;
}
