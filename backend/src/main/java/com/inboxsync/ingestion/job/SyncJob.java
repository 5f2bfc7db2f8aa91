package com.inboxsync.ingestion.job;

import com.inboxsync.domain.SyncRun;
import com.inboxsync.domain.SyncRunRepository;
import com.inboxsync.domain.SyncTrigger;
import com.inboxsync.ingestion.config.SyncJobProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for sync runs: scheduled, on startup, or manual (API).
 * At most one run is active per process; the history entry is written after each run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncJob {

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final SyncOrchestrator orchestrator;
    private final SyncRunRepository syncRunRepository;
    private final SyncJobProperties properties;

    /**
     * Runs one sync synchronously on the calling thread.
     *
     * @throws SyncAlreadyRunningException when another run is active in this process
     */
    public SyncRun trigger(SyncTrigger trigger) {
        if (!running.compareAndSet(false, true)) {
            throw new SyncAlreadyRunningException();
        }
        try {
            Instant startedAt = Instant.now();
            log.info("Sync run started (trigger={})", trigger);
            SyncRunReport report = orchestrator.run();
            SyncRun run = toRun(trigger, startedAt, Instant.now(), report);
            return saveQuietly(run);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(
            fixedDelayString = "${inboxsync.job.interval-ms:300000}",
            initialDelayString = "${inboxsync.job.interval-ms:300000}")
    public void runScheduled() {
        if (!properties.isScheduleEnabled()) return;
        try {
            trigger(SyncTrigger.SCHEDULED);
        } catch (SyncAlreadyRunningException e) {
            log.info("Scheduled sync skipped: previous run still active");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isRunOnStartup()) return;
        try {
            trigger(SyncTrigger.STARTUP);
        } catch (SyncAlreadyRunningException e) {
            log.info("Startup sync skipped: a run is already active");
        }
    }

    private SyncRun saveQuietly(SyncRun run) {
        try {
            return syncRunRepository.save(run);
        } catch (RuntimeException e) {
            log.warn("Failed to record sync run history (outcome={}): {}", run.getOutcome(), e.getMessage());
            return run;
        }
    }

    static SyncRun toRun(SyncTrigger trigger, Instant startedAt, Instant finishedAt, SyncRunReport report) {
        SyncRun run = new SyncRun();
        run.setTrigger(trigger);
        run.setStartedAt(startedAt);
        run.setFinishedAt(finishedAt);
        run.setOutcome(report.outcome());
        run.setDiscovered(report.discovered());
        run.setSkippedDuplicate(report.skippedDuplicate());
        run.setFilteredOut(report.filteredOut());
        run.setFetched(report.fetched());
        run.setPersisted(report.persisted());
        run.setAcknowledged(report.acknowledged());
        run.setAcknowledgeFailed(report.acknowledgeFailed());
        run.setErrored(report.errored());
        run.setFailureReason(report.failureReason());
        return run;
    }
}
