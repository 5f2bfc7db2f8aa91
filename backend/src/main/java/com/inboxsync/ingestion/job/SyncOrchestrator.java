package com.inboxsync.ingestion.job;

import com.inboxsync.common.FailureKind;
import com.inboxsync.common.RemoteCallException;
import com.inboxsync.common.RetryPolicy;
import com.inboxsync.domain.ItemIdentity;
import com.inboxsync.domain.RowRecord;
import com.inboxsync.domain.SyncBatch;
import com.inboxsync.ingestion.config.GmailProperties;
import com.inboxsync.ingestion.config.SubjectFilterProperties;
import com.inboxsync.ingestion.filter.SubjectFilter;
import com.inboxsync.ingestion.sink.SinkAdapter;
import com.inboxsync.ingestion.source.RawItem;
import com.inboxsync.ingestion.source.SourceAdapter;
import com.inboxsync.ingestion.store.IdentitySet;
import com.inboxsync.ingestion.store.StoreUnavailableException;
import com.inboxsync.ingestion.store.StoreWriteFailedException;
import com.inboxsync.ingestion.transform.Transformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * One sync run as a linear pipeline: Init → Discover → Fetch+Transform → Persist → Acknowledge → Done.
 *
 * <p>Ordering contract: rows are appended before identities are recorded, and identities are recorded
 * before anything is acknowledged. A crash at any point therefore either leaves an identity recorded
 * (next run skips the item) or leaves it absent (next run redoes row, identity and acknowledgment).
 * An item is never acknowledged without its row being durable.
 *
 * <p>Identities already in the {@link IdentitySet} are dropped before fetch and never re-appended.
 */
@Component
@Slf4j
public class SyncOrchestrator {

    private final SourceAdapter source;
    private final Transformer transformer;
    private final SinkAdapter sink;
    private final RetryPolicy retryPolicy;
    private final SubjectFilterProperties filterProperties;
    private final GmailProperties gmailProperties;
    private final Executor fetchExecutor;

    public SyncOrchestrator(SourceAdapter source,
                            Transformer transformer,
                            SinkAdapter sink,
                            RetryPolicy retryPolicy,
                            SubjectFilterProperties filterProperties,
                            GmailProperties gmailProperties,
                            @Qualifier("fetch-executor") Executor fetchExecutor) {
        this.source = source;
        this.transformer = transformer;
        this.sink = sink;
        this.retryPolicy = retryPolicy;
        this.filterProperties = filterProperties;
        this.gmailProperties = gmailProperties;
        this.fetchExecutor = fetchExecutor;
    }

    public SyncRunReport run() {
        SyncRunReport.Tally tally = SyncRunReport.tally();
        SubjectFilter filter = filterProperties.toFilter();

        // Init
        IdentitySet identities;
        try {
            identities = IdentitySet.load(sink, retryPolicy);
        } catch (StoreUnavailableException e) {
            log.error("Aborting before persistence: {}", e.getMessage());
            return done(tally.aborted(e.getMessage()));
        }
        log.info("Loaded {} synchronized identities", identities.size());

        // Discover
        List<ItemIdentity> listed;
        try {
            listed = retryPolicy.execute("source.list", () -> source.list(filter));
        } catch (RuntimeException e) {
            log.error("Aborting before persistence: listing candidates failed", e);
            return done(tally.aborted("Listing candidates failed: " + e.getMessage()));
        }
        List<ItemIdentity> fresh = dropKnown(listed, identities, tally);
        log.info("Found {} candidate(s): {} already synchronized, {} new",
                tally.discovered, tally.skippedDuplicate, fresh.size());

        // Fetch + Transform
        SyncBatch batch = new SyncBatch();
        String abortReason = fetchAndTransform(fresh, filter, batch, tally);
        if (abortReason != null) {
            log.error("Aborting before persistence: {}", abortReason);
            return done(tally.aborted(abortReason));
        }

        if (batch.isEmpty()) {
            log.info("No new rows to append; nothing to acknowledge");
            return done(tally.finish());
        }

        // Persist: rows, then identities
        try {
            retryPolicy.run("sink.appendRows", () -> sink.appendRows(batch.rows()));
        } catch (RuntimeException e) {
            log.error("Row append of {} row(s) failed; identities not recorded, nothing acknowledged", batch.size(), e);
            return done(tally.persistFailed("Row append failed: " + e.getMessage()));
        }
        try {
            identities.record(batch.identities());
        } catch (StoreWriteFailedException e) {
            log.error("Rows appended but identity append failed; nothing acknowledged, items will be re-synced", e);
            return done(tally.persistFailed(e.getMessage()));
        }
        tally.persisted = batch.size();

        // Acknowledge only what is durably recorded
        acknowledge(batch.identities(), identities, tally);
        return done(tally.finish());
    }

    private static List<ItemIdentity> dropKnown(List<ItemIdentity> listed, IdentitySet identities, SyncRunReport.Tally tally) {
        LinkedHashSet<ItemIdentity> distinct = new LinkedHashSet<>(listed == null ? List.of() : listed);
        tally.discovered = distinct.size();
        List<ItemIdentity> fresh = new ArrayList<>();
        for (ItemIdentity id : distinct) {
            if (identities.contains(id)) {
                tally.skippedDuplicate++;
                log.debug("Skipping already synchronized item {}", id);
            } else {
                fresh.add(id);
            }
        }
        return fresh;
    }

    /**
     * Fetches concurrently, consumes results in discovery order. Per-item failures are skipped;
     * a permanent failure stops the run and its reason is returned. Returns null otherwise.
     */
    private String fetchAndTransform(List<ItemIdentity> fresh, SubjectFilter filter, SyncBatch batch, SyncRunReport.Tally tally) {
        List<CompletableFuture<FetchResult>> pending = fresh.stream()
                .map(id -> CompletableFuture.supplyAsync(() -> fetchOne(id), fetchExecutor))
                .toList();
        for (int i = 0; i < pending.size(); i++) {
            FetchResult result = pending.get(i).join();
            if (result.fetched()) {
                tally.fetched++;
            }
            if (result.failure() == null) {
                if (!filter.matches(result.row().subject())) {
                    tally.filteredOut++;
                    log.debug("Subject filtered out for item {}", result.id());
                    continue;
                }
                batch.add(result.id(), result.row());
                continue;
            }
            RuntimeException failure = result.failure();
            if (failure instanceof RemoteCallException rce && rce.getKind() == FailureKind.PERMANENT) {
                pending.subList(i + 1, pending.size()).forEach(f -> f.cancel(false));
                return "Permanent failure fetching " + result.id() + ": " + failure.getMessage();
            }
            tally.errored++;
            log.warn("Skipping item {} for this run: {}", result.id(), failure.getMessage());
        }
        return null;
    }

    private FetchResult fetchOne(ItemIdentity id) {
        RawItem raw;
        try {
            raw = retryPolicy.execute("source.fetch " + id, () -> source.fetch(id));
        } catch (RuntimeException e) {
            return new FetchResult(id, false, null, e);
        }
        try {
            return new FetchResult(id, true, transformer.transform(raw), null);
        } catch (RuntimeException e) {
            return new FetchResult(id, true, null, e);
        }
    }

    private void acknowledge(List<ItemIdentity> persisted, IdentitySet identities, SyncRunReport.Tally tally) {
        List<ItemIdentity> recorded = persisted.stream().filter(identities::contains).toList();
        int chunkSize = Math.max(1, Math.min(gmailProperties.effectiveAckBatchSize(), source.maxAcknowledgeBatch()));
        for (int from = 0; from < recorded.size(); from += chunkSize) {
            List<ItemIdentity> chunk = recorded.subList(from, Math.min(from + chunkSize, recorded.size()));
            try {
                retryPolicy.run("source.acknowledge", () -> source.acknowledge(chunk));
                tally.acknowledged += chunk.size();
            } catch (RuntimeException e) {
                tally.acknowledgeFailed += chunk.size();
                log.warn("Acknowledging {} item(s) failed; they are recorded and will not be synced again: {}",
                        chunk.size(), e.getMessage());
            }
        }
        log.info("Acknowledged {} item(s)", tally.acknowledged);
    }

    private static SyncRunReport done(SyncRunReport report) {
        log.info("Sync finished: outcome={} discovered={} duplicates={} filtered={} fetched={} persisted={} acknowledged={} ackFailed={} errored={}",
                report.outcome(), report.discovered(), report.skippedDuplicate(), report.filteredOut(), report.fetched(),
                report.persisted(), report.acknowledged(), report.acknowledgeFailed(), report.errored());
        return report;
    }

    private record FetchResult(ItemIdentity id, boolean fetched, RowRecord row, RuntimeException failure) {
    }
}
