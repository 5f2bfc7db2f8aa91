package com.inboxsync.api.controller;

import com.inboxsync.api.dto.SyncRunResponse;
import com.inboxsync.domain.SyncTrigger;
import com.inboxsync.ingestion.history.SyncRunHistoryService;
import com.inboxsync.ingestion.job.SyncJob;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * POST /sync/run, GET /sync/runs/latest, GET /sync/runs.
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
public class SyncController {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final SyncJob syncJob;
    private final SyncRunHistoryService syncRunHistoryService;

    /** Runs one sync and responds with its summary once it is done. 409 when a run is already active. */
    @PostMapping("/run")
    public Mono<SyncRunResponse> run() {
        return Mono.fromCallable(() -> SyncRunResponse.from(syncJob.trigger(SyncTrigger.MANUAL)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/runs/latest")
    public ResponseEntity<SyncRunResponse> latest() {
        return syncRunHistoryService.findLatest()
                .map(run -> ResponseEntity.ok(SyncRunResponse.from(run)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/runs")
    public List<SyncRunResponse> recent(@RequestParam(required = false) Integer limit) {
        int size = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        return syncRunHistoryService.findRecent(size).stream()
                .map(SyncRunResponse::from)
                .toList();
    }
}
