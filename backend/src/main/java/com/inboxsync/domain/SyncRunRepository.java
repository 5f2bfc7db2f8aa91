package com.inboxsync.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for sync_runs. Written by SyncJob, read by SyncRunHistoryService.
 */
public interface SyncRunRepository extends MongoRepository<SyncRun, String> {

    Optional<SyncRun> findFirstByOrderByStartedAtDesc();

    List<SyncRun> findAllByOrderByStartedAtDesc(Pageable pageable);
}
