package com.inboxsync.ingestion.history;

import com.inboxsync.domain.SyncRun;
import com.inboxsync.domain.SyncRunRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only run history for API (GET /sync/runs, /sync/runs/latest).
 */
@Service
@RequiredArgsConstructor
public class SyncRunHistoryService {

    private final SyncRunRepository syncRunRepository;

    public Optional<SyncRun> findLatest() {
        return syncRunRepository.findFirstByOrderByStartedAtDesc();
    }

    /** Newest first. */
    public List<SyncRun> findRecent(int limit) {
        return syncRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }
}
