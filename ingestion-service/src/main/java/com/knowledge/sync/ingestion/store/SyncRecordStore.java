package com.knowledge.sync.ingestion.store;

import com.knowledge.sync.ingestion.model.SyncRun;
import com.knowledge.sync.ingestion.model.SyncStatus;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for sync-run records.
 */
public interface SyncRecordStore {

    Optional<SyncRun> findSyncRun(String userId, UUID syncId);

    Optional<SyncRun> findLatestSyncRun(String userId, String integrationId);

    /**
     * Saves a new run and schedules the queue message that will execute it.
     */
    SyncRun create(SyncRun syncRun);

    /**
     * Moves a run to {@code status}. A {@code null} error message clears the stored one.
     */
    void updateStatus(String userId, UUID syncId, SyncStatus status, String errorMessage);
}
