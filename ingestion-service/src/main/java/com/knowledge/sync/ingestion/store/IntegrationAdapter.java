package com.knowledge.sync.ingestion.store;

import com.knowledge.sync.ingestion.exception.IntegrationNotFoundException;
import com.knowledge.sync.ingestion.model.Integration;
import com.knowledge.sync.ingestion.model.SyncRun;
import com.knowledge.sync.ingestion.model.SyncStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point the sync pipeline uses for sync-run and integration records.
 * Store failures are logged here and rethrown unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntegrationAdapter {

    private final SyncRecordStore syncRecordStore;
    private final IntegrationStore integrationStore;

    public Optional<SyncRun> getSyncRun(String userId, UUID syncId) {
        try {
            return syncRecordStore.findSyncRun(userId, syncId);
        } catch (RuntimeException e) {
            log.error("Failed to load sync run {} for user {}", syncId, userId, e);
            throw e;
        }
    }

    public Optional<SyncRun> findLatestSyncRun(String userId, String integrationId) {
        try {
            return syncRecordStore.findLatestSyncRun(userId, integrationId);
        } catch (RuntimeException e) {
            log.error("Failed to load latest sync run for integration {}", integrationId, e);
            throw e;
        }
    }

    public SyncRun createSyncRun(SyncRun syncRun) {
        try {
            return syncRecordStore.create(syncRun);
        } catch (RuntimeException e) {
            log.error("Failed to create sync run for integration {}", syncRun.getIntegrationId(), e);
            throw e;
        }
    }

    public void updateSyncStatus(String userId, UUID syncId, SyncStatus status, String errorMessage) {
        try {
            syncRecordStore.updateStatus(userId, syncId, status, errorMessage);
        } catch (RuntimeException e) {
            log.error("Failed to move sync run {} to {}", syncId, status, e);
            throw e;
        }
    }

    public Integration getIntegration(String userId, String integrationId) {
        return integrationStore.findIntegration(userId, integrationId)
                .orElseThrow(() -> new IntegrationNotFoundException(userId, integrationId));
    }

    public Optional<String> getCheckpoint(String userId, String integrationId) {
        return integrationStore.getCheckpoint(userId, integrationId);
    }

    public boolean updateCheckpoint(String userId, String integrationId, String checkpoint) {
        try {
            boolean updated = integrationStore.updateCheckpoint(userId, integrationId, checkpoint);
            if (!updated) {
                log.warn("Checkpoint not updated: integration {} not found for user {}", integrationId, userId);
            }
            return updated;
        } catch (RuntimeException e) {
            log.error("Failed to update checkpoint for integration {}", integrationId, e);
            throw e;
        }
    }
}
