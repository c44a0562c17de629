package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.exception.IntegrationInactiveException;
import com.knowledge.sync.ingestion.exception.IntegrationNotFoundException;
import com.knowledge.sync.ingestion.exception.SyncInterruptedException;
import com.knowledge.sync.ingestion.model.Integration;
import com.knowledge.sync.ingestion.model.IntegrationType;
import com.knowledge.sync.ingestion.model.SyncContext;
import com.knowledge.sync.ingestion.model.SyncRun;
import com.knowledge.sync.ingestion.model.SyncStatus;
import com.knowledge.sync.ingestion.model.SyncSummary;
import com.knowledge.sync.ingestion.store.IntegrationAdapter;
import com.knowledge.sync.shared.constant.APIMessages;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one sync run from its stored status to COMPLETED or FAILED.
 * <p>
 * Re-running a COMPLETED sync is a no-op, FAILED and PROCESSING runs are resumed, and integration types
 * without a registered {@link IntegrationProcessor} complete immediately.
 */
@Slf4j
@Service
public class SyncCoordinator {

    private final IntegrationAdapter integrationAdapter;
    private final Map<IntegrationType, IntegrationProcessor> processors = new EnumMap<>(IntegrationType.class);

    public SyncCoordinator(IntegrationAdapter integrationAdapter, List<IntegrationProcessor> processors) {
        this.integrationAdapter = integrationAdapter;
        for (IntegrationProcessor processor : processors) {
            IntegrationProcessor previous = this.processors.put(processor.type(), processor);
            if (previous != null) {
                throw new IllegalStateException("Two processors registered for " + processor.type());
            }
        }
        log.info("Registered integration processors: {}", this.processors.keySet());
    }

    public void run(String userId, UUID syncId) {
        Optional<SyncRun> found = integrationAdapter.getSyncRun(userId, syncId);
        if (found.isEmpty()) {
            log.error("Sync run {} not found for user {}, nothing to do", syncId, userId);
            return;
        }

        SyncRun syncRun = found.get();
        if (syncRun.getStatus() == SyncStatus.COMPLETED) {
            log.info("Sync {} already completed, skipping", syncId);
            return;
        }

        Integration integration;
        try {
            integration = integrationAdapter.getIntegration(userId, syncRun.getIntegrationId());
        } catch (IntegrationNotFoundException e) {
            log.error("Sync {} cannot run: {}", syncId, e.getMessage());
            integrationAdapter.updateSyncStatus(userId, syncId, SyncStatus.FAILED, APIMessages.ERROR_INTEGRATION_NOT_FOUND);
            return;
        }

        switch (syncRun.getStatus()) {
            case FAILED -> {
                log.info("Retrying failed sync {}", syncId);
                integrationAdapter.updateSyncStatus(userId, syncId, SyncStatus.PROCESSING, null);
            }
            case PROCESSING -> log.info("Resuming sync {} left in PROCESSING", syncId);
            case STARTED -> log.info("Starting sync {} for {} integration {}", syncId, integration.getType(), integration.getId());
            case COMPLETED -> throw new IllegalStateException("unreachable");
        }

        IntegrationProcessor processor = processors.get(integration.getType());
        if (processor == null) {
            log.info("No processor for integration type {}, completing sync {}", integration.getType(), syncId);
            integrationAdapter.updateSyncStatus(userId, syncId, SyncStatus.COMPLETED, null);
            return;
        }

        if (syncRun.getStatus() == SyncStatus.STARTED) {
            integrationAdapter.updateSyncStatus(userId, syncId, SyncStatus.PROCESSING, null);
        }

        try {
            SyncSummary summary = processor.process(new SyncContext(userId, syncId, integration, Instant.now()));
            integrationAdapter.updateSyncStatus(userId, syncId, SyncStatus.COMPLETED, null);
            log.info("Sync {} completed: processed={}, failed={}, skipped={}, total={}",
                    syncId, summary.processed(), summary.failed(), summary.skipped(), summary.total());
        } catch (SyncInterruptedException e) {
            log.warn("Sync {} interrupted, leaving it PROCESSING for redelivery", syncId);
            throw e;
        } catch (RuntimeException e) {
            // blocking driver calls surface interrupts as their own exception types
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Sync {} interrupted ({}), leaving it PROCESSING for redelivery", syncId, e.getClass().getSimpleName());
                throw new SyncInterruptedException("Sync " + syncId + " interrupted", e);
            }
            log.error("Sync {} failed: {}", syncId, e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            integrationAdapter.updateSyncStatus(userId, syncId, SyncStatus.FAILED, message);
            throw e;
        }
    }

    /**
     * Returns the sync already in flight for the integration, or creates and enqueues a new one.
     */
    public SyncRun requestSync(String userId, String integrationId) {
        Optional<SyncRun> latest = integrationAdapter.findLatestSyncRun(userId, integrationId);
        if (latest.isPresent() && latest.get().getStatus().isActive()) {
            log.info("Sync {} already {} for integration {}", latest.get().getSyncId(), latest.get().getStatus(), integrationId);
            return latest.get();
        }

        Integration integration = integrationAdapter.getIntegration(userId, integrationId);
        if (!integration.isActive()) {
            throw new IntegrationInactiveException(integrationId);
        }

        SyncRun syncRun = SyncRun.builder()
                .syncId(UUID.randomUUID().toString())
                .userId(userId)
                .integrationId(integrationId)
                .integrationType(integration.getType())
                .status(SyncStatus.STARTED)
                .build();
        return integrationAdapter.createSyncRun(syncRun);
    }
}
