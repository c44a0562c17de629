package com.knowledge.sync.ingestion.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.sync.ingestion.exception.SyncRunNotFoundException;
import com.knowledge.sync.ingestion.model.OutboxEvent;
import com.knowledge.sync.ingestion.model.SyncRun;
import com.knowledge.sync.ingestion.model.SyncStatus;
import com.knowledge.sync.ingestion.repository.OutboxRepository;
import com.knowledge.sync.ingestion.repository.SyncRunRepository;
import com.knowledge.sync.shared.event.SyncRequestEvent;
import com.knowledge.sync.shared.event.SyncStatusChangedEvent;
import com.knowledge.sync.shared.util.CorrelationIdGenerator;
import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Sync runs in MongoDB. Every write also records an outbox event in the same transaction,
 * which {@link com.knowledge.sync.ingestion.service.OutboxRelay} later publishes to Kafka.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoSyncRecordStore implements SyncRecordStore {

    private final SyncRunRepository syncRunRepository;
    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<SyncRun> findSyncRun(String userId, UUID syncId) {
        return syncRunRepository.findBySyncIdAndUserId(syncId.toString(), userId);
    }

    @Override
    public Optional<SyncRun> findLatestSyncRun(String userId, String integrationId) {
        return syncRunRepository.findFirstByUserIdAndIntegrationIdOrderByCreatedAtDesc(userId, integrationId);
    }

    @Override
    @Transactional
    public SyncRun create(SyncRun syncRun) {
        Instant now = Instant.now();
        syncRun.setCreatedAt(now);
        syncRun.setUpdatedAt(now);
        SyncRun saved = syncRunRepository.save(syncRun);

        SyncRequestEvent request = SyncRequestEvent.of(
                saved.getUserId(), saved.getSyncId(), CorrelationIdGenerator.generate());
        saveToOutbox(saved.getSyncId(), AppConstants.EVENT_TYPE_SYNC_REQUESTED, request);

        log.info("Created sync run {} for integration {}", saved.getSyncId(), saved.getIntegrationId());
        return saved;
    }

    @Override
    @Transactional
    public void updateStatus(String userId, UUID syncId, SyncStatus status, String errorMessage) {
        SyncRun syncRun = findSyncRun(userId, syncId)
                .orElseThrow(() -> new SyncRunNotFoundException(syncId));

        Instant now = Instant.now();
        syncRun.setStatus(status);
        syncRun.setErrorMessage(errorMessage);
        syncRun.setUpdatedAt(now);
        if (status == SyncStatus.COMPLETED) {
            syncRun.setCompletedAt(now);
        }
        syncRunRepository.save(syncRun);

        SyncStatusChangedEvent event = new SyncStatusChangedEvent(
                syncRun.getSyncId(), userId, syncRun.getIntegrationId(), status.name(), errorMessage, now);
        saveToOutbox(syncRun.getSyncId(), AppConstants.EVENT_TYPE_SYNC_STATUS_CHANGED, event);

        log.debug("Sync run {} moved to {}", syncId, status);
    }

    private void saveToOutbox(String aggregateId, String type, Object payload) {
        try {
            OutboxEvent event = OutboxEvent.builder()
                    .aggregateId(aggregateId)
                    .type(type)
                    .payload(objectMapper.writeValueAsString(payload))
                    .createdAt(Instant.now())
                    .processed(false)
                    .build();

            outboxRepository.save(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event for sync run {}", type, aggregateId, e);
            throw new IllegalStateException("Outbox serialization error", e);
        }
    }
}
