package com.knowledge.sync.ingestion.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.sync.ingestion.exception.SyncRunNotFoundException;
import com.knowledge.sync.ingestion.model.OutboxEvent;
import com.knowledge.sync.ingestion.model.SyncRun;
import com.knowledge.sync.ingestion.model.SyncStatus;
import com.knowledge.sync.ingestion.repository.OutboxRepository;
import com.knowledge.sync.ingestion.repository.SyncRunRepository;
import com.knowledge.sync.shared.util.constants.AppConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoSyncRecordStoreTest {

    @Mock
    private SyncRunRepository syncRunRepository;

    @Mock
    private OutboxRepository outboxRepository;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MongoSyncRecordStore store;
    private UUID syncId;

    @BeforeEach
    void setUp() {
        store = new MongoSyncRecordStore(syncRunRepository, outboxRepository, objectMapper);
        syncId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Completing a run sets completed_at, clears the error and records a status event")
    void completeRun() throws Exception {
        // Given
        SyncRun run = SyncRun.builder().syncId(syncId.toString()).userId("user-1").integrationId("int-1")
                .status(SyncStatus.PROCESSING).errorMessage("old").build();
        when(syncRunRepository.findBySyncIdAndUserId(syncId.toString(), "user-1")).thenReturn(Optional.of(run));

        // When
        store.updateStatus("user-1", syncId, SyncStatus.COMPLETED, null);

        // Then
        ArgumentCaptor<SyncRun> saved = ArgumentCaptor.forClass(SyncRun.class);
        verify(syncRunRepository).save(saved.capture());
        assertEquals(SyncStatus.COMPLETED, saved.getValue().getStatus());
        assertNull(saved.getValue().getErrorMessage());
        assertNotNull(saved.getValue().getCompletedAt());
        assertNotNull(saved.getValue().getUpdatedAt());

        ArgumentCaptor<OutboxEvent> outbox = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxRepository).save(outbox.capture());
        assertEquals(AppConstants.EVENT_TYPE_SYNC_STATUS_CHANGED, outbox.getValue().getType());
        assertFalse(outbox.getValue().isProcessed());
        JsonNode payload = objectMapper.readTree(outbox.getValue().getPayload());
        assertEquals("COMPLETED", payload.get("status").asText());
        assertEquals("int-1", payload.get("integrationId").asText());
    }

    @Test
    @DisplayName("Failing a run keeps the message and leaves completed_at unset")
    void failRun() {
        SyncRun run = SyncRun.builder().syncId(syncId.toString()).userId("user-1").status(SyncStatus.PROCESSING).build();
        when(syncRunRepository.findBySyncIdAndUserId(syncId.toString(), "user-1")).thenReturn(Optional.of(run));

        store.updateStatus("user-1", syncId, SyncStatus.FAILED, "Drive listing failed");

        assertEquals("Drive listing failed", run.getErrorMessage());
        assertNull(run.getCompletedAt());
    }

    @Test
    @DisplayName("Updating an unknown run raises not found and writes nothing")
    void unknownRun() {
        when(syncRunRepository.findBySyncIdAndUserId(syncId.toString(), "user-1")).thenReturn(Optional.empty());

        assertThrows(SyncRunNotFoundException.class,
                () -> store.updateStatus("user-1", syncId, SyncStatus.PROCESSING, null));
        verify(syncRunRepository, never()).save(any());
        verify(outboxRepository, never()).save(any());
    }

    @Test
    @DisplayName("Creating a run enqueues a sync request through the outbox")
    void createRunEnqueuesRequest() throws Exception {
        // Given
        SyncRun run = SyncRun.builder().syncId(syncId.toString()).userId("user-1").integrationId("int-1")
                .status(SyncStatus.STARTED).build();
        when(syncRunRepository.save(run)).thenReturn(run);

        // When
        SyncRun created = store.create(run);

        // Then
        assertNotNull(created.getCreatedAt());
        ArgumentCaptor<OutboxEvent> outbox = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxRepository).save(outbox.capture());
        assertEquals(AppConstants.EVENT_TYPE_SYNC_REQUESTED, outbox.getValue().getType());
        assertEquals(syncId.toString(), outbox.getValue().getAggregateId());
        JsonNode payload = objectMapper.readTree(outbox.getValue().getPayload());
        assertEquals(syncId.toString(), payload.get("sync_id").asText());
        assertEquals("user-1", payload.get("user_id").asText());
        assertEquals(0, payload.get("retry_count").asInt());
    }
}
