package com.knowledge.sync.ingestion.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.sync.ingestion.kafka.KafkaSyncEventPublisher;
import com.knowledge.sync.ingestion.model.OutboxEvent;
import com.knowledge.sync.ingestion.repository.OutboxRepository;
import com.knowledge.sync.shared.event.SyncRequestEvent;
import com.knowledge.sync.shared.event.SyncStatusChangedEvent;
import com.knowledge.sync.shared.util.constants.AppConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.messaging.MessageListenerContainer;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxRelayTest {

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private KafkaSyncEventPublisher publisher;

    @Mock
    private MessageListenerContainer container;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private OutboxRelay relay;

    @BeforeEach
    void setUp() {
        relay = new OutboxRelay(outboxRepository, publisher, objectMapper, container);
    }

    @Test
    @DisplayName("A sync request event is published and then marked processed")
    void relaysSyncRequest() throws Exception {
        // Given
        SyncRequestEvent request = SyncRequestEvent.of("user-1", "3f0e4a1c-9b7d-4c55-8a61-0d2f5e8b9c10", "msg-1");
        OutboxEvent event = event(AppConstants.EVENT_TYPE_SYNC_REQUESTED, objectMapper.writeValueAsString(request));
        when(publisher.publishSyncRequest(any())).thenReturn(CompletableFuture.completedFuture(null));

        // When
        relay.processEvent(event);

        // Then
        ArgumentCaptor<SyncRequestEvent> captor = ArgumentCaptor.forClass(SyncRequestEvent.class);
        verify(publisher).publishSyncRequest(captor.capture());
        assertEquals(request, captor.getValue());
        assertTrue(event.isProcessed());
        assertNotNull(event.getProcessedAt());
        verify(outboxRepository).save(event);
    }

    @Test
    @DisplayName("A status change event is published to the status topic")
    void relaysStatusChange() throws Exception {
        // Given
        SyncStatusChangedEvent change = new SyncStatusChangedEvent("sync-1", "user-1", "int-1", "COMPLETED", null,
                Instant.parse("2024-06-01T00:00:00Z"));
        OutboxEvent event = event(AppConstants.EVENT_TYPE_SYNC_STATUS_CHANGED, objectMapper.writeValueAsString(change));
        when(publisher.publishStatusChange(any())).thenReturn(CompletableFuture.completedFuture(null));

        // When
        relay.processEvent(event);

        // Then
        verify(publisher).publishStatusChange(change);
        assertTrue(event.isProcessed());
    }

    @Test
    @DisplayName("An event Kafka rejected stays unprocessed for the next sweep")
    void rejectedEventStaysPending() throws Exception {
        // Given
        SyncRequestEvent request = SyncRequestEvent.of("user-1", "3f0e4a1c-9b7d-4c55-8a61-0d2f5e8b9c10", "msg-1");
        OutboxEvent event = event(AppConstants.EVENT_TYPE_SYNC_REQUESTED, objectMapper.writeValueAsString(request));
        when(publisher.publishSyncRequest(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        // When
        relay.processEvent(event);

        // Then
        assertFalse(event.isProcessed());
        verify(outboxRepository, never()).save(any());
    }

    @Test
    @DisplayName("Processed and unknown events are not published")
    void skipsProcessedAndUnknownEvents() {
        OutboxEvent processed = event(AppConstants.EVENT_TYPE_SYNC_REQUESTED, "{}");
        processed.setProcessed(true);
        OutboxEvent unknown = event("SOMETHING_ELSE", "{}");

        relay.processEvent(processed);
        relay.processEvent(unknown);

        verifyNoInteractions(publisher, outboxRepository);
    }

    private static OutboxEvent event(String type, String payload) {
        return OutboxEvent.builder()
                .id("evt-1")
                .aggregateId("sync-1")
                .type(type)
                .payload(payload)
                .createdAt(Instant.now())
                .processed(false)
                .build();
    }
}
