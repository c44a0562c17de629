package com.knowledge.sync.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.sync.ingestion.kafka.KafkaSyncEventPublisher;
import com.knowledge.sync.ingestion.model.OutboxEvent;
import com.knowledge.sync.ingestion.repository.OutboxRepository;
import com.knowledge.sync.shared.event.SyncRequestEvent;
import com.knowledge.sync.shared.event.SyncStatusChangedEvent;
import com.knowledge.sync.shared.util.constants.AppConstants;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.messaging.ChangeStreamRequest;
import org.springframework.data.mongodb.core.messaging.Message;
import org.springframework.data.mongodb.core.messaging.MessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.Subscription;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Publishes outbox events to Kafka as soon as the change stream reports them. A periodic sweep picks
 * up anything the stream missed. An event is marked processed only after Kafka acknowledged it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxRelay {

    private final OutboxRepository outboxRepository;
    private final KafkaSyncEventPublisher publisher;
    private final ObjectMapper objectMapper;
    private final MessageListenerContainer container;

    @Value(AppConstants.PROP_COLLECTION_OUTBOX)
    private String outboxCollection;

    @Value(AppConstants.PROP_OUTBOX_SWEEP_RATE_MS)
    private long sweepIntervalMs;

    @PostConstruct
    public void startWatching() {
        log.info("Initializing MongoDB watch on collection: {}", outboxCollection);
        ChangeStreamRequest<OutboxEvent> request = ChangeStreamRequest.builder(
                        (Message<ChangeStreamDocument<org.bson.Document>, OutboxEvent> message) -> {
                            OutboxEvent event = message.getBody();
                            if (event != null) {
                                log.debug("Captured outbox event {} from change stream", event.getId());
                                processEvent(event);
                            }
                        })
                .collection(outboxCollection)
                .build();

        if (!container.isRunning()) {
            container.start();
        }

        Subscription subscription = container.register(request, OutboxEvent.class);
        log.info("MongoDB change stream started. Active: {}", subscription.isActive());
    }

    @Scheduled(fixedDelayString = AppConstants.PROP_OUTBOX_SWEEP_RATE_MS,
            initialDelayString = AppConstants.PROP_OUTBOX_SWEEP_RATE_MS)
    public void sweep() {
        Instant cutoff = Instant.now().minus(Duration.ofMillis(sweepIntervalMs));
        List<OutboxEvent> pending = outboxRepository.findByProcessedFalseAndCreatedAtBefore(cutoff);
        if (!pending.isEmpty()) {
            log.info("Re-publishing {} outbox event(s) missed by the change stream", pending.size());
            pending.forEach(this::processEvent);
        }
    }

    void processEvent(OutboxEvent event) {
        if (event.isProcessed()) {
            return;
        }
        if (event.getType() == null) {
            log.warn("Ignoring outbox event {} without a type", event.getId());
            return;
        }

        try {
            CompletableFuture<?> sent = switch (event.getType()) {
                case AppConstants.EVENT_TYPE_SYNC_REQUESTED -> publisher.publishSyncRequest(
                        objectMapper.readValue(event.getPayload(), SyncRequestEvent.class));
                case AppConstants.EVENT_TYPE_SYNC_STATUS_CHANGED -> publisher.publishStatusChange(
                        objectMapper.readValue(event.getPayload(), SyncStatusChangedEvent.class));
                default -> null;
            };
            if (sent == null) {
                log.warn("Ignoring outbox event {} of unknown type {}", event.getId(), event.getType());
                return;
            }
            sent.join();

            event.setProcessed(true);
            event.setProcessedAt(Instant.now());
            outboxRepository.save(event);
            log.debug("Relayed outbox event {} ({})", event.getId(), event.getType());
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize outbox payload for event {}", event.getId(), e);
        } catch (CompletionException e) {
            log.error("Kafka rejected outbox event {}, the next sweep retries it", event.getId(), e.getCause());
        }
    }
}
