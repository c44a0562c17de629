package com.knowledge.sync.ingestion.kafka;

import com.knowledge.sync.shared.event.SyncRequestEvent;
import com.knowledge.sync.shared.event.SyncStatusChangedEvent;
import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes sync events keyed by sync id, so all events of one run land on the same partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaSyncEventPublisher {

    @Value(AppConstants.PROP_KAFKA_TOPIC_SYNC_REQUESTS)
    private String syncRequestsTopic;

    @Value(AppConstants.PROP_KAFKA_TOPIC_SYNC_STATUS)
    private String syncStatusTopic;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public CompletableFuture<SendResult<String, Object>> publishSyncRequest(SyncRequestEvent event) {
        log.info("Publishing sync request {} to topic '{}'", event.syncId(), syncRequestsTopic);
        return kafkaTemplate.send(syncRequestsTopic, event.syncId(), event);
    }

    public CompletableFuture<SendResult<String, Object>> publishStatusChange(SyncStatusChangedEvent event) {
        log.debug("Publishing status {} of sync {} to topic '{}'", event.status(), event.syncId(), syncStatusTopic);
        return kafkaTemplate.send(syncStatusTopic, event.syncId(), event);
    }
}
