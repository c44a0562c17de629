package com.knowledge.sync.ingestion.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.sync.ingestion.worker.IngestionWorker;
import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.util.Map;

/**
 * Hands sync-request messages to the {@link IngestionWorker} on the listener thread, so the offset is
 * committed only once the sync has finished.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncRequestListener {

    static final String FIELD_RETRY_COUNT = "retry_count";

    private final IngestionWorker ingestionWorker;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = AppConstants.PROP_KAFKA_TOPIC_SYNC_REQUESTS,
            groupId = AppConstants.PROP_KAFKA_GROUP_ID,
            concurrency = AppConstants.PROP_KAFKA_LISTENER_CONCURRENCY)
    public void onMessage(ConsumerRecord<String, String> record) {
        Object payload;
        try {
            payload = objectMapper.readValue(record.value(), Object.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping unparseable sync request at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getOriginalMessage());
            return;
        }

        if (payload instanceof Map<?, ?> map && !map.containsKey(FIELD_RETRY_COUNT)) {
            Map<String, Object> message = objectMapper.convertValue(map, new TypeReference<Map<String, Object>>() {
            });
            message.put(FIELD_RETRY_COUNT, deliveryAttempt(record) - 1);
            payload = message;
        }

        ingestionWorker.consume(payload);
    }

    static int deliveryAttempt(ConsumerRecord<?, ?> record) {
        Header header = record.headers().lastHeader(KafkaHeaders.DELIVERY_ATTEMPT);
        if (header == null || header.value() == null || header.value().length != Integer.BYTES) {
            return 1;
        }
        return Math.max(1, ByteBuffer.wrap(header.value()).getInt());
    }
}
