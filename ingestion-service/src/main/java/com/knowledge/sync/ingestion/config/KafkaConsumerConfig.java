package com.knowledge.sync.ingestion.config;

import com.knowledge.sync.ingestion.exception.MessageValidationException;
import com.knowledge.sync.ingestion.exception.MissingCredentialException;
import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

@Slf4j
@Configuration
public class KafkaConsumerConfig {

    /**
     * Redelivers a failed sync request in place with a fixed back-off. The sync run itself decides what
     * a repeated delivery does (resume, no-op on COMPLETED).
     */
    @Bean
    public DefaultErrorHandler syncRequestErrorHandler(
            @Value(AppConstants.PROP_KAFKA_REDELIVERY_INTERVAL_MS) long intervalMs,
            @Value(AppConstants.PROP_KAFKA_REDELIVERY_ATTEMPTS) long maxAttempts) {
        DefaultErrorHandler handler = new DefaultErrorHandler(
                (record, e) -> log.error("Giving up on sync request {} after {} attempts",
                        record.key(), maxAttempts + 1, e),
                new FixedBackOff(intervalMs, maxAttempts));
        handler.addNotRetryableExceptions(MessageValidationException.class, MissingCredentialException.class);
        return handler;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<Object, Object> kafkaListenerContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory,
            DefaultErrorHandler syncRequestErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> factory = new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(factory, consumerFactory);
        factory.setCommonErrorHandler(syncRequestErrorHandler);
        factory.getContainerProperties().setDeliveryAttemptHeader(true);
        return factory;
    }
}
