package com.knowledge.sync.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app.ingestion")
public class IngestionProperties {

    /** Deliveries after which a message is still processed but logged as over the limit. */
    @Min(0)
    private int maxRetries = 3;

    @Min(1)
    private int maxConcurrentSyncs = 20;

    /** Zero disables the per-sync timeout. */
    private Duration syncTimeout = Duration.ZERO;

    @Min(1)
    private int maxTokens = 1024;

    @Min(0)
    private int overlapTokens = 128;

    @Min(1)
    private int extractionPoolSize = 4;

    @Min(0)
    private int extractionQueueCapacity = 100;

    public boolean hasSyncTimeout() {
        return syncTimeout != null && !syncTimeout.isZero() && !syncTimeout.isNegative();
    }
}
