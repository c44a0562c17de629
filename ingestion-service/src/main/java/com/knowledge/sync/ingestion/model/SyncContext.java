package com.knowledge.sync.ingestion.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Everything an integration processor needs to know about the run it is executing.
 */
public record SyncContext(String userId, UUID syncId, Integration integration, Instant startedAt) {

    public String integrationId() {
        return integration.getId();
    }
}
