package com.knowledge.sync.shared.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncStatusChangedEvent(
        String syncId,
        String userId,
        String integrationId,
        String status,
        String errorMessage,
        Instant occurredAt) {
}
