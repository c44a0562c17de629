package com.knowledge.sync.ingestion.model;

public enum SyncStatus {
    STARTED,
    PROCESSING,
    COMPLETED,
    FAILED;

    /** A run in this state still owns its (user, integration) pair. */
    public boolean isActive() {
        return this == STARTED || this == PROCESSING;
    }
}
