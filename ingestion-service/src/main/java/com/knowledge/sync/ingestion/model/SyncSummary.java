package com.knowledge.sync.ingestion.model;

public record SyncSummary(int processed, int failed, int skipped, int total) {

    public static SyncSummary single() {
        return new SyncSummary(1, 0, 0, 1);
    }
}
