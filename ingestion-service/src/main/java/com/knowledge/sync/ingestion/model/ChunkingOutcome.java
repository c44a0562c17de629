package com.knowledge.sync.ingestion.model;

public record ChunkingOutcome(boolean chunkingSucceeded, boolean extractionSucceeded) {

    public static ChunkingOutcome chunkingFailed() {
        return new ChunkingOutcome(false, false);
    }
}
