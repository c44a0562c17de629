package com.knowledge.sync.ingestion.model;

/**
 * Outcome of one write against the knowledge graph. Callers decide whether a failure is fatal.
 */
public record GraphWriteResult(boolean success, int nodesCreated, int relationshipsCreated, String error) {

    public static GraphWriteResult success(int nodesCreated, int relationshipsCreated) {
        return new GraphWriteResult(true, nodesCreated, relationshipsCreated, null);
    }

    public static GraphWriteResult failure(String error) {
        return new GraphWriteResult(false, 0, 0, error);
    }
}
