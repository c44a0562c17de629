package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.model.ChunkingOutcome;

public interface ChunkExtractor {

    /**
     * Splits and embeds {@code text}, then extracts graph entities from the chunks.
     * Chunking can succeed while extraction fails; the outcome reports both.
     */
    ChunkingOutcome chunkAndExtract(String userId, String documentId, String text, int maxTokens, int overlapTokens);

    /**
     * Entity extraction alone, for documents whose chunks are already stored.
     */
    boolean extractEntities(String userId, String documentId, String text, int maxTokens, int overlapTokens);
}
