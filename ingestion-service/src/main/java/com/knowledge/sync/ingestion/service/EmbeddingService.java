package com.knowledge.sync.ingestion.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingService {

    private final VectorStore vectorStore;

    /**
     * Embeds the chunks with the configured EmbeddingModel and stores them in the MongoDB vector store.
     * Chunk ids are stable, so a re-run replaces the previous vectors.
     */
    public void embedAndStore(List<Document> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        log.info("Embedding and storing {} chunk(s)", chunks.size());
        vectorStore.add(chunks);
    }
}
