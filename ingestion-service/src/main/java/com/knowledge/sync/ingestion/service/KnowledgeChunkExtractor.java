package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.exception.ExtractionException;
import com.knowledge.sync.ingestion.exception.SyncInterruptedException;
import com.knowledge.sync.ingestion.graph.GraphRepository;
import com.knowledge.sync.ingestion.model.ChunkingOutcome;
import com.knowledge.sync.ingestion.model.ExtractedGraph;
import com.knowledge.sync.ingestion.model.GraphWriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Chunks, embeds and graph-extracts documents on the extraction pool.
 * Document node, entity and relationship writes must succeed; theme writes may fail.
 */
@Slf4j
@Service
public class KnowledgeChunkExtractor implements ChunkExtractor {

    private final ChunkingService chunkingService;
    private final EmbeddingService embeddingService;
    private final EntityExtractor entityExtractor;
    private final GraphRepository graphRepository;
    private final Executor extractionExecutor;

    public KnowledgeChunkExtractor(ChunkingService chunkingService,
                                   EmbeddingService embeddingService,
                                   EntityExtractor entityExtractor,
                                   GraphRepository graphRepository,
                                   @Qualifier("extractionExecutor") Executor extractionExecutor) {
        this.chunkingService = chunkingService;
        this.embeddingService = embeddingService;
        this.entityExtractor = entityExtractor;
        this.graphRepository = graphRepository;
        this.extractionExecutor = extractionExecutor;
    }

    @Override
    public ChunkingOutcome chunkAndExtract(String userId, String documentId, String text, int maxTokens, int overlapTokens) {
        List<Document> chunks;
        try {
            chunks = onExtractionPool(() -> {
                List<Document> split = chunkingService.split(userId, documentId, text, maxTokens, overlapTokens);
                embeddingService.embedAndStore(split);
                return split;
            });
        } catch (ExtractionException e) {
            log.error("Chunking failed for document {}: {}", documentId, e.getMessage(), e.getCause());
            return ChunkingOutcome.chunkingFailed();
        }

        return new ChunkingOutcome(true, extractGraph(userId, documentId, () -> chunks));
    }

    @Override
    public boolean extractEntities(String userId, String documentId, String text, int maxTokens, int overlapTokens) {
        return extractGraph(userId, documentId,
                () -> chunkingService.split(userId, documentId, text, maxTokens, overlapTokens));
    }

    private boolean extractGraph(String userId, String documentId, Supplier<List<Document>> chunks) {
        try {
            return onExtractionPool(() -> writeGraph(userId, documentId, chunks.get()));
        } catch (ExtractionException e) {
            log.error("Entity extraction failed for document {}: {}", documentId, e.getMessage(), e.getCause());
            return false;
        }
    }

    private boolean writeGraph(String userId, String documentId, List<Document> chunks) {
        GraphWriteResult documentNode = graphRepository.createDocumentNode(userId, documentId);
        if (!documentNode.success()) {
            log.error("Could not create graph node for document {}: {}", documentId, documentNode.error());
            return false;
        }

        int entityCount = 0;
        for (Document chunk : chunks) {
            ExtractedGraph graph = entityExtractor.extract(chunk.getText());

            GraphWriteResult entities = graphRepository.mergeEntities(userId, documentId, graph.entitiesOrEmpty());
            if (!entities.success()) {
                log.error("Entity write failed for document {}: {}", documentId, entities.error());
                return false;
            }
            GraphWriteResult relationships = graphRepository.mergeRelationships(userId, graph.relationshipsOrEmpty());
            if (!relationships.success()) {
                log.error("Relationship write failed for document {}: {}", documentId, relationships.error());
                return false;
            }
            GraphWriteResult themes = graphRepository.mergeThemes(userId, documentId, graph.themesOrEmpty());
            if (!themes.success()) {
                log.warn("Ignoring theme write failure for document {}: {}", documentId, themes.error());
            }
            entityCount += graph.entitiesOrEmpty().size();
        }

        log.info("Extracted {} entities from {} chunk(s) of document {}", entityCount, chunks.size(), documentId);
        return true;
    }

    private <T> T onExtractionPool(Supplier<T> work) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(work, extractionExecutor);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncInterruptedException("Interrupted while waiting for extraction", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SyncInterruptedException interrupted) {
                throw interrupted;
            }
            throw new ExtractionException(cause.getMessage(), cause);
        }
    }
}
