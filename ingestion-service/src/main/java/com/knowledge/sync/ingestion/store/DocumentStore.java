package com.knowledge.sync.ingestion.store;

import com.knowledge.sync.ingestion.model.KnowledgeDocument;

import java.util.Optional;

/**
 * Persistence for per-document processing state.
 */
public interface DocumentStore {

    Optional<KnowledgeDocument> findByOriginalFileId(String userId, String originalFileId);

    KnowledgeDocument create(KnowledgeDocument document);

    KnowledgeDocument update(KnowledgeDocument document);
}
