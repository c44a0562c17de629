package com.knowledge.sync.ingestion.store;

import com.knowledge.sync.ingestion.model.KnowledgeDocument;
import com.knowledge.sync.ingestion.repository.KnowledgeDocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoDocumentStore implements DocumentStore {

    private final KnowledgeDocumentRepository documentRepository;

    @Override
    public Optional<KnowledgeDocument> findByOriginalFileId(String userId, String originalFileId) {
        return documentRepository.findByUserIdAndOriginalFileId(userId, originalFileId);
    }

    @Override
    public KnowledgeDocument create(KnowledgeDocument document) {
        document.setProcessedAt(Instant.now());
        // insert, not save: a duplicate (userId, originalFileId) must fail on the unique index
        return documentRepository.insert(document);
    }

    @Override
    public KnowledgeDocument update(KnowledgeDocument document) {
        document.setProcessedAt(Instant.now());
        return documentRepository.save(document);
    }
}
