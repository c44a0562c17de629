package com.knowledge.sync.ingestion.repository;

import com.knowledge.sync.ingestion.model.KnowledgeDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface KnowledgeDocumentRepository extends MongoRepository<KnowledgeDocument, String> {

    Optional<KnowledgeDocument> findByUserIdAndOriginalFileId(String userId, String originalFileId);
}
