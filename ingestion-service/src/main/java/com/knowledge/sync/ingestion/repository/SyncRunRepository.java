package com.knowledge.sync.ingestion.repository;

import com.knowledge.sync.ingestion.model.SyncRun;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SyncRunRepository extends MongoRepository<SyncRun, String> {

    Optional<SyncRun> findBySyncIdAndUserId(String syncId, String userId);

    Optional<SyncRun> findFirstByUserIdAndIntegrationIdOrderByCreatedAtDesc(String userId, String integrationId);
}
