package com.knowledge.sync.ingestion.repository;

import com.knowledge.sync.ingestion.model.Integration;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IntegrationRepository extends MongoRepository<Integration, String> {

    Optional<Integration> findByIdAndUserId(String id, String userId);
}
