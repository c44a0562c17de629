package com.knowledge.sync.ingestion.repository;

import com.knowledge.sync.ingestion.model.OutboxEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OutboxRepository extends MongoRepository<OutboxEvent, String> {

    List<OutboxEvent> findByProcessedFalseAndCreatedAtBefore(Instant cutoff);
}
