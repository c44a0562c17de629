package com.knowledge.sync.ingestion.store;

import com.knowledge.sync.ingestion.model.Integration;

import java.util.Optional;

public interface IntegrationStore {

    Optional<Integration> findIntegration(String userId, String integrationId);

    Optional<String> getCheckpoint(String userId, String integrationId);

    boolean updateCheckpoint(String userId, String integrationId, String checkpoint);
}
