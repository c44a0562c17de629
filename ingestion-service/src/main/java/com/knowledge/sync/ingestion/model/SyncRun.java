package com.knowledge.sync.ingestion.model;

import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = AppConstants.SPEL_COLLECTION_SYNC_RUNS)
@CompoundIndex(name = "user_integration_created", def = "{'userId': 1, 'integrationId': 1, 'createdAt': -1}")
public class SyncRun {

    @Id
    private String syncId;

    private String userId;
    private String integrationId;
    private IntegrationType integrationType;
    private SyncStatus status;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private String errorMessage;
}
