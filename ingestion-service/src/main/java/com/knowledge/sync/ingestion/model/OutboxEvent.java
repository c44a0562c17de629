package com.knowledge.sync.ingestion.model;

import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = AppConstants.SPEL_COLLECTION_OUTBOX)
public class OutboxEvent {

    @Id
    private String id;

    private String aggregateId;
    private String type;
    private String payload;

    private Instant createdAt;
    private boolean processed;
    private Instant processedAt;
}
