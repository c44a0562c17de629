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

/**
 * Processing state of one external file inside the knowledge base.
 * {@code (userId, originalFileId)} is unique: rediscovering a file never creates a second row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = AppConstants.SPEL_COLLECTION_DOCUMENTS)
@CompoundIndex(name = "user_original_file", def = "{'userId': 1, 'originalFileId': 1}", unique = true)
public class KnowledgeDocument {

    @Id
    private String id;

    private String userId;
    private String integrationId;
    private String originalFileId;

    private String fileName;
    private String fileType;
    private Long size;
    private String address;
    private String sourceType;
    private Instant createdAt;
    private Instant updatedAt;

    private DocumentStatus status;
    private ProcessingStatus processingStatus;
    private String content;
    private String error;
    private Instant processedAt;
}
