package com.knowledge.sync.ingestion.model;

import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * A user's connection to an external system. Owned by the integrations module; the ingestion
 * pipeline only reads it and moves the {@code checkpoint} setting forward.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = AppConstants.SPEL_COLLECTION_INTEGRATIONS)
public class Integration {

    public static final String SETTING_CHECKPOINT = "checkpoint";

    @Id
    private String id;

    @Indexed
    private String userId;

    private IntegrationType type;
    private String name;
    private Map<String, Object> credential;
    private Map<String, Object> settings;
    private boolean active;

    private Instant expiresAt;
    private Instant createdAt;
    private Instant updatedAt;

    public String credentialValue(String key) {
        if (credential == null) {
            return null;
        }
        Object value = credential.get(key);
        return value == null ? null : value.toString();
    }
}
