package com.knowledge.sync.shared.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Queue message asking the ingestion service to run (or resume) one integration sync.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncRequestEvent(
        @JsonProperty("user_id") String userId,
        @JsonProperty("sync_id") String syncId,
        @JsonProperty("retry_count") Integer retryCount,
        @JsonProperty("priority") String priority,
        @JsonProperty("message_id") String messageId) {

    public static final String PRIORITY_NORMAL = "normal";
    public static final String PRIORITY_HIGH = "high";

    public static SyncRequestEvent of(String userId, String syncId, String messageId) {
        return new SyncRequestEvent(userId, syncId, 0, PRIORITY_NORMAL, messageId);
    }
}
