package com.knowledge.sync.shared.constant;

public final class APIMessages {

    private APIMessages() {
    }

    // ── Sync ──
    public static final String ERROR_SYNC_NOT_FOUND = "Sync run not found for ID: ";
    public static final String ERROR_INTEGRATION_NOT_FOUND = "Integration not found";
    public static final String ERROR_INTEGRATION_INACTIVE = "Integration is not active: ";
    public static final String ERROR_SYNC_INTERRUPTED = "Sync interrupted before completion";
    public static final String ERROR_SYNC_TIMEOUT = "Sync did not finish within ";
    public static final String ERROR_MISSING_ACCESS_TOKEN = "Credential error: no access token for integration ";

    // ── Documents ──
    public static final String ERROR_CHUNKING_FAILED = "Failed to process document chunks";
    public static final String ERROR_ENTITY_EXTRACTION_FAILED = "Entity extraction failed";
    public static final String ERROR_CONTENT_MISSING = "Content missing for retry from CHUNKING_SUCCEEDED state";
    public static final String ERROR_UNEXPECTED_STATUS = "Unexpected status for retry: ";

    // ── Messages ──
    public static final String ERROR_NOT_A_MAP = "Expected a JSON object, got ";
    public static final String ERROR_MISSING_FIELD = "Missing required field '%s'";
    public static final String ERROR_USER_ID_TYPE = "Field 'user_id' must be a string";
    public static final String ERROR_SYNC_ID_FORMAT = "Invalid sync_id format: ";
}
