package com.knowledge.sync.ingestion.model;

/**
 * Last stage of the ingestion pipeline that a document durably reached.
 */
public enum DocumentStatus {
    META_DATA_FETCHED,
    CONTENT_FETCHED,
    CHUNKING_SUCCEEDED,
    COMPLETED
}
