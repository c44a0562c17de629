package com.knowledge.sync.ingestion.model;

public enum ProcessingStatus {
    PROCESSING,
    SUCCESS,
    FAILED
}
