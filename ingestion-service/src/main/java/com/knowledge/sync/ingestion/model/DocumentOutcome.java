package com.knowledge.sync.ingestion.model;

public enum DocumentOutcome {
    SKIPPED,
    SUCCEEDED,
    FAILED
}
