package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.model.ExternalFile;
import com.knowledge.sync.ingestion.model.SyncContext;

/**
 * One external file to run through the document pipeline within a sync run.
 */
public record DocumentTask(SyncContext context, ExternalFile file, ContentExtractor contentExtractor, String sourceType) {

    public String userId() {
        return context.userId();
    }
}
