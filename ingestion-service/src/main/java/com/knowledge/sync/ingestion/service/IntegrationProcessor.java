package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.model.IntegrationType;
import com.knowledge.sync.ingestion.model.SyncContext;
import com.knowledge.sync.ingestion.model.SyncSummary;

/**
 * Syncs one kind of integration. Throwing fails the whole run; per-document failures belong in the summary.
 */
public interface IntegrationProcessor {

    IntegrationType type();

    SyncSummary process(SyncContext context);
}
