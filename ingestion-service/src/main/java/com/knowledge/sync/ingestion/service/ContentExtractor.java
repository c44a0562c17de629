package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.model.ExternalFile;

/**
 * Fetches the text of a discovered external file. Implementations are bound to one sync run's credentials.
 */
@FunctionalInterface
public interface ContentExtractor {

    String extract(ExternalFile file);
}
