package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.model.ExtractedGraph;

public interface EntityExtractor {

    ExtractedGraph extract(String text);
}
