package com.knowledge.sync.ingestion.graph;

import com.knowledge.sync.ingestion.model.ExtractedGraph;
import com.knowledge.sync.ingestion.model.GraphWriteResult;

import java.util.List;

/**
 * Writes to the knowledge graph. Never throws for store errors; every call reports a {@link GraphWriteResult}.
 */
public interface GraphRepository {

    GraphWriteResult createDocumentNode(String userId, String documentId);

    GraphWriteResult mergeEntities(String userId, String documentId, List<ExtractedGraph.Entity> entities);

    GraphWriteResult mergeRelationships(String userId, List<ExtractedGraph.Relationship> relationships);

    GraphWriteResult mergeThemes(String userId, String documentId, List<String> themes);
}
