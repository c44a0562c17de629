package com.knowledge.sync.ingestion.graph;

import com.knowledge.sync.ingestion.model.ExtractedGraph;
import com.knowledge.sync.ingestion.model.GraphWriteResult;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.summary.SummaryCounters;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Knowledge graph in Neo4j. Every write is a MERGE, so replaying a document leaves the graph unchanged.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class Neo4jGraphRepository implements GraphRepository {

    private static final String MERGE_DOCUMENT = """
            MERGE (d:Document {id: $documentId})
            SET d.userId = $userId, d.updatedAt = datetime()
            """;

    private static final String MERGE_ENTITIES = """
            UNWIND $entities AS entity
            MERGE (e:Entity {userId: $userId, name: entity.name})
            ON CREATE SET e.type = entity.type, e.description = entity.description
            WITH e
            MATCH (d:Document {id: $documentId})
            MERGE (d)-[:MENTIONS]->(e)
            """;

    private static final String MERGE_RELATIONSHIPS = """
            UNWIND $relationships AS rel
            MATCH (s:Entity {userId: $userId, name: rel.source})
            MATCH (t:Entity {userId: $userId, name: rel.target})
            MERGE (s)-[r:RELATED_TO {type: rel.type}]->(t)
            SET r.description = rel.description, r.strength = rel.strength
            """;

    private static final String MERGE_THEMES = """
            UNWIND $themes AS theme
            MERGE (t:Theme {userId: $userId, name: theme})
            WITH t
            MATCH (d:Document {id: $documentId})
            MERGE (d)-[:HAS_THEME]->(t)
            """;

    private final Driver driver;

    @PostConstruct
    public void createIndexes() {
        try (Session session = driver.session()) {
            session.run("CREATE INDEX document_id IF NOT EXISTS FOR (d:Document) ON (d.id)");
            session.run("CREATE INDEX entity_user_name IF NOT EXISTS FOR (e:Entity) ON (e.userId, e.name)");
            session.run("CREATE INDEX theme_user_name IF NOT EXISTS FOR (t:Theme) ON (t.userId, t.name)");
            log.info("Neo4j indexes ensured");
        } catch (Neo4jException e) {
            log.warn("Failed to create Neo4j indexes: {}", e.getMessage());
        }
    }

    @Override
    public GraphWriteResult createDocumentNode(String userId, String documentId) {
        return write("document node " + documentId, MERGE_DOCUMENT,
                Map.of("userId", userId, "documentId", documentId));
    }

    @Override
    public GraphWriteResult mergeEntities(String userId, String documentId, List<ExtractedGraph.Entity> entities) {
        List<Map<String, Object>> rows = entities.stream()
                .filter(entity -> entity.name() != null && !entity.name().isBlank())
                .map(entity -> row("name", entity.name(), "type", entity.type(), "description", entity.description()))
                .toList();
        if (rows.isEmpty()) {
            return GraphWriteResult.success(0, 0);
        }
        return write("entities of " + documentId, MERGE_ENTITIES,
                Map.of("userId", userId, "documentId", documentId, "entities", rows));
    }

    @Override
    public GraphWriteResult mergeRelationships(String userId, List<ExtractedGraph.Relationship> relationships) {
        List<Map<String, Object>> rows = relationships.stream()
                .filter(rel -> rel.source() != null && rel.target() != null)
                .map(rel -> row("source", rel.source(), "target", rel.target(),
                        "type", rel.type() == null ? "RELATED_TO" : rel.type(),
                        "description", rel.description(), "strength", rel.strength()))
                .toList();
        if (rows.isEmpty()) {
            return GraphWriteResult.success(0, 0);
        }
        return write("relationships", MERGE_RELATIONSHIPS, Map.of("userId", userId, "relationships", rows));
    }

    @Override
    public GraphWriteResult mergeThemes(String userId, String documentId, List<String> themes) {
        List<String> names = themes.stream().filter(theme -> theme != null && !theme.isBlank()).toList();
        if (names.isEmpty()) {
            return GraphWriteResult.success(0, 0);
        }
        return write("themes of " + documentId, MERGE_THEMES,
                Map.of("userId", userId, "documentId", documentId, "themes", names));
    }

    private GraphWriteResult write(String what, String cypher, Map<String, Object> parameters) {
        try (Session session = driver.session()) {
            SummaryCounters counters = session.executeWrite(tx -> tx.run(cypher, parameters).consume().counters());
            log.debug("Wrote {}: {} node(s), {} relationship(s)", what, counters.nodesCreated(), counters.relationshipsCreated());
            return GraphWriteResult.success(counters.nodesCreated(), counters.relationshipsCreated());
        } catch (Neo4jException e) {
            log.error("Failed to write {} to Neo4j: {}", what, e.getMessage());
            return GraphWriteResult.failure(e.getMessage());
        }
    }

    // Map.of rejects nulls; extracted descriptions are often missing
    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
