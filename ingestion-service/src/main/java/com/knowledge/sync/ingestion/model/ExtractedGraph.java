package com.knowledge.sync.ingestion.model;

import java.util.List;

/**
 * Entities, relationships and themes found in one chunk of text.
 */
public record ExtractedGraph(
        List<Entity> entities,
        List<Relationship> relationships,
        List<String> themes) {

    public static ExtractedGraph empty() {
        return new ExtractedGraph(List.of(), List.of(), List.of());
    }

    public List<Entity> entitiesOrEmpty() {
        return entities == null ? List.of() : entities;
    }

    public List<Relationship> relationshipsOrEmpty() {
        return relationships == null ? List.of() : relationships;
    }

    public List<String> themesOrEmpty() {
        return themes == null ? List.of() : themes;
    }

    public record Entity(String name, String type, String description) {
    }

    public record Relationship(String source, String target, String type, String description, double strength) {
    }
}
