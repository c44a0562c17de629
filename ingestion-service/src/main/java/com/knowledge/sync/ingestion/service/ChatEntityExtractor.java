package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.model.ExtractedGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

/**
 * Asks the chat model for the entities, relationships and themes of a chunk as structured output.
 */
@Slf4j
@Service
public class ChatEntityExtractor implements EntityExtractor {

    private static final String SYSTEM_PROMPT = """
            Extract a knowledge graph from the user's text.
            entities: the people, organizations, places, products and concepts it names, each with a type and a one-sentence description.
            relationships: how those entities relate; source and target must be entity names, strength is between 0 and 1.
            themes: at most five short topic labels for the text.
            Use only information present in the text.
            """;

    private final ChatClient chatClient;

    public ChatEntityExtractor(ChatClient.Builder builder) {
        this.chatClient = builder.defaultSystem(SYSTEM_PROMPT).build();
    }

    @Override
    public ExtractedGraph extract(String text) {
        ExtractedGraph graph = chatClient.prompt()
                .user(text)
                .call()
                .entity(ExtractedGraph.class);
        if (graph == null) {
            log.warn("Chat model returned no graph for a chunk of {} chars", text.length());
            return ExtractedGraph.empty();
        }
        return graph;
    }
}
