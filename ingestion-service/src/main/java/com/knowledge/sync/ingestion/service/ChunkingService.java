package com.knowledge.sync.ingestion.service;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.transformer.splitter.TokenTextSplitter;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Splits document text into token-bounded chunks. Each chunk after the first starts with the last
 * {@code overlapTokens} tokens of the previous one, and chunk ids depend only on document id and position.
 */
@Slf4j
@Service
public class ChunkingService {

    public static final String META_USER_ID = "user_id";
    public static final String META_DOCUMENT_ID = "document_id";
    public static final String META_CHUNK_INDEX = "chunk_index";

    private static final int MIN_CHUNK_SIZE_CHARS = 350;
    private static final int MIN_CHUNK_LENGTH_TO_EMBED = 5;
    private static final int MAX_NUM_CHUNKS = 10000;

    private final Encoding encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);

    public List<Document> split(String userId, String documentId, String text, int maxTokens, int overlapTokens) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        int overlap = Math.max(0, Math.min(overlapTokens, maxTokens - 1));
        TokenTextSplitter splitter = new TokenTextSplitter(
                maxTokens - overlap, MIN_CHUNK_SIZE_CHARS, MIN_CHUNK_LENGTH_TO_EMBED, MAX_NUM_CHUNKS, true);
        List<Document> pieces = splitter.apply(List.of(new Document(text)));

        List<Document> chunks = new ArrayList<>(pieces.size());
        String previous = null;
        for (int i = 0; i < pieces.size(); i++) {
            String piece = pieces.get(i).getText();
            String chunkText = previous == null || overlap == 0
                    ? piece
                    : (tail(previous, overlap) + "\n" + piece).strip();
            chunks.add(new Document(chunkId(documentId, i), chunkText, Map.of(
                    META_USER_ID, userId,
                    META_DOCUMENT_ID, documentId,
                    META_CHUNK_INDEX, i)));
            previous = piece;
        }

        log.debug("Split document {} into {} chunk(s) of at most {} tokens", documentId, chunks.size(), maxTokens);
        return chunks;
    }

    static String chunkId(String documentId, int index) {
        return UUID.nameUUIDFromBytes((documentId + ":" + index).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private String tail(String text, int tokens) {
        IntArrayList encoded = encoding.encode(text);
        int from = Math.max(0, encoded.size() - tokens);
        IntArrayList tail = new IntArrayList(encoded.size() - from);
        for (int i = from; i < encoded.size(); i++) {
            tail.add(encoded.get(i));
        }
        return encoding.decode(tail);
    }
}
