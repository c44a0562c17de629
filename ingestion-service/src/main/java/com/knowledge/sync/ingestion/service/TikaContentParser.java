package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.reader.tika.TikaDocumentReader;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns downloaded file bytes into plain text with Apache Tika.
 */
@Slf4j
@Service
public class TikaContentParser {

    public String parse(byte[] content, String fileName) {
        if (content == null || content.length == 0) {
            return "";
        }

        ByteArrayResource resource = new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return fileName;
            }
        };

        try {
            List<Document> documents = new TikaDocumentReader(resource).get();
            log.debug("Parsed {} into {} section(s)", fileName, documents.size());
            return documents.stream()
                    .map(Document::getText)
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining("\n"));
        } catch (RuntimeException e) {
            throw new ExtractionException("Failed to parse " + fileName + ": " + e.getMessage(), e);
        }
    }
}
