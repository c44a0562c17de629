package com.knowledge.sync.ingestion.model;

import java.time.Instant;

/**
 * A file as listed by an external source, before anything is stored about it.
 */
public record ExternalFile(
        String id,
        String name,
        String mimeType,
        Long size,
        String webViewLink,
        Instant createdTime,
        Instant modifiedTime) {
}
