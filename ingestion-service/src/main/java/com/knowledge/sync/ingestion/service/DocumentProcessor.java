package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.config.IngestionProperties;
import com.knowledge.sync.ingestion.exception.SyncInterruptedException;
import com.knowledge.sync.ingestion.model.ChunkingOutcome;
import com.knowledge.sync.ingestion.model.DocumentOutcome;
import com.knowledge.sync.ingestion.model.DocumentStatus;
import com.knowledge.sync.ingestion.model.ExternalFile;
import com.knowledge.sync.ingestion.model.KnowledgeDocument;
import com.knowledge.sync.ingestion.model.ProcessingStatus;
import com.knowledge.sync.ingestion.store.DocumentStore;
import com.knowledge.sync.shared.constant.APIMessages;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resumable per-document pipeline: metadata, content, chunks, entities.
 * <p>
 * The stored {@link DocumentStatus} is the last stage a document durably reached. Each call to
 * {@link #advance} runs exactly the next stage and persists the result before returning, so a crash
 * between stages resumes from the last persisted one.
 */
@Slf4j
@Service
public class DocumentProcessor {

    private static final char NUL = '\u0000';

    private final DocumentStore documentStore;
    private final ChunkExtractor chunkExtractor;
    private final IngestionProperties properties;
    private final Map<DocumentStatus, Stage> stages = new EnumMap<>(DocumentStatus.class);

    public DocumentProcessor(DocumentStore documentStore, ChunkExtractor chunkExtractor, IngestionProperties properties) {
        this.documentStore = documentStore;
        this.chunkExtractor = chunkExtractor;
        this.properties = properties;
        stages.put(DocumentStatus.META_DATA_FETCHED, this::fetchContent);
        stages.put(DocumentStatus.CONTENT_FETCHED, this::chunkAndExtract);
        stages.put(DocumentStatus.CHUNKING_SUCCEEDED, this::extractEntities);
    }

    /**
     * Runs the file through every remaining stage. Document failures are recorded on the document and
     * reported as {@link DocumentOutcome#FAILED}; only interruption propagates.
     */
    public DocumentOutcome process(DocumentTask task) {
        Optional<KnowledgeDocument> discovered = discover(task);
        if (discovered.isEmpty()) {
            return DocumentOutcome.SKIPPED;
        }

        KnowledgeDocument document = discovered.get();
        while (document.getProcessingStatus() == ProcessingStatus.PROCESSING) {
            document = advance(task, document);
        }
        return document.getProcessingStatus() == ProcessingStatus.SUCCESS
                ? DocumentOutcome.SUCCEEDED
                : DocumentOutcome.FAILED;
    }

    /**
     * Finds or creates the document for {@code task}'s file and marks it PROCESSING.
     *
     * @return empty when the document already succeeded and must be skipped
     */
    public Optional<KnowledgeDocument> discover(DocumentTask task) {
        ExternalFile file = task.file();
        Optional<KnowledgeDocument> existing = documentStore.findByOriginalFileId(task.userId(), file.id());
        if (existing.isPresent()) {
            return resume(existing.get());
        }

        try {
            KnowledgeDocument created = documentStore.create(newDocument(task));
            log.info("Discovered new document {} ({})", file.name(), file.id());
            return Optional.of(created);
        } catch (DuplicateKeyException e) {
            log.warn("Document {} was created concurrently, resuming the stored row", file.id());
            return documentStore.findByOriginalFileId(task.userId(), file.id()).flatMap(this::resume);
        }
    }

    /**
     * Executes the single stage implied by {@code document}'s status and returns the persisted result.
     */
    public KnowledgeDocument advance(DocumentTask task, KnowledgeDocument document) {
        Stage stage = stages.get(document.getStatus());
        if (stage == null) {
            log.warn("Document {} has unexpected status {} for retry", document.getOriginalFileId(), document.getStatus());
            String error = document.getError() != null
                    ? document.getError()
                    : APIMessages.ERROR_UNEXPECTED_STATUS + document.getStatus();
            return fail(document, error);
        }

        try {
            return stage.apply(task, document);
        } catch (SyncInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Stage {} failed for document {}: {}",
                    document.getStatus(), document.getOriginalFileId(), e.getMessage(), e);
            return fail(document, errorMessage(e));
        }
    }

    private Optional<KnowledgeDocument> resume(KnowledgeDocument document) {
        if (document.getProcessingStatus() == ProcessingStatus.SUCCESS) {
            log.debug("Skipping already processed document {}", document.getOriginalFileId());
            return Optional.empty();
        }

        log.info("Retrying document {} from {} (was {})",
                document.getOriginalFileId(), document.getStatus(), document.getProcessingStatus());
        KnowledgeDocument.KnowledgeDocumentBuilder retry = document.toBuilder()
                .processingStatus(ProcessingStatus.PROCESSING)
                .updatedAt(Instant.now());
        if (document.getProcessingStatus() == ProcessingStatus.FAILED) {
            retry.error(null);
        }
        return Optional.of(documentStore.update(retry.build()));
    }

    private KnowledgeDocument newDocument(DocumentTask task) {
        ExternalFile file = task.file();
        Instant now = Instant.now();
        return KnowledgeDocument.builder()
                .userId(task.userId())
                .integrationId(task.context().integrationId())
                .originalFileId(file.id())
                .fileName(file.name())
                .fileType(file.mimeType())
                .size(file.size())
                .address(file.webViewLink())
                .sourceType(task.sourceType())
                .createdAt(file.createdTime() != null ? file.createdTime() : now)
                .updatedAt(file.modifiedTime() != null ? file.modifiedTime() : now)
                .status(DocumentStatus.META_DATA_FETCHED)
                .processingStatus(ProcessingStatus.PROCESSING)
                .build();
    }

    private KnowledgeDocument fetchContent(DocumentTask task, KnowledgeDocument document) {
        String content = task.contentExtractor().extract(task.file());
        String cleaned = content == null ? "" : content.replace(String.valueOf(NUL), "");

        return documentStore.update(document.toBuilder()
                .content(cleaned)
                .status(DocumentStatus.CONTENT_FETCHED)
                .processingStatus(ProcessingStatus.PROCESSING)
                .build());
    }

    private KnowledgeDocument chunkAndExtract(DocumentTask task, KnowledgeDocument document) {
        ChunkingOutcome outcome = chunkExtractor.chunkAndExtract(task.userId(), document.getId(),
                document.getContent(), properties.getMaxTokens(), properties.getOverlapTokens());
        log.info("Document {} processed: chunking={}, entities={}",
                document.getId(), outcome.chunkingSucceeded(), outcome.extractionSucceeded());

        if (outcome.chunkingSucceeded() && outcome.extractionSucceeded()) {
            return complete(document);
        }
        if (outcome.chunkingSucceeded()) {
            return documentStore.update(document.toBuilder()
                    .status(DocumentStatus.CHUNKING_SUCCEEDED)
                    .processingStatus(ProcessingStatus.FAILED)
                    .error(APIMessages.ERROR_ENTITY_EXTRACTION_FAILED)
                    .build());
        }
        return fail(document, APIMessages.ERROR_CHUNKING_FAILED);
    }

    private KnowledgeDocument extractEntities(DocumentTask task, KnowledgeDocument document) {
        if (document.getContent() == null || document.getContent().isEmpty()) {
            log.error("Content missing for document {} in CHUNKING_SUCCEEDED state", document.getOriginalFileId());
            return fail(document, APIMessages.ERROR_CONTENT_MISSING);
        }

        boolean extracted = chunkExtractor.extractEntities(task.userId(), document.getId(),
                document.getContent(), properties.getMaxTokens(), properties.getOverlapTokens());
        return extracted ? complete(document) : fail(document, APIMessages.ERROR_ENTITY_EXTRACTION_FAILED);
    }

    private KnowledgeDocument complete(KnowledgeDocument document) {
        return documentStore.update(document.toBuilder()
                .status(DocumentStatus.COMPLETED)
                .processingStatus(ProcessingStatus.SUCCESS)
                .error(null)
                .build());
    }

    private KnowledgeDocument fail(KnowledgeDocument document, String error) {
        return documentStore.update(document.toBuilder()
                .processingStatus(ProcessingStatus.FAILED)
                .error(error)
                .build());
    }

    private static String errorMessage(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @FunctionalInterface
    private interface Stage {
        KnowledgeDocument apply(DocumentTask task, KnowledgeDocument document);
    }
}
