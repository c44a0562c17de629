package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.config.IngestionProperties;
import com.knowledge.sync.ingestion.exception.ExtractionException;
import com.knowledge.sync.ingestion.exception.SyncInterruptedException;
import com.knowledge.sync.ingestion.model.ChunkingOutcome;
import com.knowledge.sync.ingestion.model.DocumentOutcome;
import com.knowledge.sync.ingestion.model.DocumentStatus;
import com.knowledge.sync.ingestion.model.ExternalFile;
import com.knowledge.sync.ingestion.model.Integration;
import com.knowledge.sync.ingestion.model.IntegrationType;
import com.knowledge.sync.ingestion.model.KnowledgeDocument;
import com.knowledge.sync.ingestion.model.ProcessingStatus;
import com.knowledge.sync.ingestion.model.SyncContext;
import com.knowledge.sync.shared.constant.APIMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentProcessorTest {

    private static final String USER_ID = "user-1";

    @Mock
    private ChunkExtractor chunkExtractor;

    @Mock
    private ContentExtractor contentExtractor;

    private InMemoryDocumentStore documentStore;
    private DocumentProcessor documentProcessor;
    private ExternalFile file;
    private DocumentTask task;

    @BeforeEach
    void setUp() {
        documentStore = new InMemoryDocumentStore();
        documentProcessor = new DocumentProcessor(documentStore, chunkExtractor, new IngestionProperties());

        Integration integration = Integration.builder().id("int-1").userId(USER_ID).type(IntegrationType.GOOGLE_DRIVE).build();
        SyncContext context = new SyncContext(USER_ID, UUID.randomUUID(), integration, Instant.now());
        file = new ExternalFile("file-1", "Notes.pdf", "application/pdf", 2048L,
                "https://drive.example/file-1", Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"));
        task = new DocumentTask(context, file, contentExtractor, "google_drive");
    }

    @Test
    @DisplayName("A new file passes through every stage and each stage is persisted")
    void newFileRunsAllStages() {
        // Given
        when(contentExtractor.extract(file)).thenReturn("hello\u0000 world");
        when(chunkExtractor.chunkAndExtract(eq(USER_ID), anyString(), eq("hello world"), eq(1024), eq(128)))
                .thenReturn(new ChunkingOutcome(true, true));

        // When
        DocumentOutcome outcome = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.SUCCEEDED, outcome);
        KnowledgeDocument stored = documentStore.get(USER_ID, "file-1");
        assertEquals(DocumentStatus.COMPLETED, stored.getStatus());
        assertEquals(ProcessingStatus.SUCCESS, stored.getProcessingStatus());
        assertEquals("hello world", stored.getContent());
        assertEquals("int-1", stored.getIntegrationId());
        assertEquals("https://drive.example/file-1", stored.getAddress());
        assertNull(stored.getError());

        List<DocumentStatus> persisted = documentStore.writes().stream().map(KnowledgeDocument::getStatus).toList();
        assertEquals(List.of(DocumentStatus.META_DATA_FETCHED, DocumentStatus.CONTENT_FETCHED, DocumentStatus.COMPLETED), persisted);
    }

    @Test
    @DisplayName("A FAILED document at CONTENT_FETCHED resumes from chunking and ends COMPLETED with no error")
    void failedContentFetchedDocumentResumes() {
        // Given
        documentStore.seed(document(DocumentStatus.CONTENT_FETCHED, ProcessingStatus.FAILED, "stored text", "timeout"));
        when(chunkExtractor.chunkAndExtract(eq(USER_ID), anyString(), eq("stored text"), anyInt(), anyInt()))
                .thenReturn(new ChunkingOutcome(true, true));

        // When
        DocumentOutcome outcome = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.SUCCEEDED, outcome);
        KnowledgeDocument stored = documentStore.get(USER_ID, "file-1");
        assertEquals(DocumentStatus.COMPLETED, stored.getStatus());
        assertEquals(ProcessingStatus.SUCCESS, stored.getProcessingStatus());
        assertNull(stored.getError());
        verifyNoInteractions(contentExtractor);

        KnowledgeDocument firstWrite = documentStore.writes().get(0);
        assertEquals(ProcessingStatus.PROCESSING, firstWrite.getProcessingStatus());
        assertNull(firstWrite.getError());
    }

    @Test
    @DisplayName("A CHUNKING_SUCCEEDED document only re-runs entity extraction")
    void chunkingSucceededDocumentOnlyExtractsEntities() {
        // Given
        documentStore.seed(document(DocumentStatus.CHUNKING_SUCCEEDED, ProcessingStatus.FAILED, "stored text",
                APIMessages.ERROR_ENTITY_EXTRACTION_FAILED));
        when(chunkExtractor.extractEntities(eq(USER_ID), anyString(), eq("stored text"), anyInt(), anyInt())).thenReturn(true);

        // When
        DocumentOutcome outcome = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.SUCCEEDED, outcome);
        assertEquals(DocumentStatus.COMPLETED, documentStore.get(USER_ID, "file-1").getStatus());
        verify(chunkExtractor, never()).chunkAndExtract(anyString(), anyString(), anyString(), anyInt(), anyInt());
        verifyNoInteractions(contentExtractor);
    }

    @Test
    @DisplayName("A CHUNKING_SUCCEEDED document without content fails without calling any extractor")
    void chunkingSucceededWithoutContentFails() {
        // Given
        documentStore.seed(document(DocumentStatus.CHUNKING_SUCCEEDED, ProcessingStatus.FAILED, null, "earlier error"));

        // When
        DocumentOutcome outcome = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.FAILED, outcome);
        KnowledgeDocument stored = documentStore.get(USER_ID, "file-1");
        assertEquals(DocumentStatus.CHUNKING_SUCCEEDED, stored.getStatus());
        assertEquals(ProcessingStatus.FAILED, stored.getProcessingStatus());
        assertEquals(APIMessages.ERROR_CONTENT_MISSING, stored.getError());
        verifyNoInteractions(chunkExtractor, contentExtractor);
    }

    @Test
    @DisplayName("Chunking success with extraction failure is stored as CHUNKING_SUCCEEDED / FAILED")
    void partialSuccessIsPersisted() {
        // Given
        when(contentExtractor.extract(file)).thenReturn("text");
        when(chunkExtractor.chunkAndExtract(anyString(), anyString(), anyString(), anyInt(), anyInt()))
                .thenReturn(new ChunkingOutcome(true, false));

        // When
        DocumentOutcome outcome = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.FAILED, outcome);
        KnowledgeDocument stored = documentStore.get(USER_ID, "file-1");
        assertEquals(DocumentStatus.CHUNKING_SUCCEEDED, stored.getStatus());
        assertEquals(ProcessingStatus.FAILED, stored.getProcessingStatus());
        assertEquals(APIMessages.ERROR_ENTITY_EXTRACTION_FAILED, stored.getError());
        assertEquals("text", stored.getContent());
    }

    @Test
    @DisplayName("Chunking failure keeps the document at CONTENT_FETCHED")
    void chunkingFailureStaysAtContentFetched() {
        // Given
        when(contentExtractor.extract(file)).thenReturn("text");
        when(chunkExtractor.chunkAndExtract(anyString(), anyString(), anyString(), anyInt(), anyInt()))
                .thenReturn(ChunkingOutcome.chunkingFailed());

        // When
        DocumentOutcome outcome = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.FAILED, outcome);
        KnowledgeDocument stored = documentStore.get(USER_ID, "file-1");
        assertEquals(DocumentStatus.CONTENT_FETCHED, stored.getStatus());
        assertEquals(APIMessages.ERROR_CHUNKING_FAILED, stored.getError());
    }

    @Test
    @DisplayName("A content fetch error is recorded on the document instead of thrown")
    void contentFetchErrorIsRecorded() {
        // Given
        when(contentExtractor.extract(file)).thenThrow(new ExtractionException("Drive download timed out"));

        // When
        DocumentOutcome outcome = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.FAILED, outcome);
        KnowledgeDocument stored = documentStore.get(USER_ID, "file-1");
        assertEquals(DocumentStatus.META_DATA_FETCHED, stored.getStatus());
        assertEquals(ProcessingStatus.FAILED, stored.getProcessingStatus());
        assertEquals("Drive download timed out", stored.getError());
        verifyNoInteractions(chunkExtractor);
    }

    @Test
    @DisplayName("Discovering a file twice never creates a second document")
    void duplicateDiscoveryIsSafe() {
        // Given
        when(contentExtractor.extract(file)).thenReturn("text");
        when(chunkExtractor.chunkAndExtract(anyString(), anyString(), anyString(), anyInt(), anyInt()))
                .thenReturn(new ChunkingOutcome(true, true));
        documentProcessor.process(task);
        int writesAfterFirstRun = documentStore.writes().size();

        // When
        DocumentOutcome second = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.SKIPPED, second);
        assertEquals(1, documentStore.size());
        assertEquals(writesAfterFirstRun, documentStore.writes().size());
    }

    @Test
    @DisplayName("A concurrent insert of the same file resumes the stored row")
    void concurrentInsertResumesStoredRow() {
        // Given
        documentStore.seed(document(DocumentStatus.META_DATA_FETCHED, ProcessingStatus.PROCESSING, null, null));
        documentStore.hideNextLookup();

        // When
        Optional<KnowledgeDocument> discovered = documentProcessor.discover(task);

        // Then
        assertTrue(discovered.isPresent());
        assertEquals(DocumentStatus.META_DATA_FETCHED, discovered.get().getStatus());
        assertEquals(1, documentStore.size());
    }

    @Test
    @DisplayName("Interruption propagates and leaves the document PROCESSING")
    void interruptionPropagates() {
        // Given
        UUID syncId = task.context().syncId();
        when(contentExtractor.extract(file)).thenThrow(new SyncInterruptedException(syncId));

        // When / Then
        assertThrows(SyncInterruptedException.class, () -> documentProcessor.process(task));
        KnowledgeDocument stored = documentStore.get(USER_ID, "file-1");
        assertEquals(DocumentStatus.META_DATA_FETCHED, stored.getStatus());
        assertEquals(ProcessingStatus.PROCESSING, stored.getProcessingStatus());
    }

    @Test
    @DisplayName("A FAILED document whose stage is already COMPLETED is failed as an unexpected status")
    void completedButFailedDocumentIsUnexpected() {
        // Given
        documentStore.seed(document(DocumentStatus.COMPLETED, ProcessingStatus.FAILED, "text", "old"));

        // When
        DocumentOutcome outcome = documentProcessor.process(task);

        // Then
        assertEquals(DocumentOutcome.FAILED, outcome);
        assertEquals(APIMessages.ERROR_UNEXPECTED_STATUS + DocumentStatus.COMPLETED,
                documentStore.get(USER_ID, "file-1").getError());
        verifyNoInteractions(chunkExtractor, contentExtractor);
    }

    @Test
    @DisplayName("advance runs exactly one stage")
    void advanceRunsOneStage() {
        // Given
        KnowledgeDocument document = documentStore.seed(
                document(DocumentStatus.META_DATA_FETCHED, ProcessingStatus.PROCESSING, null, null));
        when(contentExtractor.extract(any())).thenReturn("text");

        // When
        KnowledgeDocument advanced = documentProcessor.advance(task, document);

        // Then
        assertEquals(DocumentStatus.CONTENT_FETCHED, advanced.getStatus());
        assertEquals(ProcessingStatus.PROCESSING, advanced.getProcessingStatus());
        verifyNoInteractions(chunkExtractor);
    }

    private KnowledgeDocument document(DocumentStatus status, ProcessingStatus processingStatus, String content, String error) {
        return KnowledgeDocument.builder()
                .id("doc-1")
                .userId(USER_ID)
                .integrationId("int-1")
                .originalFileId("file-1")
                .fileName("Notes.pdf")
                .status(status)
                .processingStatus(processingStatus)
                .content(content)
                .error(error)
                .build();
    }
}
