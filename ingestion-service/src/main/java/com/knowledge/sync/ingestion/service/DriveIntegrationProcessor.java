package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.client.DriveClient;
import com.knowledge.sync.ingestion.exception.MissingCredentialException;
import com.knowledge.sync.ingestion.exception.SyncInterruptedException;
import com.knowledge.sync.ingestion.model.DocumentOutcome;
import com.knowledge.sync.ingestion.model.ExternalFile;
import com.knowledge.sync.ingestion.model.IntegrationType;
import com.knowledge.sync.ingestion.model.SyncContext;
import com.knowledge.sync.ingestion.model.SyncSummary;
import com.knowledge.sync.ingestion.store.IntegrationAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;

/**
 * Incremental Google Drive sync: lists files changed since the stored checkpoint and runs the text
 * documents among them through the {@link DocumentProcessor}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriveIntegrationProcessor implements IntegrationProcessor {

    static final String CREDENTIAL_ACCESS_TOKEN = "access_token";
    static final String SOURCE_TYPE = "google_drive";

    static final Set<String> DOCUMENT_TYPES = Set.of(
            "application/vnd.google-apps.document",
            "application/vnd.google-apps.presentation",
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/vnd.openxmlformats-officedocument.presentationml.presentation",
            "application/rtf",
            "text/plain",
            "text/markdown",
            "text/html");

    static final Set<String> SPREADSHEET_TYPES = Set.of(
            "application/vnd.google-apps.spreadsheet",
            "application/vnd.ms-excel",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "text/csv");

    private final DriveClient driveClient;
    private final TikaContentParser contentParser;
    private final DocumentProcessor documentProcessor;
    private final IntegrationAdapter integrationAdapter;

    @Override
    public IntegrationType type() {
        return IntegrationType.GOOGLE_DRIVE;
    }

    @Override
    public SyncSummary process(SyncContext context) {
        String accessToken = context.integration().credentialValue(CREDENTIAL_ACCESS_TOKEN);
        if (accessToken == null || accessToken.isBlank()) {
            throw new MissingCredentialException(context.integrationId());
        }

        Instant checkpoint = readCheckpoint(context);
        List<ExternalFile> files = driveClient.listFiles(accessToken, checkpoint);
        log.info("Found {} Drive file(s) for sync {}", files.size(), context.syncId());

        ContentExtractor extractor = file -> contentParser.parse(driveClient.download(accessToken, file), file.name());
        int processed = 0;
        int failed = 0;
        int skipped = 0;

        for (ExternalFile file : files) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SyncInterruptedException(context.syncId());
            }

            String mimeType = file.mimeType() == null ? "" : file.mimeType();
            if (DOCUMENT_TYPES.contains(mimeType)) {
                DocumentOutcome outcome = documentProcessor.process(new DocumentTask(context, file, extractor, SOURCE_TYPE));
                switch (outcome) {
                    case SUCCEEDED -> processed++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                }
            } else if (SPREADSHEET_TYPES.contains(mimeType)) {
                log.info("Spreadsheet {} not ingested yet, skipping", file.name());
                skipped++;
            } else if (mimeType.startsWith("image/")) {
                log.info("Image {} not ingested yet, skipping", file.name());
                skipped++;
            } else {
                log.debug("Skipping unsupported file type {} for {}", mimeType, file.name());
                skipped++;
            }
        }

        log.info("Drive sync {} finished: processed={}, failed={}, skipped={}, total={}",
                context.syncId(), processed, failed, skipped, files.size());

        if (failed == 0) {
            integrationAdapter.updateCheckpoint(context.userId(), context.integrationId(), context.startedAt().toString());
        } else {
            log.warn("Keeping checkpoint of integration {}: {} file(s) failed and will be retried next sync",
                    context.integrationId(), failed);
        }
        return new SyncSummary(processed, failed, skipped, files.size());
    }

    private Instant readCheckpoint(SyncContext context) {
        return integrationAdapter.getCheckpoint(context.userId(), context.integrationId())
                .filter(value -> !value.isBlank())
                .map(value -> {
                    try {
                        return Instant.parse(value);
                    } catch (DateTimeParseException e) {
                        log.warn("Ignoring unreadable checkpoint '{}' of integration {}", value, context.integrationId());
                        return null;
                    }
                })
                .orElse(null);
    }
}
