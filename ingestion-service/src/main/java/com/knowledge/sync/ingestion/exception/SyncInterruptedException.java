package com.knowledge.sync.ingestion.exception;

import com.knowledge.sync.shared.constant.APIMessages;

import java.util.UUID;

/**
 * The thread running a sync was interrupted. The run is left PROCESSING so redelivery resumes it.
 */
public class SyncInterruptedException extends RuntimeException {

    public SyncInterruptedException(UUID syncId) {
        super(APIMessages.ERROR_SYNC_INTERRUPTED + " (sync " + syncId + ")");
    }

    public SyncInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
