package com.knowledge.sync.ingestion.exception;

import com.knowledge.sync.shared.constant.APIMessages;

import java.time.Duration;
import java.util.UUID;

public class SyncTimeoutException extends RuntimeException {

    public SyncTimeoutException(UUID syncId, Duration timeout) {
        super(APIMessages.ERROR_SYNC_TIMEOUT + timeout.toSeconds() + "s (sync " + syncId + ")");
    }
}
