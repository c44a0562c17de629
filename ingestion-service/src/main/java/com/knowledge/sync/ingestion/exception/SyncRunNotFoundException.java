package com.knowledge.sync.ingestion.exception;

import com.knowledge.sync.shared.constant.APIMessages;

import java.util.UUID;

public class SyncRunNotFoundException extends RuntimeException {

    public SyncRunNotFoundException(UUID syncId) {
        super(APIMessages.ERROR_SYNC_NOT_FOUND + syncId);
    }
}
