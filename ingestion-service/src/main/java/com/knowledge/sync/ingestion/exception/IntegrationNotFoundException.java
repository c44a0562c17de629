package com.knowledge.sync.ingestion.exception;

import com.knowledge.sync.shared.constant.APIMessages;

public class IntegrationNotFoundException extends RuntimeException {

    public IntegrationNotFoundException(String userId, String integrationId) {
        super(APIMessages.ERROR_INTEGRATION_NOT_FOUND + " for user " + userId + " and integration " + integrationId);
    }
}
