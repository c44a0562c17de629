package com.knowledge.sync.ingestion.exception;

import com.knowledge.sync.shared.constant.APIMessages;

public class IntegrationInactiveException extends RuntimeException {

    public IntegrationInactiveException(String integrationId) {
        super(APIMessages.ERROR_INTEGRATION_INACTIVE + integrationId);
    }
}
