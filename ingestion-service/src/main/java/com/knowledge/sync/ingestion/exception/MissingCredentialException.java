package com.knowledge.sync.ingestion.exception;

import com.knowledge.sync.shared.constant.APIMessages;

/**
 * The integration carries no usable access token. Redelivery cannot fix this.
 */
public class MissingCredentialException extends RuntimeException {

    public MissingCredentialException(String integrationId) {
        super(APIMessages.ERROR_MISSING_ACCESS_TOKEN + integrationId);
    }
}
