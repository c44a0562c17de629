package com.knowledge.sync.ingestion.exception;

/**
 * A queue message that can never become valid. Dropped, never retried.
 */
public class MessageValidationException extends RuntimeException {

    public MessageValidationException(String message) {
        super(message);
    }
}
