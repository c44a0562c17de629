package com.knowledge.sync.ingestion.exception;

/**
 * Fetching or parsing external content failed. Usually transient.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
