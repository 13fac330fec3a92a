package com.openrangelabs.ingestor.exception;

/**
 * Extraction parameters that cannot be honoured: a malformed or foreign continuation
 * token, a missing tracking field, several targets for one cursor.
 */
public class InvalidExtractionRequestException extends ExtractionException {

    public InvalidExtractionRequestException(String message) {
        super(message);
    }

    public InvalidExtractionRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
