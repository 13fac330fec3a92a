package com.openrangelabs.ingestor.exception;

/**
 * Exception raised when extraction fails or incremental sync state does not match the source.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ExtractionException extends IngestionException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
