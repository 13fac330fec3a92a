package com.openrangelabs.ingestor.exception;

/**
 * Base exception for ingestion framework failures.
 *
 * <p>Expected operational failures (bad credentials, unreachable hosts, malformed filters)
 * travel as typed result objects; this hierarchy is raised for failures that must abort
 * the current operation.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
