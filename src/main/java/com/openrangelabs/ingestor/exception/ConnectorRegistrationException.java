package com.openrangelabs.ingestor.exception;

/**
 * Exception thrown when a type cannot be registered as a connector, either because it
 * does not implement the connector contract or because its metadata is incomplete.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ConnectorRegistrationException extends IngestionException {

    public ConnectorRegistrationException(String message) {
        super(message);
    }

    public ConnectorRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
