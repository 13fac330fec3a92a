package com.openrangelabs.ingestor.exception;

/**
 * Exception raised when a connector cannot be created, initialized or connected.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ConnectionException extends IngestionException {

    private final String connectorId;

    public ConnectionException(String connectorId, String message) {
        super(message);
        this.connectorId = connectorId;
    }

    public ConnectionException(String connectorId, String message, Throwable cause) {
        super(message, cause);
        this.connectorId = connectorId;
    }

    public String getConnectorId() {
        return connectorId;
    }
}
