package com.openrangelabs.ingestor.exception;

/**
 * Exception thrown when no connector is registered under an id or source type.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ConnectorNotFoundException extends IngestionException {

    public ConnectorNotFoundException(String idOrSourceType) {
        super(String.format("No connector registered for: %s", idOrSourceType));
    }
}
