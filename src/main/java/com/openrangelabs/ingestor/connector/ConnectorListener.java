package com.openrangelabs.ingestor.connector;

/**
 * Observer for connector lifecycle, progress and error events. Callbacks run on the
 * thread that raised the event and must not block.
 */
public interface ConnectorListener {

    default void onStateChanged(String connectorId, ConnectionState oldState, ConnectionState newState) {
    }

    default void onProgress(ProgressUpdate progress) {
    }

    default void onError(String connectorId, String operation, String message, Throwable error) {
    }
}
