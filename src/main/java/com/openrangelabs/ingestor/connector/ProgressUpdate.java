package com.openrangelabs.ingestor.connector;

/**
 * Progress notification emitted during extraction. {@code total} is -1 when unknown.
 */
public record ProgressUpdate(String connectorId, String operation, long current, long total, String message) {

    public double percentComplete() {
        return total > 0 ? Math.min(100.0, current * 100.0 / total) : -1.0;
    }
}
