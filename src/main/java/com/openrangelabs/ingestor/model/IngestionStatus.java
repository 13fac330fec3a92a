package com.openrangelabs.ingestor.model;

/**
 * Lifecycle status of an ingestion job definition
 *
 * <p>{@code PAUSED} is reported in notifications and mirrors the job's pause flag; the flag is
 * what suppresses triggers.
 */
public enum IngestionStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    PAUSED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
