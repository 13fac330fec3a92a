package com.openrangelabs.ingestor.extraction;

/**
 * Why an extraction did not succeed
 */
public enum FailureReason {
    NONE,
    ERROR,
    CANCELLED,
    TIMEOUT,
    /**
     * The stored change-tracking version is older than the backend retains; the caller must
     * run a full extraction before incremental sync can resume.
     */
    FULL_RELOAD_REQUIRED,
    INVALID_REQUEST
}
