package com.openrangelabs.ingestor.exception;

import java.util.UUID;

/**
 * Exception thrown when a job definition does not exist.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class JobNotFoundException extends SchedulingException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super(String.format("Ingestion job not found with ID: %s", jobId));
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
