package com.openrangelabs.ingestor.exception;

/**
 * Exception thrown for invalid scheduling requests: bad cron expressions,
 * pausing a paused job, resuming a running one, triggering a paused job.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class SchedulingException extends IngestionException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
