package com.openrangelabs.ingestor.scheduler;

import java.util.UUID;

/**
 * Trigger layer behind the job scheduler: recurring cron registrations plus one-off runs.
 *
 * <p>Implementations decide where triggers live (in-process timer, external queue); the
 * scheduler only relies on these three operations.
 */
public interface RecurringJobRegistrar {

    /**
     * Register or replace the recurring trigger for a job
     *
     * @throws com.openrangelabs.ingestor.exception.SchedulingException if the cron expression is invalid
     */
    void addOrUpdate(UUID jobId, String cronExpression, Runnable handler);

    void removeIfExists(UUID jobId);

    void enqueue(Runnable handler);

    boolean isRegistered(UUID jobId);
}
