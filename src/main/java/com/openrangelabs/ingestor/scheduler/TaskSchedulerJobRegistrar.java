package com.openrangelabs.ingestor.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * In-process trigger layer on Spring's {@link TaskScheduler}; cron triggers fire in the
 * configured time zone.
 */
@Component
public class TaskSchedulerJobRegistrar implements RecurringJobRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(TaskSchedulerJobRegistrar.class);

    private final TaskScheduler taskScheduler;
    private final ZoneId zone;
    private final boolean enabled;
    private final Map<UUID, ScheduledFuture<?>> triggers = new ConcurrentHashMap<>();

    @Autowired
    public TaskSchedulerJobRegistrar(TaskScheduler taskScheduler,
                                     @Value("${ingestion.scheduling.time-zone:UTC}") String timeZone,
                                     @Value("${ingestion.scheduling.enabled:true}") boolean enabled) {
        this.taskScheduler = taskScheduler;
        this.zone = ZoneId.of(timeZone);
        this.enabled = enabled;
    }

    @Override
    public void addOrUpdate(UUID jobId, String cronExpression, Runnable handler) {
        String expression = CronExpressions.normalize(cronExpression);
        if (!enabled) {
            logger.debug("Scheduling is disabled, not registering trigger for job {}", jobId);
            return;
        }

        ScheduledFuture<?> future = taskScheduler.schedule(handler, new CronTrigger(expression, zone));
        ScheduledFuture<?> previous = future != null ? triggers.put(jobId, future) : triggers.remove(jobId);
        if (previous != null) {
            previous.cancel(false);
        }
        logger.info("Registered recurring trigger for job {} with cron '{}' ({})", jobId, expression, zone);
    }

    @Override
    public void removeIfExists(UUID jobId) {
        ScheduledFuture<?> future = triggers.remove(jobId);
        if (future != null) {
            future.cancel(false);
            logger.info("Removed recurring trigger for job {}", jobId);
        }
    }

    @Override
    public void enqueue(Runnable handler) {
        taskScheduler.schedule(handler, Instant.now());
    }

    @Override
    public boolean isRegistered(UUID jobId) {
        return triggers.containsKey(jobId);
    }

    public ZoneId getZone() {
        return zone;
    }
}
