package com.openrangelabs.ingestor.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.ConnectorConfiguration;
import com.openrangelabs.ingestor.connector.DataSourceConnector;
import com.openrangelabs.ingestor.entity.DataSource;
import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import com.openrangelabs.ingestor.exception.ConnectionException;
import com.openrangelabs.ingestor.exception.ExtractionException;
import com.openrangelabs.ingestor.exception.IngestionException;
import com.openrangelabs.ingestor.exception.JobNotFoundException;
import com.openrangelabs.ingestor.exception.OperationCancelledException;
import com.openrangelabs.ingestor.exception.SchedulingException;
import com.openrangelabs.ingestor.exception.TransformationException;
import com.openrangelabs.ingestor.extraction.ContinuationToken;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.ExtractionResult;
import com.openrangelabs.ingestor.extraction.FailureReason;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.IngestionStatus;
import com.openrangelabs.ingestor.notification.JobNotificationService;
import com.openrangelabs.ingestor.registry.ConnectorFactory;
import com.openrangelabs.ingestor.repository.DataSourceRepository;
import com.openrangelabs.ingestor.repository.IngestionJobDefinitionRepository;
import com.openrangelabs.ingestor.transformation.TransformationEngine;
import com.openrangelabs.ingestor.transformation.TransformationParameters;
import com.openrangelabs.ingestor.transformation.TransformationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Schedules ingestion jobs and runs them
 *
 * <p>A run connects to the job's data source, extracts, optionally transforms and hands the
 * rows to every {@link ExtractedDataSink}. Failures never escape {@link #executeJob(UUID)}: they
 * become a FAILED status, a failure notification and, once the retry budget is spent, an
 * automatic pause that also removes the recurring trigger. Re-running a failed job is left to
 * the next trigger.
 */
@Service
public class IngestionJobScheduler {

    private static final Logger logger = LoggerFactory.getLogger(IngestionJobScheduler.class);

    private final IngestionJobDefinitionRepository jobRepository;
    private final DataSourceRepository dataSourceRepository;
    private final RecurringJobRegistrar registrar;
    private final JobNotificationService notificationService;
    private final ConnectorFactory connectorFactory;
    private final DataSourceParameterResolver parameterResolver;
    private final TransformationEngine transformationEngine;
    private final ObjectProvider<ExtractedDataSink> sinks;
    private final ObjectMapper objectMapper;

    // One run per job within this process
    private final Map<UUID, CancellationSignal> runningJobs = new ConcurrentHashMap<>();
    // Deleted while a run was in flight; that run must not write the job back
    private final Set<UUID> deletedWhileRunning = ConcurrentHashMap.newKeySet();

    @Autowired
    public IngestionJobScheduler(IngestionJobDefinitionRepository jobRepository,
                                 DataSourceRepository dataSourceRepository,
                                 RecurringJobRegistrar registrar,
                                 JobNotificationService notificationService,
                                 ConnectorFactory connectorFactory,
                                 DataSourceParameterResolver parameterResolver,
                                 TransformationEngine transformationEngine,
                                 ObjectProvider<ExtractedDataSink> sinks,
                                 ObjectMapper objectMapper) {
        this.jobRepository = jobRepository;
        this.dataSourceRepository = dataSourceRepository;
        this.registrar = registrar;
        this.notificationService = notificationService;
        this.connectorFactory = connectorFactory;
        this.parameterResolver = parameterResolver;
        this.transformationEngine = transformationEngine;
        this.sinks = sinks;
        this.objectMapper = objectMapper;
    }

    /**
     * Re-register recurring triggers for every active job after startup
     */
    @EventListener(ApplicationReadyEvent.class)
    public void restoreTriggers() {
        jobRepository.findSchedulable()
                .doOnNext(this::registerTrigger)
                .count()
                .subscribe(
                        count -> logger.info("Restored {} recurring ingestion triggers", count),
                        error -> logger.error("Failed to restore recurring ingestion triggers: {}", error.getMessage(), error)
                );
    }

    public Mono<IngestionJobDefinition> schedule(IngestionJobDefinition job) {
        Objects.requireNonNull(job, "job");
        return Mono.defer(() -> {
            if (job.isRecurring()) {
                job.setCronExpression(job.getCronExpression().trim());
                CronExpressions.normalize(job.getCronExpression());
            }
            logger.info("Scheduling ingestion job '{}' for data source {}", job.getName(), job.getDataSourceId());
            job.setId(null);
            job.setStatus(job.isPaused() ? IngestionStatus.PAUSED.name() : IngestionStatus.SCHEDULED.name());
            job.setFailureCount(0);
            if (job.getMaxRetryCount() == null) {
                job.setMaxRetryCount(IngestionJobDefinition.DEFAULT_MAX_RETRY_COUNT);
            }
            job.setCreatedAt(LocalDateTime.now());
            job.touch();
            return jobRepository.save(job);
        }).doOnNext(saved -> {
            if (saved.isRecurring() && !saved.isPaused()) {
                registerTrigger(saved);
            }
            logger.info("Ingestion job scheduled with ID: {}", saved.getId());
        });
    }

    public Mono<IngestionJobDefinition> getJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)));
    }

    public Flux<IngestionJobDefinition> getJobsForTenant(UUID tenantId) {
        return jobRepository.findByTenantId(tenantId);
    }

    /**
     * Replace the editable settings of a job; the trigger is re-registered when the cron
     * expression or the pause flag changed
     */
    public Mono<IngestionJobDefinition> update(UUID jobId, IngestionJobDefinition changes) {
        return getJob(jobId).flatMap(existing -> {
            if (changes.isRecurring()) {
                CronExpressions.normalize(changes.getCronExpression());
            }
            boolean cronChanged = !Objects.equals(existing.getCronExpression(), changes.getCronExpression());
            boolean pauseChanged = existing.isPaused() != changes.isPaused();

            existing.setName(changes.getName());
            existing.setDescription(changes.getDescription());
            existing.setDataSourceId(changes.getDataSourceId());
            existing.setCronExpression(changes.getCronExpression());
            existing.setPaused(changes.isPaused());
            if (changes.getMaxRetryCount() != null) {
                existing.setMaxRetryCount(changes.getMaxRetryCount());
            }
            existing.setNotificationConfigJson(changes.getNotificationConfigJson());
            existing.setExtractionParametersJson(changes.getExtractionParametersJson());
            existing.setTransformationParametersJson(changes.getTransformationParametersJson());
            if (pauseChanged) {
                existing.setStatus(changes.isPaused() ? IngestionStatus.PAUSED.name() : IngestionStatus.SCHEDULED.name());
            }
            existing.touch();

            return jobRepository.save(existing).doOnNext(saved -> {
                if (cronChanged || pauseChanged) {
                    refreshTrigger(saved);
                }
            });
        });
    }

    public Mono<IngestionJobDefinition> pause(UUID jobId) {
        return getJob(jobId).flatMap(job -> {
            if (job.isPaused()) {
                return Mono.error(new SchedulingException("Job " + jobId + " is already paused"));
            }
            job.setPaused(true);
            job.markStatus(IngestionStatus.PAUSED, null);
            return jobRepository.save(job);
        }).doOnNext(saved -> {
            registrar.removeIfExists(jobId);
            logger.info("Paused ingestion job {}", jobId);
        });
    }

    /**
     * Resume a paused job with a fresh retry budget
     */
    public Mono<IngestionJobDefinition> resume(UUID jobId) {
        return getJob(jobId).flatMap(job -> {
            if (!job.isPaused()) {
                return Mono.error(new SchedulingException("Job " + jobId + " is not paused"));
            }
            job.setPaused(false);
            job.setFailureCount(0);
            job.markStatus(IngestionStatus.SCHEDULED, null);
            return jobRepository.save(job);
        }).doOnNext(saved -> {
            if (saved.isRecurring()) {
                registerTrigger(saved);
            }
            logger.info("Resumed ingestion job {}", jobId);
        });
    }

    /**
     * Queue one immediate run; paused jobs are rejected
     */
    public Mono<Void> triggerNow(UUID jobId) {
        return getJob(jobId).flatMap(job -> {
            if (job.isPaused()) {
                return Mono.error(new SchedulingException("Cannot trigger paused job " + jobId));
            }
            logger.info("Triggering immediate execution of job {}", jobId);
            registrar.enqueue(() -> runDetached(jobId));
            return Mono.<Void>empty();
        });
    }

    /**
     * Request cancellation of a running job
     *
     * @return true if the job was running in this process
     */
    public boolean cancel(UUID jobId) {
        CancellationSignal signal = runningJobs.get(jobId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        logger.info("Cancellation requested for job {}", jobId);
        return true;
    }

    public Mono<Void> delete(UUID jobId) {
        return getJob(jobId).flatMap(job -> {
            logger.info("Deleting ingestion job {}", jobId);
            registrar.removeIfExists(jobId);
            if (runningJobs.containsKey(jobId)) {
                deletedWhileRunning.add(jobId);
                cancel(jobId);
            }
            return jobRepository.delete(job);
        });
    }

    public boolean isRunning(UUID jobId) {
        return runningJobs.containsKey(jobId);
    }

    /**
     * Run a job once
     *
     * <p>Completes empty when the job does not exist, is paused or is already running here.
     * Otherwise emits the job as persisted after the run. Never signals an error.
     */
    public Mono<IngestionJobDefinition> executeJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .switchIfEmpty(Mono.defer(() -> {
                    logger.error("Job {} not found during execution", jobId);
                    return Mono.empty();
                }))
                .filter(job -> {
                    if (job.isPaused()) {
                        logger.warn("Cannot execute paused job: {}", jobId);
                        return false;
                    }
                    return true;
                })
                .flatMap(job -> {
                    CancellationSignal signal = CancellationSignal.create();
                    if (runningJobs.putIfAbsent(jobId, signal) != null) {
                        logger.warn("Job {} is already running, skipping this trigger", jobId);
                        return Mono.empty();
                    }
                    logger.info("Starting execution of job {}", jobId);
                    return markRunning(job)
                            .flatMap(running -> run(running, signal))
                            .onErrorResume(error -> handleFailure(job, error))
                            .doFinally(s -> {
                                runningJobs.remove(jobId);
                                deletedWhileRunning.remove(jobId);
                            });
                })
                .onErrorResume(error -> {
                    logger.error("Unexpected error while executing job {}: {}", jobId, error.getMessage(), error);
                    return Mono.empty();
                });
    }

    private Mono<IngestionJobDefinition> markRunning(IngestionJobDefinition job) {
        job.markStatus(IngestionStatus.RUNNING, null);
        job.setLastExecutionTime(LocalDateTime.now());
        return jobRepository.save(job);
    }

    private Mono<IngestionJobDefinition> run(IngestionJobDefinition job, CancellationSignal signal) {
        return dataSourceRepository.findById(job.getDataSourceId())
                .switchIfEmpty(Mono.error(new IngestionException("Data source not found: " + job.getDataSourceId())))
                .flatMap(dataSource -> parameterResolver.resolve(dataSource)
                        .flatMap(parameters -> Mono.using(
                                () -> connectorFactory.createForSourceType(dataSource.getSourceType()),
                                connector -> ingest(job, dataSource, connector, parameters, signal),
                                DataSourceConnector::close)))
                .flatMap(outcome -> complete(job, outcome));
    }

    private Mono<RunOutcome> ingest(IngestionJobDefinition job, DataSource dataSource, DataSourceConnector connector,
                                    Map<String, String> parameters, CancellationSignal signal) {
        ConnectorConfiguration configuration =
                new ConnectorConfiguration(connector.getId(), dataSource.getName(), job.getTenantId(), parameters);

        ExtractionParameters extractionParameters = extractionParameters(job);

        return connectorFactory.initialize(connector, configuration)
                .flatMap(initialized -> connector.validateConnection(parameters))
                .flatMap(validation -> {
                    if (!validation.isValid()) {
                        return Mono.error(new ConnectionException(connector.getId(),
                                "Failed to validate connection to data source: " + validation.describeErrors()));
                    }
                    return connector.connect(parameters, signal);
                })
                .flatMap(connection -> {
                    if (!connection.isSuccess()) {
                        if (connection.getCancellationReason() == CancellationSignal.Reason.CANCELLED) {
                            return Mono.error(new OperationCancelledException(CancellationSignal.Reason.CANCELLED, 0));
                        }
                        return Mono.error(new ConnectionException(connector.getId(),
                                "Failed to connect to data source: " + connection.getMessage()));
                    }
                    return connector.extractData(extractionParameters, signal);
                })
                .flatMap(extraction -> {
                    if (!extraction.isSuccess()) {
                        if (extraction.getFailureReason() == FailureReason.CANCELLED) {
                            return Mono.error(new OperationCancelledException(
                                    CancellationSignal.Reason.CANCELLED, extraction.getProcessedCount()));
                        }
                        return Mono.error(new ExtractionException("Failed to extract data: " + extraction.getErrorMessage()));
                    }
                    logger.info("Extracted {} rows from data source {} for job {}",
                            extraction.getRowCount(), job.getDataSourceId(), job.getId());
                    return transform(job, extraction, signal)
                            .flatMap(rows -> deliver(job, rows).thenReturn(new RunOutcome(extraction.getRowCount(),
                                    rows.size(), extraction.getContinuationToken(), extractionParameters.isIncrementalExtraction())));
                })
                .flatMap(outcome -> connector.disconnect(signal).thenReturn(outcome));
    }

    private Mono<List<DataRow>> transform(IngestionJobDefinition job, ExtractionResult extraction, CancellationSignal signal) {
        TransformationParameters parameters = transformationParameters(job);
        if (parameters == null || parameters.getRules() == null || parameters.getRules().isEmpty()) {
            return Mono.just(extraction.getRows());
        }
        return Mono.fromCallable(() -> transformationEngine.transform(extraction.getRows(), parameters, signal))
                .flatMap(result -> {
                    if (!result.isSuccess()) {
                        if (result.getFailureReason() == FailureReason.CANCELLED) {
                            return Mono.error(new OperationCancelledException(
                                    CancellationSignal.Reason.CANCELLED, result.getOriginalRowCount()));
                        }
                        return Mono.error(new TransformationException(null,
                                "Failed to transform data: " + result.getErrorMessage()));
                    }
                    logTransformation(job, result);
                    return Mono.just(result.getRows());
                });
    }

    private void logTransformation(IngestionJobDefinition job, TransformationResult result) {
        logger.debug("Job {} transformed {} rows into {} rows in {} ms",
                job.getId(), result.getOriginalRowCount(), result.getResultRowCount(), result.getExecutionTimeMs());
    }

    private Mono<Void> deliver(IngestionJobDefinition job, List<DataRow> rows) {
        List<ExtractedDataSink> targets = sinks.orderedStream().collect(Collectors.toList());
        if (targets.isEmpty()) {
            logger.debug("No data sink configured, dropping {} rows of job {}", rows.size(), job.getId());
            return Mono.empty();
        }
        return Flux.fromIterable(targets)
                .concatMap(sink -> sink.accept(job, rows))
                .then();
    }

    private Mono<IngestionJobDefinition> complete(IngestionJobDefinition job, RunOutcome outcome) {
        String message = String.format("Successfully extracted %d items", outcome.extracted());
        if (outcome.delivered() != outcome.extracted()) {
            message += String.format(" (%d after transformation)", outcome.delivered());
        }
        job.markStatus(IngestionStatus.COMPLETED, message);
        job.setFailureCount(0);
        if (outcome.continuationToken() != null) {
            job.setContinuationToken(outcome.continuationToken());
        } else if (!outcome.incremental()) {
            // paged full extraction reached the end; next run starts from the first page
            job.setContinuationToken(null);
        }
        String summary = message;
        if (deletedWhileRunning.contains(job.getId())) {
            logger.info("Job {} was deleted during its run, discarding result: {}", job.getId(), summary);
            return Mono.just(job);
        }
        return jobRepository.save(job)
                .flatMap(saved -> notificationService.sendNotification(saved, IngestionStatus.COMPLETED, summary)
                        .thenReturn(saved))
                .doOnNext(saved -> logger.info("Job {} completed: {}", saved.getId(), summary));
    }

    private Mono<IngestionJobDefinition> handleFailure(IngestionJobDefinition job, Throwable error) {
        if (deletedWhileRunning.contains(job.getId())) {
            logger.info("Job {} was deleted during its run, discarding outcome: {}", job.getId(), error.getMessage());
            job.markStatus(IngestionStatus.CANCELLED, error.getMessage());
            return Mono.just(job);
        }
        if (error instanceof OperationCancelledException) {
            logger.info("Job {} was cancelled", job.getId());
            job.markStatus(IngestionStatus.CANCELLED, error.getMessage());
            return jobRepository.save(job);
        }

        logger.error("Error executing job {}: {}", job.getId(), error.getMessage(), error);
        int failureCount = job.incrementFailureCount();
        job.markStatus(IngestionStatus.FAILED, error.getMessage());

        return jobRepository.save(job)
                .flatMap(saved -> notificationService.sendNotification(saved, IngestionStatus.FAILED, error.getMessage())
                        .thenReturn(saved))
                .flatMap(saved -> {
                    if (!saved.hasReachedRetryLimit()) {
                        return Mono.just(saved);
                    }
                    logger.warn("Job {} reached maximum retry count of {} after {} failures. Auto-pausing job.",
                            saved.getId(), saved.getMaxRetryCount(), failureCount);
                    saved.setPaused(true);
                    saved.touch();
                    return jobRepository.save(saved)
                            .doOnNext(paused -> registrar.removeIfExists(paused.getId()))
                            .flatMap(paused -> notificationService.sendNotification(paused, IngestionStatus.PAUSED,
                                            "Job auto-paused after reaching maximum retry count of " + paused.getMaxRetryCount())
                                    .thenReturn(paused));
                });
    }

    private void registerTrigger(IngestionJobDefinition job) {
        UUID jobId = job.getId();
        registrar.addOrUpdate(jobId, job.getCronExpression(), () -> runDetached(jobId));
    }

    private void refreshTrigger(IngestionJobDefinition job) {
        if (job.isPaused() || !job.isRecurring()) {
            registrar.removeIfExists(job.getId());
        } else {
            registerTrigger(job);
        }
    }

    private void runDetached(UUID jobId) {
        executeJob(jobId).subscribe(
                job -> logger.debug("Job {} finished with status {}", jobId, job.getStatus()),
                error -> logger.error("Job {} run ended with an error: {}", jobId, error.getMessage(), error));
    }

    ExtractionParameters extractionParameters(IngestionJobDefinition job) {
        ExtractionParameters parameters = readJson(job.getExtractionParametersJson(), ExtractionParameters.class,
                "extraction parameters");
        if (parameters == null) {
            parameters = new ExtractionParameters();
        }
        if (parameters.getTargetStructures() == null || parameters.getTargetStructures().isEmpty()) {
            parameters.setTargetStructures(new ArrayList<>(List.of(ExtractionParameters.ALL_STRUCTURES)));
        }
        if (!parameters.hasContinuationToken() && job.getContinuationToken() != null) {
            if (matchesMode(job.getContinuationToken(), parameters.isIncrementalExtraction())) {
                parameters.setContinuationToken(job.getContinuationToken());
            } else {
                logger.warn("Ignoring stored continuation token of job {} that does not match its {} extraction mode",
                        job.getId(), parameters.isIncrementalExtraction() ? "incremental" : "full");
            }
        }
        return parameters;
    }

    /**
     * Offset tokens resume full extractions, tracking tokens resume incremental ones.
     */
    static boolean matchesMode(String token, boolean incremental) {
        try {
            return ContinuationToken.parse(token).isOffset() != incremental;
        } catch (IllegalArgumentException e) {
            logger.debug("Stored continuation token is malformed: {}", e.getMessage());
            return false;
        }
    }

    private TransformationParameters transformationParameters(IngestionJobDefinition job) {
        return readJson(job.getTransformationParametersJson(), TransformationParameters.class, "transformation parameters");
    }

    private <T> T readJson(String json, Class<T> type, String what) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IngestionException("Invalid " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    private record RunOutcome(int extracted, int delivered, String continuationToken, boolean incremental) {
    }
}
