package com.openrangelabs.ingestor.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.connector.sample.SampleConnector;
import com.openrangelabs.ingestor.entity.DataSource;
import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import com.openrangelabs.ingestor.exception.JobNotFoundException;
import com.openrangelabs.ingestor.exception.SchedulingException;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.model.IngestionStatus;
import com.openrangelabs.ingestor.notification.JobNotificationService;
import com.openrangelabs.ingestor.registry.ConnectorFactory;
import com.openrangelabs.ingestor.registry.ConnectorRegistry;
import com.openrangelabs.ingestor.repository.DataSourceRepository;
import com.openrangelabs.ingestor.repository.IngestionJobDefinitionRepository;
import com.openrangelabs.ingestor.transformation.TransformationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionJobSchedulerTest {

    private static final Map<String, String> SAMPLE_PARAMETERS = Map.of(
        "server", "sample.local",
        "apiKey", "0123456789abcdef",
        "maxRecords", "5");

    @Mock
    private IngestionJobDefinitionRepository jobRepository;

    @Mock
    private DataSourceRepository dataSourceRepository;

    @Mock
    private RecurringJobRegistrar registrar;

    @Mock
    private JobNotificationService notificationService;

    @Mock
    private DataSourceParameterResolver parameterResolver;

    @Mock
    private ObjectProvider<ExtractedDataSink> sinks;

    @Mock
    private ExtractedDataSink sink;

    private IngestionJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        ConnectorRegistry registry = new ConnectorRegistry();
        registry.register(SampleConnector::new);
        scheduler = new IngestionJobScheduler(jobRepository, dataSourceRepository, registrar, notificationService,
            new ConnectorFactory(registry), parameterResolver, new TransformationEngine(),
            sinks, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void schedule_RecurringJobRegistersTrigger() {
        // Arrange
        IngestionJobDefinition job = new IngestionJobDefinition("nightly", UUID.randomUUID(), UUID.randomUUID(), " 0 2 * * * ");
        UUID assignedId = UUID.randomUUID();
        when(jobRepository.save(any(IngestionJobDefinition.class))).thenAnswer(invocation -> {
            IngestionJobDefinition saved = invocation.getArgument(0);
            saved.setId(assignedId);
            return Mono.just(saved);
        });

        // Act & Assert
        StepVerifier.create(scheduler.schedule(job))
            .assertNext(saved -> {
                assertThat(saved.getStatus()).isEqualTo(IngestionStatus.SCHEDULED.name());
                assertThat(saved.getCronExpression()).isEqualTo("0 2 * * *");
                assertThat(saved.getFailureCount()).isZero();
            })
            .verifyComplete();
        verify(registrar).addOrUpdate(eq(assignedId), eq("0 2 * * *"), any(Runnable.class));
    }

    @Test
    void schedule_InvalidCron_IsRejectedBeforeSaving() {
        IngestionJobDefinition job = new IngestionJobDefinition("broken", UUID.randomUUID(), null, "every day");

        StepVerifier.create(scheduler.schedule(job))
            .expectError(SchedulingException.class)
            .verify();
        verify(jobRepository, never()).save(any());
    }

    @Test
    void executeJob_SuccessfulRunDeliversRowsAndCompletes() {
        // Arrange
        IngestionJobDefinition job = job(0);
        DataSource dataSource = sampleDataSource(job.getDataSourceId());
        stubRun(job, dataSource);
        when(parameterResolver.resolve(dataSource)).thenReturn(Mono.just(SAMPLE_PARAMETERS));
        when(sinks.orderedStream()).thenReturn(Stream.of(sink));
        when(sink.accept(eq(job), anyList())).thenReturn(Mono.empty());
        when(notificationService.sendNotification(any(), eq(IngestionStatus.COMPLETED), anyString()))
            .thenReturn(Mono.just(true));

        // Act & Assert
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(finished -> {
                assertThat(finished.getStatus()).isEqualTo(IngestionStatus.COMPLETED.name());
                assertThat(finished.getLastExecutionResult()).startsWith("Successfully extracted");
                assertThat(finished.getLastExecutionTime()).isNotNull();
                assertThat(finished.getFailureCount()).isZero();
            })
            .verifyComplete();
        verify(sink).accept(eq(job), anyList());
        assertThat(scheduler.isRunning(job.getId())).isFalse();
    }

    @Test
    void executeJob_FailureBelowRetryLimit_CountsFailure() {
        // Arrange
        IngestionJobDefinition job = job(0);
        stubRun(job, null);
        when(notificationService.sendNotification(any(), eq(IngestionStatus.FAILED), anyString()))
            .thenReturn(Mono.just(true));

        // Act & Assert
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(failed -> {
                assertThat(failed.getStatus()).isEqualTo(IngestionStatus.FAILED.name());
                assertThat(failed.getFailureCount()).isEqualTo(1);
                assertThat(failed.isPaused()).isFalse();
                assertThat(failed.getLastExecutionResult()).contains("Data source not found");
            })
            .verifyComplete();
        verify(registrar, never()).removeIfExists(any());
    }

    @Test
    void executeJob_ThirdConsecutiveFailure_AutoPausesJob() {
        // Arrange
        IngestionJobDefinition job = job(2);
        stubRun(job, null);
        when(notificationService.sendNotification(any(), any(), anyString())).thenReturn(Mono.just(true));

        // Act & Assert
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(paused -> {
                assertThat(paused.getFailureCount()).isEqualTo(3);
                assertThat(paused.isPaused()).isTrue();
            })
            .verifyComplete();
        verify(registrar).removeIfExists(job.getId());
        verify(notificationService).sendNotification(any(), eq(IngestionStatus.FAILED), anyString());
        verify(notificationService).sendNotification(any(), eq(IngestionStatus.PAUSED), anyString());
    }

    @Test
    void executeJob_SuccessResetsFailureCount() {
        // Arrange
        IngestionJobDefinition job = job(2);
        DataSource dataSource = sampleDataSource(job.getDataSourceId());
        stubRun(job, dataSource);
        when(parameterResolver.resolve(dataSource)).thenReturn(Mono.just(SAMPLE_PARAMETERS));
        when(sinks.orderedStream()).thenReturn(Stream.empty());
        when(notificationService.sendNotification(any(), eq(IngestionStatus.COMPLETED), anyString()))
            .thenReturn(Mono.just(true));

        // Act & Assert
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(finished -> assertThat(finished.getFailureCount()).isZero())
            .verifyComplete();
    }

    @Test
    void executeJob_CancelledWhileRunning_EndsCancelled() {
        // Arrange
        IngestionJobDefinition job = job(0);
        DataSource dataSource = sampleDataSource(job.getDataSourceId());
        stubRun(job, dataSource);
        when(parameterResolver.resolve(dataSource)).thenReturn(Mono.fromCallable(() -> {
            assertThat(scheduler.cancel(job.getId())).isTrue();
            return SAMPLE_PARAMETERS;
        }));

        // Act & Assert
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(cancelled -> {
                assertThat(cancelled.getStatus()).isEqualTo(IngestionStatus.CANCELLED.name());
                assertThat(cancelled.getFailureCount()).isZero();
            })
            .verifyComplete();
        verify(notificationService, never()).sendNotification(any(), any(), any());
    }

    @Test
    void executeJob_PausedJobIsSkipped() {
        IngestionJobDefinition job = job(0);
        job.setPaused(true);
        when(jobRepository.findById(job.getId())).thenReturn(Mono.just(job));

        StepVerifier.create(scheduler.executeJob(job.getId())).verifyComplete();
        verify(jobRepository, never()).save(any());
    }

    @Test
    void executeJob_UnknownJobCompletesEmpty() {
        UUID jobId = UUID.randomUUID();
        when(jobRepository.findById(jobId)).thenReturn(Mono.empty());

        StepVerifier.create(scheduler.executeJob(jobId)).verifyComplete();
    }

    @Test
    void pauseAndResume_RejectConflictingTransitions() {
        // Arrange
        IngestionJobDefinition job = job(2);
        job.setCronExpression("*/5 * * * *");
        when(jobRepository.findById(job.getId())).thenReturn(Mono.just(job));
        when(jobRepository.save(any(IngestionJobDefinition.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        // Act & Assert
        StepVerifier.create(scheduler.resume(job.getId()))
            .expectError(SchedulingException.class)
            .verify();

        StepVerifier.create(scheduler.pause(job.getId()))
            .assertNext(paused -> assertThat(paused.getStatus()).isEqualTo(IngestionStatus.PAUSED.name()))
            .verifyComplete();
        verify(registrar).removeIfExists(job.getId());

        StepVerifier.create(scheduler.pause(job.getId()))
            .expectError(SchedulingException.class)
            .verify();

        StepVerifier.create(scheduler.resume(job.getId()))
            .assertNext(resumed -> {
                assertThat(resumed.isPaused()).isFalse();
                assertThat(resumed.getFailureCount()).isZero();
                assertThat(resumed.getStatus()).isEqualTo(IngestionStatus.SCHEDULED.name());
            })
            .verifyComplete();
        verify(registrar).addOrUpdate(eq(job.getId()), eq("*/5 * * * *"), any(Runnable.class));
    }

    @Test
    void triggerNow_PausedJobIsRejected() {
        IngestionJobDefinition job = job(0);
        job.setPaused(true);
        when(jobRepository.findById(job.getId())).thenReturn(Mono.just(job));

        StepVerifier.create(scheduler.triggerNow(job.getId()))
            .expectError(SchedulingException.class)
            .verify();
        verify(registrar, never()).enqueue(any());
    }

    @Test
    void triggerNow_QueuesOneRun() {
        IngestionJobDefinition job = job(0);
        when(jobRepository.findById(job.getId())).thenReturn(Mono.just(job));

        StepVerifier.create(scheduler.triggerNow(job.getId())).verifyComplete();
        verify(registrar).enqueue(any(Runnable.class));
    }

    @Test
    void getJob_UnknownIdIsNotFound() {
        UUID jobId = UUID.randomUUID();
        when(jobRepository.findById(jobId)).thenReturn(Mono.empty());

        StepVerifier.create(scheduler.getJob(jobId))
            .expectError(JobNotFoundException.class)
            .verify();
        assertThat(scheduler.cancel(jobId)).isFalse();
    }

    @Test
    void extractionParameters_ResumeFromStoredContinuationToken() {
        IngestionJobDefinition job = job(0);
        job.setExtractionParametersJson("{\"incrementalExtraction\":true}");
        job.setContinuationToken("sample_table_1|id|42");

        ExtractionParameters parameters = scheduler.extractionParameters(job);

        assertThat(parameters.getContinuationToken()).isEqualTo("sample_table_1|id|42");
        assertThat(parameters.getTargetStructures()).containsExactly(ExtractionParameters.ALL_STRUCTURES);
    }

    @Test
    void executeJob_FullExtractionResumesFromStoredOffset() {
        // Arrange
        IngestionJobDefinition job = job(0);
        job.setExtractionParametersJson("{\"targetStructures\":[\"sample_table_1\"],\"maxRecords\":2}");
        DataSource dataSource = sampleDataSource(job.getDataSourceId());
        stubRun(job, dataSource);
        when(parameterResolver.resolve(dataSource)).thenReturn(Mono.just(SAMPLE_PARAMETERS));
        when(sinks.orderedStream()).thenAnswer(invocation -> Stream.empty());
        when(notificationService.sendNotification(any(), eq(IngestionStatus.COMPLETED), anyString()))
            .thenReturn(Mono.just(true));

        // Act & Assert: first page
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(finished -> {
                assertThat(finished.getLastExecutionResult()).isEqualTo("Successfully extracted 2 items");
                assertThat(finished.getContinuationToken()).isEqualTo("sample_table_1|2");
            })
            .verifyComplete();

        // Act & Assert: second page continues where the first stopped
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(finished -> assertThat(finished.getContinuationToken()).isEqualTo("sample_table_1|4"))
            .verifyComplete();

        // Act & Assert: last page clears the offset so the next run starts over
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(finished -> {
                assertThat(finished.getLastExecutionResult()).isEqualTo("Successfully extracted 1 items");
                assertThat(finished.getContinuationToken()).isNull();
            })
            .verifyComplete();
    }

    @Test
    void extractionParameters_IgnoresTokenOfTheOtherMode() {
        IngestionJobDefinition incrementalJob = job(0);
        incrementalJob.setExtractionParametersJson("{\"incrementalExtraction\":true}");
        incrementalJob.setContinuationToken("sample_table_1|4");

        IngestionJobDefinition fullJob = job(0);
        fullJob.setContinuationToken("sample_table_1|id|42");

        assertThat(scheduler.extractionParameters(incrementalJob).getContinuationToken()).isNull();
        assertThat(scheduler.extractionParameters(fullJob).getContinuationToken()).isNull();
        assertThat(IngestionJobScheduler.matchesMode("not a token", true)).isFalse();
    }

    @Test
    void delete_WhileRunning_CancelsRunAndDoesNotSaveJobBack() {
        // Arrange
        IngestionJobDefinition job = job(0);
        DataSource dataSource = sampleDataSource(job.getDataSourceId());
        stubRun(job, dataSource);
        when(jobRepository.delete(job)).thenReturn(Mono.empty());
        when(parameterResolver.resolve(dataSource)).thenReturn(Mono.fromCallable(() -> {
            scheduler.delete(job.getId()).block();
            return SAMPLE_PARAMETERS;
        }));

        // Act & Assert
        StepVerifier.create(scheduler.executeJob(job.getId()))
            .assertNext(cancelled -> assertThat(cancelled.getStatus()).isEqualTo(IngestionStatus.CANCELLED.name()))
            .verifyComplete();
        verify(jobRepository).delete(job);
        verify(jobRepository, times(1)).save(any(IngestionJobDefinition.class));
        verify(registrar).removeIfExists(job.getId());
        verify(notificationService, never()).sendNotification(any(), any(), any());
        assertThat(scheduler.isRunning(job.getId())).isFalse();
    }

    private void stubRun(IngestionJobDefinition job, DataSource dataSource) {
        when(jobRepository.findById(job.getId())).thenReturn(Mono.just(job));
        when(jobRepository.save(any(IngestionJobDefinition.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        when(dataSourceRepository.findById(job.getDataSourceId())).thenReturn(Mono.justOrEmpty(dataSource));
    }

    private static IngestionJobDefinition job(int failures) {
        IngestionJobDefinition job = new IngestionJobDefinition("sample sync", UUID.randomUUID(), UUID.randomUUID(), null);
        job.setId(UUID.randomUUID());
        job.setFailureCount(failures);
        return job;
    }

    private static DataSource sampleDataSource(UUID id) {
        DataSource dataSource = new DataSource(UUID.randomUUID(), "Sample", "sample");
        dataSource.setId(id);
        return dataSource;
    }
}
