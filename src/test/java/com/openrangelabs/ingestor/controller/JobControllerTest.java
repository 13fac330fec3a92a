package com.openrangelabs.ingestor.controller;

import com.openrangelabs.ingestor.dto.ScheduleJobRequest;
import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import com.openrangelabs.ingestor.exception.JobNotFoundException;
import com.openrangelabs.ingestor.exception.SchedulingException;
import com.openrangelabs.ingestor.model.IngestionStatus;
import com.openrangelabs.ingestor.scheduler.IngestionJobScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.csrf;

@WebFluxTest(JobController.class)
class JobControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @org.springframework.boot.test.mock.mockito.MockBean
    private IngestionJobScheduler scheduler;

    private IngestionJobDefinition job;

    @BeforeEach
    void setUp() {
        job = new IngestionJobDefinition("Nightly CRM import", UUID.randomUUID(), UUID.randomUUID(), "0 2 * * *");
        job.setId(UUID.randomUUID());
        job.setNotificationConfigJson("{\"notifyOnFailure\":true}");
    }

    @Test
    @WithMockUser(roles = "USER")
    void scheduleJob_Success() {
        // Arrange
        ScheduleJobRequest request = ScheduleJobRequest.builder()
            .name(job.getName())
            .dataSourceId(job.getDataSourceId())
            .tenantId(job.getTenantId())
            .cronExpression("0 2 * * *")
            .build();
        when(scheduler.schedule(any(IngestionJobDefinition.class))).thenReturn(Mono.just(job));

        // Act & Assert
        webTestClient.mutateWith(csrf())
            .post()
            .uri("/api/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.id").isEqualTo(job.getId().toString())
            .jsonPath("$.status").isEqualTo(IngestionStatus.SCHEDULED.name())
            .jsonPath("$.notification.notifyOnFailure").isEqualTo(true);
    }

    @Test
    @WithMockUser(roles = "USER")
    void scheduleJob_MissingNameAndDataSource() {
        ScheduleJobRequest request = ScheduleJobRequest.builder().tenantId(UUID.randomUUID()).build();

        webTestClient.mutateWith(csrf())
            .post()
            .uri("/api/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.fieldErrors.name").isEqualTo("Job name is required")
            .jsonPath("$.fieldErrors.dataSourceId").exists();
        verify(scheduler, never()).schedule(any());
    }

    @Test
    @WithMockUser(roles = "USER")
    void scheduleJob_InvalidCronIsConflict() {
        ScheduleJobRequest request = ScheduleJobRequest.builder()
            .name("bad cron")
            .dataSourceId(UUID.randomUUID())
            .tenantId(UUID.randomUUID())
            .cronExpression("sometimes")
            .build();
        when(scheduler.schedule(any(IngestionJobDefinition.class)))
            .thenReturn(Mono.error(new SchedulingException("Invalid cron expression: sometimes")));

        webTestClient.mutateWith(csrf())
            .post()
            .uri("/api/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.message").isEqualTo("Invalid cron expression: sometimes");
    }

    @Test
    @WithMockUser(roles = "USER")
    void getJob_NotFound() {
        UUID jobId = UUID.randomUUID();
        when(scheduler.getJob(jobId)).thenReturn(Mono.error(new JobNotFoundException(jobId)));

        webTestClient.get()
            .uri("/api/jobs/{jobId}", jobId)
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Job Not Found");
    }

    @Test
    @WithMockUser(roles = "USER")
    void getJobsForTenant_Success() {
        when(scheduler.getJobsForTenant(job.getTenantId())).thenReturn(Flux.just(job));

        webTestClient.get()
            .uri(uriBuilder -> uriBuilder.path("/api/jobs").queryParam("tenantId", job.getTenantId()).build())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].name").isEqualTo("Nightly CRM import")
            .jsonPath("$[0].cronExpression").isEqualTo("0 2 * * *");
    }

    @Test
    @WithMockUser(roles = "USER")
    void triggerJob_Accepted() {
        when(scheduler.triggerNow(job.getId())).thenReturn(Mono.empty());

        webTestClient.mutateWith(csrf())
            .post()
            .uri("/api/jobs/{jobId}/trigger", job.getId())
            .exchange()
            .expectStatus().isAccepted();
    }

    @Test
    @WithMockUser(roles = "USER")
    void pauseJob_AlreadyPausedIsConflict() {
        when(scheduler.pause(job.getId()))
            .thenReturn(Mono.error(new SchedulingException("Job " + job.getId() + " is already paused")));

        webTestClient.mutateWith(csrf())
            .post()
            .uri("/api/jobs/{jobId}/pause", job.getId())
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    @WithMockUser(roles = "USER")
    void resumeJob_Success() {
        when(scheduler.resume(job.getId())).thenReturn(Mono.just(job));

        webTestClient.mutateWith(csrf())
            .post()
            .uri("/api/jobs/{jobId}/resume", job.getId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.paused").isEqualTo(false);
    }

    @Test
    @WithMockUser(roles = "USER")
    void cancelJob_ReportsWhetherRunWasActive() {
        when(scheduler.getJob(job.getId())).thenReturn(Mono.just(job));
        when(scheduler.cancel(job.getId())).thenReturn(true);

        webTestClient.mutateWith(csrf())
            .post()
            .uri("/api/jobs/{jobId}/cancel", job.getId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.cancellationRequested").isEqualTo(true);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void deleteJob_NoContent() {
        when(scheduler.delete(eq(job.getId()))).thenReturn(Mono.empty());

        webTestClient.mutateWith(csrf())
            .delete()
            .uri("/api/jobs/{jobId}", job.getId())
            .exchange()
            .expectStatus().isNoContent();
    }

    @Test
    void getJob_Unauthenticated() {
        webTestClient.get()
            .uri("/api/jobs/{jobId}", job.getId())
            .exchange()
            .expectStatus().isUnauthorized();
    }
}
