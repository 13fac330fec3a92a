package com.openrangelabs.ingestor.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.dto.JobResponseDto;
import com.openrangelabs.ingestor.dto.ScheduleJobRequest;
import com.openrangelabs.ingestor.scheduler.IngestionJobScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * REST controller for ingestion job scheduling.
 *
 * <p>Jobs with a cron expression fire on their schedule; every job can also be triggered on
 * demand unless it is paused.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@Validated
@RestController
@RequestMapping(value = "/api/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Ingestion Jobs", description = "Scheduling and running ingestion jobs")
@SecurityRequirement(name = "bearerAuth")
public class JobController {

    private final IngestionJobScheduler scheduler;
    private final ObjectMapper objectMapper;

    @Operation(summary = "Schedule a job", description = "Stores the job and registers its cron trigger")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Job scheduled"),
            @ApiResponse(responseCode = "400", description = "Invalid request data"),
            @ApiResponse(responseCode = "409", description = "Invalid cron expression")
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<JobResponseDto>> scheduleJob(@Valid @RequestBody ScheduleJobRequest request) {
        log.info("Scheduling job '{}' for data source {}", request.getName(), request.getDataSourceId());
        return scheduler.schedule(request.toDefinition(objectMapper))
                .map(job -> ResponseEntity.status(HttpStatus.CREATED).body(JobResponseDto.fromEntity(job, objectMapper)));
    }

    @Operation(summary = "Get a job")
    @GetMapping("/{jobId}")
    public Mono<JobResponseDto> getJob(@PathVariable UUID jobId) {
        return scheduler.getJob(jobId).map(job -> JobResponseDto.fromEntity(job, objectMapper));
    }

    @Operation(summary = "List jobs of a tenant")
    @GetMapping
    public Flux<JobResponseDto> getJobsForTenant(
            @Parameter(description = "Tenant UUID", required = true) @RequestParam UUID tenantId) {
        return scheduler.getJobsForTenant(tenantId).map(job -> JobResponseDto.fromEntity(job, objectMapper));
    }

    @Operation(summary = "Replace a job's settings", description = "Re-registers the trigger when the schedule or pause flag changed")
    @PutMapping(value = "/{jobId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JobResponseDto> updateJob(@PathVariable UUID jobId, @Valid @RequestBody ScheduleJobRequest request) {
        log.info("Updating job {}", jobId);
        return scheduler.update(jobId, request.toDefinition(objectMapper))
                .map(job -> JobResponseDto.fromEntity(job, objectMapper));
    }

    @Operation(summary = "Pause a job")
    @ApiResponse(responseCode = "409", description = "Job is already paused")
    @PostMapping("/{jobId}/pause")
    public Mono<JobResponseDto> pauseJob(@PathVariable UUID jobId) {
        return scheduler.pause(jobId).map(job -> JobResponseDto.fromEntity(job, objectMapper));
    }

    @Operation(summary = "Resume a paused job")
    @ApiResponse(responseCode = "409", description = "Job is not paused")
    @PostMapping("/{jobId}/resume")
    public Mono<JobResponseDto> resumeJob(@PathVariable UUID jobId) {
        return scheduler.resume(jobId).map(job -> JobResponseDto.fromEntity(job, objectMapper));
    }

    @Operation(summary = "Run a job now")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Run queued"),
            @ApiResponse(responseCode = "409", description = "Job is paused")
    })
    @PostMapping("/{jobId}/trigger")
    public Mono<ResponseEntity<Void>> triggerJob(@PathVariable UUID jobId) {
        return scheduler.triggerNow(jobId)
                .then(Mono.just(ResponseEntity.accepted().<Void>build()));
    }

    @Operation(summary = "Cancel a running job")
    @PostMapping("/{jobId}/cancel")
    public Mono<Map<String, Object>> cancelJob(@PathVariable UUID jobId) {
        return scheduler.getJob(jobId)
                .map(job -> Map.<String, Object>of("jobId", jobId, "cancellationRequested", scheduler.cancel(jobId)));
    }

    @Operation(summary = "Delete a job", description = "Removes the trigger and the job record")
    @DeleteMapping("/{jobId}")
    public Mono<ResponseEntity<Void>> deleteJob(@PathVariable UUID jobId) {
        log.info("Deleting job {}", jobId);
        return scheduler.delete(jobId)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
