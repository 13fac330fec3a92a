package com.openrangelabs.ingestor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for ingestion jobs; JSON settings are returned as parsed objects.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Ingestion job definition and last run state")
public class JobResponseDto {

    UUID id;
    String name;
    String description;
    UUID dataSourceId;
    UUID tenantId;
    String cronExpression;

    @Schema(description = "Lifecycle status", example = "SCHEDULED")
    String status;

    boolean paused;
    int failureCount;
    int maxRetryCount;
    JsonNode notification;
    JsonNode extraction;
    JsonNode transformation;
    String continuationToken;
    LocalDateTime createdAt;
    LocalDateTime modifiedAt;
    LocalDateTime lastExecutionTime;
    String lastExecutionResult;

    public static JobResponseDto fromEntity(IngestionJobDefinition job, ObjectMapper objectMapper) {
        return JobResponseDto.builder()
                .id(job.getId())
                .name(job.getName())
                .description(job.getDescription())
                .dataSourceId(job.getDataSourceId())
                .tenantId(job.getTenantId())
                .cronExpression(job.getCronExpression())
                .status(job.getStatus())
                .paused(job.isPaused())
                .failureCount(job.getFailureCount() == null ? 0 : job.getFailureCount())
                .maxRetryCount(job.getMaxRetryCount() == null
                        ? IngestionJobDefinition.DEFAULT_MAX_RETRY_COUNT : job.getMaxRetryCount())
                .notification(readTree(objectMapper, job.getNotificationConfigJson()))
                .extraction(readTree(objectMapper, job.getExtractionParametersJson()))
                .transformation(readTree(objectMapper, job.getTransformationParametersJson()))
                .continuationToken(job.getContinuationToken())
                .createdAt(job.getCreatedAt())
                .modifiedAt(job.getModifiedAt())
                .lastExecutionTime(job.getLastExecutionTime())
                .lastExecutionResult(job.getLastExecutionResult())
                .build();
    }

    private static JsonNode readTree(ObjectMapper objectMapper, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(json);
        }
    }
}
