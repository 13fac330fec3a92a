package com.openrangelabs.ingestor.dto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import com.openrangelabs.ingestor.exception.IngestionException;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.notification.NotificationConfig;
import com.openrangelabs.ingestor.transformation.TransformationParameters;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request DTO for creating or replacing an ingestion job.
 *
 * <p>Omitting the cron expression makes the job manual-trigger only.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for scheduling an ingestion job")
public class ScheduleJobRequest {

    @NotBlank(message = "Job name is required")
    @Size(max = 200, message = "Job name cannot exceed 200 characters")
    @Schema(description = "Display name of the job", example = "Nightly CRM import", required = true)
    private String name;

    @Size(max = 1000, message = "Description cannot exceed 1000 characters")
    private String description;

    @NotNull(message = "Data source ID is required")
    @Schema(description = "Data source to read from", example = "123e4567-e89b-12d3-a456-426614174000", required = true)
    private UUID dataSourceId;

    @NotNull(message = "Tenant ID is required")
    private UUID tenantId;

    @Schema(description = "Cron expression, 5 fields or 6 with seconds first", example = "0 2 * * *")
    private String cronExpression;

    private boolean paused;

    @Min(value = 1, message = "Max retry count must be at least 1")
    @Max(value = 100, message = "Max retry count cannot exceed 100")
    @Schema(description = "Consecutive failures before the job pauses itself", example = "3")
    private Integer maxRetryCount;

    private NotificationConfig notification;

    private ExtractionParameters extraction;

    private TransformationParameters transformation;

    public IngestionJobDefinition toDefinition(ObjectMapper objectMapper) {
        IngestionJobDefinition job = new IngestionJobDefinition(name, dataSourceId, tenantId,
                cronExpression == null || cronExpression.isBlank() ? null : cronExpression.trim());
        job.setDescription(description);
        job.setPaused(paused);
        job.setMaxRetryCount(maxRetryCount);
        job.setNotificationConfigJson(writeJson(objectMapper, notification));
        job.setExtractionParametersJson(writeJson(objectMapper, extraction));
        job.setTransformationParametersJson(writeJson(objectMapper, transformation));
        return job;
    }

    private static String writeJson(ObjectMapper objectMapper, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IngestionException("Unable to serialize job settings: " + e.getOriginalMessage(), e);
        }
    }
}
