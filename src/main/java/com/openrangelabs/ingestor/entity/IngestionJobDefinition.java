package com.openrangelabs.ingestor.entity;

import com.openrangelabs.ingestor.model.IngestionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Entity representing a scheduled ingestion job for one data source
 * Extraction, transformation and notification settings are stored as JSON text
 */
@Table("ingestion_jobs")
public class IngestionJobDefinition {

    public static final int DEFAULT_MAX_RETRY_COUNT = 3;

    @Id
    private UUID id;

    private String name;

    private String description;

    @Column("data_source_id")
    private UUID dataSourceId;

    @Column("tenant_id")
    private UUID tenantId;

    @Column("cron_expression")
    private String cronExpression;

    private String status = IngestionStatus.SCHEDULED.name();

    @Column("is_paused")
    private Boolean paused = false;

    @Column("failure_count")
    private Integer failureCount = 0;

    @Column("max_retry_count")
    private Integer maxRetryCount = DEFAULT_MAX_RETRY_COUNT;

    @Column("notification_config")
    private String notificationConfigJson;

    @Column("extraction_parameters")
    private String extractionParametersJson;

    @Column("transformation_parameters")
    private String transformationParametersJson;

    @Column("continuation_token")
    private String continuationToken;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column("modified_at")
    private LocalDateTime modifiedAt = LocalDateTime.now();

    @Column("last_execution_time")
    private LocalDateTime lastExecutionTime;

    @Column("last_execution_result")
    private String lastExecutionResult;

    public IngestionJobDefinition() {}

    public IngestionJobDefinition(String name, UUID dataSourceId, UUID tenantId, String cronExpression) {
        this.name = name;
        this.dataSourceId = dataSourceId;
        this.tenantId = tenantId;
        this.cronExpression = cronExpression;
    }

    // Business methods
    public boolean isRecurring() {
        return cronExpression != null && !cronExpression.isBlank();
    }

    public boolean isPaused() {
        return Boolean.TRUE.equals(paused);
    }

    public IngestionStatus statusValue() {
        return status == null ? IngestionStatus.SCHEDULED : IngestionStatus.valueOf(status);
    }

    public void markStatus(IngestionStatus newStatus, String result) {
        this.status = newStatus.name();
        if (result != null) {
            this.lastExecutionResult = result;
        }
        touch();
    }

    public int incrementFailureCount() {
        this.failureCount = (failureCount == null ? 0 : failureCount) + 1;
        return failureCount;
    }

    public boolean hasReachedRetryLimit() {
        int limit = maxRetryCount == null ? DEFAULT_MAX_RETRY_COUNT : maxRetryCount;
        return failureCount != null && failureCount >= limit;
    }

    public void touch() {
        this.modifiedAt = LocalDateTime.now();
    }

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public UUID getDataSourceId() { return dataSourceId; }
    public void setDataSourceId(UUID dataSourceId) { this.dataSourceId = dataSourceId; }

    public UUID getTenantId() { return tenantId; }
    public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public Boolean getPaused() { return paused; }
    public void setPaused(Boolean paused) { this.paused = paused; }

    public Integer getFailureCount() { return failureCount; }
    public void setFailureCount(Integer failureCount) { this.failureCount = failureCount; }

    public Integer getMaxRetryCount() { return maxRetryCount; }
    public void setMaxRetryCount(Integer maxRetryCount) { this.maxRetryCount = maxRetryCount; }

    public String getNotificationConfigJson() { return notificationConfigJson; }
    public void setNotificationConfigJson(String notificationConfigJson) { this.notificationConfigJson = notificationConfigJson; }

    public String getExtractionParametersJson() { return extractionParametersJson; }
    public void setExtractionParametersJson(String extractionParametersJson) { this.extractionParametersJson = extractionParametersJson; }

    public String getTransformationParametersJson() { return transformationParametersJson; }
    public void setTransformationParametersJson(String transformationParametersJson) { this.transformationParametersJson = transformationParametersJson; }

    public String getContinuationToken() { return continuationToken; }
    public void setContinuationToken(String continuationToken) { this.continuationToken = continuationToken; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getModifiedAt() { return modifiedAt; }
    public void setModifiedAt(LocalDateTime modifiedAt) { this.modifiedAt = modifiedAt; }

    public LocalDateTime getLastExecutionTime() { return lastExecutionTime; }
    public void setLastExecutionTime(LocalDateTime lastExecutionTime) { this.lastExecutionTime = lastExecutionTime; }

    public String getLastExecutionResult() { return lastExecutionResult; }
    public void setLastExecutionResult(String lastExecutionResult) { this.lastExecutionResult = lastExecutionResult; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IngestionJobDefinition that = (IngestionJobDefinition) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "IngestionJobDefinition{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", dataSourceId=" + dataSourceId +
                ", tenantId=" + tenantId +
                ", cronExpression='" + cronExpression + '\'' +
                ", status='" + status + '\'' +
                ", paused=" + paused +
                ", failureCount=" + failureCount +
                ", maxRetryCount=" + maxRetryCount +
                '}';
    }
}
