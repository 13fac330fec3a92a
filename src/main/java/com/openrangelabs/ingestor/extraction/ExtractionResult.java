package com.openrangelabs.ingestor.extraction;

import com.openrangelabs.ingestor.connector.DataStructureInfo;
import com.openrangelabs.ingestor.model.DataRow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of an extraction call.
 *
 * <p>The continuation token is opaque to callers: persist it and replay it verbatim.
 */
public class ExtractionResult {

    private final boolean success;
    private final FailureReason failureReason;
    private final String errorMessage;
    private final List<String> errorDetails;
    private final List<DataRow> rows;
    private final long processedCount;
    private final boolean hasMoreRecords;
    private final String continuationToken;
    private final List<DataStructureInfo> structureInfo;
    private final long executionTimeMs;
    private final Instant timestamp;

    private ExtractionResult(Builder builder) {
        this.success = builder.success;
        this.failureReason = builder.failureReason;
        this.errorMessage = builder.errorMessage;
        this.errorDetails = Collections.unmodifiableList(builder.errorDetails);
        this.rows = Collections.unmodifiableList(builder.rows);
        this.processedCount = builder.processedCount >= 0 ? builder.processedCount : builder.rows.size();
        this.hasMoreRecords = builder.hasMoreRecords;
        this.continuationToken = builder.continuationToken;
        this.structureInfo = Collections.unmodifiableList(builder.structureInfo);
        this.executionTimeMs = builder.executionTimeMs;
        this.timestamp = builder.timestamp;
    }

    public static Builder success() {
        return new Builder(true, FailureReason.NONE, null);
    }

    public static Builder failure(FailureReason reason, String errorMessage) {
        if (reason == FailureReason.NONE) {
            throw new IllegalArgumentException("A failure needs a reason");
        }
        return new Builder(false, reason, errorMessage);
    }

    // Getters
    public boolean isSuccess() { return success; }
    public FailureReason getFailureReason() { return failureReason; }
    public String getErrorMessage() { return errorMessage; }
    public List<String> getErrorDetails() { return errorDetails; }
    public List<DataRow> getRows() { return rows; }
    public long getProcessedCount() { return processedCount; }
    public boolean isHasMoreRecords() { return hasMoreRecords; }
    public String getContinuationToken() { return continuationToken; }
    public List<DataStructureInfo> getStructureInfo() { return structureInfo; }
    public long getExecutionTimeMs() { return executionTimeMs; }
    public Instant getTimestamp() { return timestamp; }

    public int getRowCount() {
        return rows.size();
    }

    public boolean isCancelled() {
        return failureReason == FailureReason.CANCELLED || failureReason == FailureReason.TIMEOUT;
    }

    /**
     * Copy of this result with a different execution time, used once the caller has timed the whole call.
     */
    public ExtractionResult withExecutionTime(long executionTimeMs) {
        Builder builder = new Builder(success, failureReason, errorMessage)
                .rows(rows)
                .processedCount(processedCount)
                .hasMoreRecords(hasMoreRecords)
                .continuationToken(continuationToken)
                .structureInfo(structureInfo)
                .executionTimeMs(executionTimeMs);
        errorDetails.forEach(builder::addErrorDetail);
        return builder.build();
    }

    public static class Builder {
        private final boolean success;
        private final FailureReason failureReason;
        private final String errorMessage;
        private final List<String> errorDetails = new ArrayList<>();
        private List<DataRow> rows = new ArrayList<>();
        private long processedCount = -1;
        private boolean hasMoreRecords;
        private String continuationToken;
        private List<DataStructureInfo> structureInfo = new ArrayList<>();
        private long executionTimeMs;
        private Instant timestamp = Instant.now();

        private Builder(boolean success, FailureReason failureReason, String errorMessage) {
            this.success = success;
            this.failureReason = failureReason;
            this.errorMessage = errorMessage;
        }

        public Builder rows(List<DataRow> rows) {
            this.rows = new ArrayList<>(rows);
            return this;
        }

        public Builder processedCount(long processedCount) {
            this.processedCount = processedCount;
            return this;
        }

        public Builder hasMoreRecords(boolean hasMoreRecords) {
            this.hasMoreRecords = hasMoreRecords;
            return this;
        }

        public Builder continuationToken(String continuationToken) {
            this.continuationToken = continuationToken;
            return this;
        }

        public Builder structureInfo(List<DataStructureInfo> structureInfo) {
            this.structureInfo = new ArrayList<>(structureInfo);
            return this;
        }

        public Builder addStructureInfo(DataStructureInfo info) {
            this.structureInfo.add(info);
            return this;
        }

        public Builder addErrorDetail(String detail) {
            this.errorDetails.add(detail);
            return this;
        }

        public Builder executionTimeMs(long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public ExtractionResult build() {
            return new ExtractionResult(this);
        }
    }

    @Override
    public String toString() {
        return "ExtractionResult{" +
                "success=" + success +
                ", failureReason=" + failureReason +
                ", rows=" + rows.size() +
                ", processedCount=" + processedCount +
                ", hasMoreRecords=" + hasMoreRecords +
                ", continuationToken='" + continuationToken + '\'' +
                ", executionTimeMs=" + executionTimeMs +
                (errorMessage != null ? ", errorMessage='" + errorMessage + '\'' : "") +
                '}';
    }
}
