package com.openrangelabs.ingestor.transformation;

import com.openrangelabs.ingestor.extraction.FailureReason;
import com.openrangelabs.ingestor.model.DataRow;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of running a rule pipeline
 */
public class TransformationResult {

    private final boolean success;
    private final FailureReason failureReason;
    private final String errorMessage;
    private final List<DataRow> rows;
    private final int originalRowCount;
    private final List<RuleExecutionResult> ruleResults;
    private final long executionTimeMs;
    private final Instant timestamp = Instant.now();

    private TransformationResult(boolean success, FailureReason failureReason, String errorMessage, List<DataRow> rows,
                                 int originalRowCount, List<RuleExecutionResult> ruleResults, long executionTimeMs) {
        this.success = success;
        this.failureReason = failureReason;
        this.errorMessage = errorMessage;
        this.rows = Collections.unmodifiableList(rows);
        this.originalRowCount = originalRowCount;
        this.ruleResults = List.copyOf(ruleResults);
        this.executionTimeMs = executionTimeMs;
    }

    public static TransformationResult success(List<DataRow> rows, int originalRowCount,
                                               List<RuleExecutionResult> ruleResults, long executionTimeMs) {
        return new TransformationResult(true, FailureReason.NONE, null, rows, originalRowCount, ruleResults, executionTimeMs);
    }

    /**
     * Aborted pipeline. Rows are dropped; only the rule results gathered so far are kept.
     */
    public static TransformationResult failure(FailureReason reason, String errorMessage, int originalRowCount,
                                               List<RuleExecutionResult> ruleResults, long executionTimeMs) {
        return new TransformationResult(false, reason, errorMessage, List.of(), originalRowCount, ruleResults, executionTimeMs);
    }

    public boolean isSuccess() { return success; }
    public FailureReason getFailureReason() { return failureReason; }
    public String getErrorMessage() { return errorMessage; }
    public List<DataRow> getRows() { return rows; }
    public int getOriginalRowCount() { return originalRowCount; }
    public int getResultRowCount() { return rows.size(); }
    public List<RuleExecutionResult> getRuleResults() { return ruleResults; }
    public long getExecutionTimeMs() { return executionTimeMs; }
    public Instant getTimestamp() { return timestamp; }

    public long getTotalFailureCount() {
        return ruleResults.stream().mapToLong(RuleExecutionResult::failureCount).sum();
    }

    @Override
    public String toString() {
        return "TransformationResult{" +
                "success=" + success +
                ", failureReason=" + failureReason +
                ", originalRowCount=" + originalRowCount +
                ", resultRowCount=" + rows.size() +
                ", rules=" + ruleResults.size() +
                ", executionTimeMs=" + executionTimeMs +
                '}';
    }
}
