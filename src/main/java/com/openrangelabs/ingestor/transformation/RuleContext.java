package com.openrangelabs.ingestor.transformation;

import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.exception.TransformationException;
import com.openrangelabs.ingestor.model.DataRow;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-rule execution state handed to a {@link com.openrangelabs.ingestor.transformation.handler.RuleHandler}:
 * shared collaborators plus the counters that end up in the {@link RuleExecutionResult}.
 */
public class RuleContext {

    private final TransformationRule rule;
    private final ExpressionEvaluator expressions;
    private final Map<String, CustomRuleFunction> customFunctions;
    private final Map<String, List<DataRow>> joinSources;
    private final CancellationSignal signal;
    private final int batchSize;
    private final boolean failOnError;

    private long rowsSeen;
    private long successCount;
    private long failureCount;
    private String firstError;

    public RuleContext(TransformationRule rule, ExpressionEvaluator expressions, Map<String, CustomRuleFunction> customFunctions,
                       Map<String, List<DataRow>> joinSources, CancellationSignal signal, int batchSize, boolean failOnError) {
        this.rule = rule;
        this.expressions = expressions;
        this.customFunctions = customFunctions;
        this.joinSources = joinSources;
        this.signal = signal;
        this.batchSize = batchSize;
        this.failOnError = failOnError;
    }

    public ExpressionEvaluator expressions() {
        return expressions;
    }

    public Optional<CustomRuleFunction> customFunction(String name) {
        return Optional.ofNullable(customFunctions.get(name));
    }

    public Optional<List<DataRow>> joinSource(String name) {
        return Optional.ofNullable(joinSources.get(name));
    }

    public boolean isFailOnError() {
        return failOnError;
    }

    /**
     * Counts the row and polls the cancellation signal at every batch boundary.
     */
    public void rowSeen() {
        if (rowsSeen % batchSize == 0) {
            signal.throwIfCancellationRequested(rowsSeen);
        }
        rowsSeen++;
    }

    /**
     * Evaluates the rule's guard. A guard not in {@code field op value} form is treated as a boolean expression.
     */
    public boolean guardAllows(DataRow row) {
        String condition = rule.getCondition();
        if (condition == null || condition.isBlank()) {
            return true;
        }
        return RuleCondition.parse(condition)
                .map(parsed -> parsed.test(row))
                .orElseGet(() -> expressions.evaluateCondition(condition, row));
    }

    public void recordSuccess() {
        successCount++;
    }

    /**
     * Counts a row-level failure, or aborts the rule when fail-on-error is in force.
     */
    public void recordFailure(Exception error) {
        failureCount++;
        if (firstError == null) {
            firstError = error.getMessage();
        }
        if (failOnError) {
            throw new TransformationException(rule.getId(),
                    String.format("Rule %s failed on row %d: %s", rule.getId(), rowsSeen, error.getMessage()), error);
        }
    }

    public long getRowsSeen() { return rowsSeen; }
    public long getSuccessCount() { return successCount; }
    public long getFailureCount() { return failureCount; }

    public RuleExecutionResult toResult(Duration elapsed) {
        return new RuleExecutionResult(rule.getId(), rule.getType(), failureCount == 0, elapsed,
                rowsSeen, successCount, failureCount, firstError);
    }

    public RuleExecutionResult toFailedResult(Duration elapsed, String errorMessage) {
        return RuleExecutionResult.failed(rule.getId(), rule.getType(), elapsed, rowsSeen, successCount,
                Math.max(1, failureCount), errorMessage);
    }
}
