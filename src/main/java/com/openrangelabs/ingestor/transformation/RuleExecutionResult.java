package com.openrangelabs.ingestor.transformation;

import java.time.Duration;

/**
 * What one rule did to the row set.
 */
public record RuleExecutionResult(String ruleId,
                                  String ruleType,
                                  boolean success,
                                  Duration elapsed,
                                  long rowsSeen,
                                  long successCount,
                                  long failureCount,
                                  String errorMessage) {

    public static RuleExecutionResult failed(String ruleId, String ruleType, Duration elapsed, long rowsSeen,
                                             long successCount, long failureCount, String errorMessage) {
        return new RuleExecutionResult(ruleId, ruleType, false, elapsed, rowsSeen, successCount, failureCount, errorMessage);
    }
}
