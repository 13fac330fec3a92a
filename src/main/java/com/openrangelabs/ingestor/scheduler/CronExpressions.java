package com.openrangelabs.ingestor.scheduler;

import com.openrangelabs.ingestor.exception.SchedulingException;
import org.springframework.scheduling.support.CronExpression;

/**
 * Accepts standard 5-field cron expressions as well as Spring's 6-field form (seconds first).
 */
public final class CronExpressions {

    private CronExpressions() {}

    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new SchedulingException("Cron expression must not be empty");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        String normalized = fields.length == 5 ? "0 " + String.join(" ", fields) : trimmed;
        if (!CronExpression.isValidExpression(normalized)) {
            throw new SchedulingException("Invalid cron expression: " + expression);
        }
        return normalized;
    }

    public static boolean isValid(String expression) {
        try {
            normalize(expression);
            return true;
        } catch (SchedulingException e) {
            return false;
        }
    }
}
