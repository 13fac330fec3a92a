package com.openrangelabs.ingestor.exception;

/**
 * Rule-level transformation failure.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class TransformationException extends IngestionException {

    private final String ruleId;

    public TransformationException(String ruleId, String message) {
        super(message);
        this.ruleId = ruleId;
    }

    public TransformationException(String ruleId, String message, Throwable cause) {
        super(message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
