package com.openrangelabs.ingestor.connector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of parameter validation: fatal errors plus non-fatal warnings
 */
public class ValidationResult {

    private final List<ValidationError> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public static ValidationResult success(List<String> warnings) {
        ValidationResult result = new ValidationResult();
        result.warnings.addAll(warnings);
        return result;
    }

    public static ValidationResult failure(String fieldName, String errorMessage) {
        ValidationResult result = new ValidationResult();
        result.addError(fieldName, errorMessage);
        return result;
    }

    public static ValidationResult of(List<ValidationError> errors, List<String> warnings) {
        ValidationResult result = new ValidationResult();
        result.errors.addAll(errors);
        result.warnings.addAll(warnings);
        return result;
    }

    public ValidationResult addError(String fieldName, String errorMessage) {
        errors.add(new ValidationError(fieldName, errorMessage));
        return this;
    }

    public ValidationResult addWarning(String warning) {
        warnings.add(warning);
        return this;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public String describeErrors() {
        return errors.stream().map(ValidationError::toString).collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() + ", errors=" + errors + ", warnings=" + warnings + '}';
    }
}
