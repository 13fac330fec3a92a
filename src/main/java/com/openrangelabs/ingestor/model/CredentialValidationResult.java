package com.openrangelabs.ingestor.model;

import java.util.List;

/**
 * Outcome of checking that a credential is enabled, current and decryptable
 */
public record CredentialValidationResult(String key, boolean valid, List<String> issues) {

    public CredentialValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static CredentialValidationResult success(String key) {
        return new CredentialValidationResult(key, true, List.of());
    }

    public static CredentialValidationResult failure(String key, List<String> issues) {
        return new CredentialValidationResult(key, false, issues);
    }
}
