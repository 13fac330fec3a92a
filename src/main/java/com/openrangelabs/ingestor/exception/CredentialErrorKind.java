package com.openrangelabs.ingestor.exception;

/**
 * Sub-kinds of credential failures
 */
public enum CredentialErrorKind {
    STORAGE,
    RETRIEVAL,
    DECRYPTION,
    ROTATION,
    VALIDATION
}
