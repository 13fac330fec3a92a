package com.openrangelabs.ingestor.exception;

/**
 * Base exception for credential-related operations.
 *
 * <p>Represents errors that occur during credential storage, retrieval,
 * decryption, rotation or validation. The {@link CredentialErrorKind} lets callers
 * tell tampering or key problems apart from plain absence.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialException extends IngestionException {

    private final CredentialErrorKind kind;

    /**
     * Constructs a new credential exception with the specified kind and detail message.
     *
     * @param kind the failure kind
     * @param message the detail message
     */
    public CredentialException(CredentialErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new credential exception with the specified kind, detail message and cause.
     *
     * @param kind the failure kind
     * @param message the detail message
     * @param cause the cause
     */
    public CredentialException(CredentialErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CredentialErrorKind getKind() {
        return kind;
    }
}
