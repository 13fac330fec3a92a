package com.openrangelabs.ingestor.exception;

/**
 * Exception thrown when credential encryption or decryption operations fail.
 *
 * <p>This exception indicates a problem with the cryptographic operations
 * used to secure credential storage and retrieval. Decryption failures carry the
 * {@link CredentialErrorKind#DECRYPTION} kind.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialEncryptionException extends CredentialException {

    public static final String ENCRYPTION = "encryption";
    public static final String DECRYPTION = "decryption";

    private final String operation;

    /**
     * Constructs a new credential encryption exception with operation context and cause.
     *
     * @param operation the operation that failed ("encryption" or "decryption")
     * @param message the detail message
     * @param cause the underlying cause
     */
    public CredentialEncryptionException(String operation, String message, Throwable cause) {
        super(kindOf(operation), String.format("Credential %s failed: %s", operation, message), cause);
        this.operation = operation;
    }

    /**
     * Gets the operation that failed.
     *
     * @return the operation name
     */
    public String getOperation() {
        return operation;
    }

    private static CredentialErrorKind kindOf(String operation) {
        return DECRYPTION.equals(operation) ? CredentialErrorKind.DECRYPTION : CredentialErrorKind.STORAGE;
    }
}
