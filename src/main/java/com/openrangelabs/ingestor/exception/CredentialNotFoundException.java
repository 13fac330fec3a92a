package com.openrangelabs.ingestor.exception;

/**
 * Exception thrown when a requested credential cannot be found.
 *
 * <p>This exception indicates that no credential is stored under the given key.
 * It is raised by mutating operations; reads report absence as an empty result.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialNotFoundException extends CredentialException {

    private final String credentialKey;

    /**
     * Constructs a new credential not found exception for a key.
     *
     * @param credentialKey the key that was not found
     */
    public CredentialNotFoundException(String credentialKey) {
        super(CredentialErrorKind.RETRIEVAL, String.format("Credential not found with key: %s", credentialKey));
        this.credentialKey = credentialKey;
    }

    public String getCredentialKey() {
        return credentialKey;
    }
}
