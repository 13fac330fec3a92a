package com.openrangelabs.ingestor.exception;

/**
 * Exception thrown when a credential cannot be rotated.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialRotationException extends CredentialException {

    public CredentialRotationException(String credentialKey, String message) {
        super(CredentialErrorKind.ROTATION, String.format("Rotation of credential %s failed: %s", credentialKey, message));
    }

    public CredentialRotationException(String credentialKey, String message, Throwable cause) {
        super(CredentialErrorKind.ROTATION,
                String.format("Rotation of credential %s failed: %s", credentialKey, message), cause);
    }
}
