package com.openrangelabs.ingestor.connector;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a connect attempt
 */
public class ConnectionResult {

    private final boolean success;
    private final String connectionId;
    private final String message;
    private final String serverVersion;
    private final Map<String, Object> connectionInfo;
    private final List<ValidationError> validationErrors;
    private final CancellationSignal.Reason cancellationReason;
    private final Instant connectedAt;

    private ConnectionResult(boolean success, String connectionId, String message, String serverVersion,
                             Map<String, Object> connectionInfo, List<ValidationError> validationErrors,
                             CancellationSignal.Reason cancellationReason) {
        this.success = success;
        this.connectionId = connectionId;
        this.message = message;
        this.serverVersion = serverVersion;
        this.connectionInfo = connectionInfo == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(connectionInfo));
        this.validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        this.cancellationReason = cancellationReason;
        this.connectedAt = success ? Instant.now() : null;
    }

    public static ConnectionResult success(String connectionId, String message, String serverVersion,
                                           Map<String, Object> connectionInfo) {
        return new ConnectionResult(true, connectionId, message, serverVersion, connectionInfo, null,
                CancellationSignal.Reason.NONE);
    }

    public static ConnectionResult alreadyConnected(String connectionId) {
        return new ConnectionResult(true, connectionId, "Already connected", null, null, null,
                CancellationSignal.Reason.NONE);
    }

    public static ConnectionResult failure(String message) {
        return new ConnectionResult(false, null, message, null, null, null, CancellationSignal.Reason.NONE);
    }

    public static ConnectionResult invalid(ValidationResult validation) {
        return new ConnectionResult(false, null, "Connection parameters are invalid: " + validation.describeErrors(),
                null, null, validation.getErrors(), CancellationSignal.Reason.NONE);
    }

    public static ConnectionResult cancelled(CancellationSignal.Reason reason) {
        String message = reason == CancellationSignal.Reason.TIMEOUT ? "Connection attempt timed out" : "Connection attempt cancelled";
        return new ConnectionResult(false, null, message, null, null, null, reason);
    }

    public boolean isSuccess() { return success; }
    public String getConnectionId() { return connectionId; }
    public String getMessage() { return message; }
    public String getServerVersion() { return serverVersion; }
    public Map<String, Object> getConnectionInfo() { return connectionInfo; }
    public List<ValidationError> getValidationErrors() { return validationErrors; }
    public CancellationSignal.Reason getCancellationReason() { return cancellationReason; }
    public Instant getConnectedAt() { return connectedAt; }

    public boolean isTimedOut() {
        return cancellationReason == CancellationSignal.Reason.TIMEOUT;
    }

    @Override
    public String toString() {
        return "ConnectionResult{" +
                "success=" + success +
                ", connectionId='" + connectionId + '\'' +
                ", message='" + message + '\'' +
                ", serverVersion='" + serverVersion + '\'' +
                '}';
    }
}
