package com.openrangelabs.ingestor.connector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable configuration handed to {@link DataSourceConnector#initialize(ConnectorConfiguration)}.
 *
 * <p>Connection parameters are the only carrier of backend-specific settings.
 */
public final class ConnectorConfiguration {

    private static final String MASK = "****";

    private final String connectorId;
    private final String displayName;
    private final UUID tenantId;
    private final Map<String, String> connectionParameters;

    public ConnectorConfiguration(String connectorId, String displayName, UUID tenantId,
                                  Map<String, String> connectionParameters) {
        this.connectorId = Objects.requireNonNull(connectorId, "connectorId");
        this.displayName = displayName;
        this.tenantId = tenantId;
        this.connectionParameters = connectionParameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(connectionParameters));
    }

    public String getConnectorId() { return connectorId; }
    public String getDisplayName() { return displayName; }
    public UUID getTenantId() { return tenantId; }
    public Map<String, String> getConnectionParameters() { return connectionParameters; }

    /**
     * Parameter values with anything that looks like a secret replaced by a mask.
     */
    public Map<String, String> maskedParameters() {
        Map<String, String> masked = new LinkedHashMap<>();
        connectionParameters.forEach((key, value) -> masked.put(key, looksSecret(key) ? MASK : value));
        return masked;
    }

    public static boolean looksSecret(String parameterName) {
        String name = parameterName.toLowerCase(Locale.ROOT);
        return name.contains("password") || name.contains("secret") || name.contains("token")
                || name.contains("apikey") || name.contains("api_key") || name.endsWith("key");
    }

    @Override
    public String toString() {
        return "ConnectorConfiguration{" +
                "connectorId='" + connectorId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", tenantId=" + tenantId +
                ", connectionParameters=" + maskedParameters() +
                '}';
    }
}
