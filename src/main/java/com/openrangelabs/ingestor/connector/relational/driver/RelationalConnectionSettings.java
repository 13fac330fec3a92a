package com.openrangelabs.ingestor.connector.relational.driver;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Everything a driver needs to open a session
 */
@Value
@Builder
public class RelationalConnectionSettings {

    String host;
    int port;
    String database;
    String username;
    String password;
    String schema;
    String sslMode;

    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration commandTimeout = Duration.ofSeconds(300);

    public boolean sslEnabled() {
        return sslMode != null && !"disable".equalsIgnoreCase(sslMode) && !"false".equalsIgnoreCase(sslMode);
    }

    @Override
    public String toString() {
        return String.format("%s@%s:%d/%s (schema %s, ssl %s)", username, host, port, database, schema, sslMode);
    }
}
