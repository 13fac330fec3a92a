package com.openrangelabs.ingestor.connector;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connector-wide timeouts and progress cadence
 */
@Component
public class ConnectorSettings {

    private final Duration connectTimeout;
    private final Duration commandTimeout;
    private final int progressInterval;

    public ConnectorSettings(@Value("${ingestion.connectors.connect-timeout:30s}") Duration connectTimeout,
                             @Value("${ingestion.connectors.command-timeout:300s}") Duration commandTimeout,
                             @Value("${ingestion.connectors.progress-interval:100}") int progressInterval) {
        this.connectTimeout = connectTimeout;
        this.commandTimeout = commandTimeout;
        this.progressInterval = progressInterval;
    }

    public static ConnectorSettings defaults() {
        return new ConnectorSettings(Duration.ofSeconds(30), Duration.ofSeconds(300), 100);
    }

    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getCommandTimeout() { return commandTimeout; }
    public int getProgressInterval() { return progressInterval; }
}
