package com.openrangelabs.ingestor.registry;

import com.openrangelabs.ingestor.connector.ConnectorMetadata;
import com.openrangelabs.ingestor.connector.DataSourceConnector;
import com.openrangelabs.ingestor.exception.ConnectorRegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Registry of connector implementations keyed by connector id
 *
 * <p>Each connector is registered with the supplier that creates its instances. Metadata is read
 * from one supplied instance's {@link DataSourceConnector#describeMetadata()}, which is closed again.
 * Registering an id twice replaces the earlier entry and logs a warning.
 */
@Component
public class ConnectorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final Map<String, ConnectorRegistration> connectors = new ConcurrentHashMap<>();

    public ConnectorRegistration register(Supplier<? extends DataSourceConnector> supplier) {
        if (supplier == null) {
            throw new IllegalArgumentException("Connector supplier must not be null");
        }
        ConnectorRegistration registration = describe(supplier);

        ConnectorRegistration previous = connectors.put(registration.getId(), registration);
        if (previous != null) {
            logger.warn("Connector with ID {} is already registered (type: {}). Replacing with {}",
                    registration.getId(), previous.getConnectorType().getName(), registration.getConnectorType().getName());
        }
        logger.info("Registered connector: {} ({})", registration.getId(), registration.getName());
        return registration;
    }

    public boolean unregister(String connectorId) {
        requireId(connectorId);
        boolean removed = connectors.remove(connectorId) != null;
        if (removed) {
            logger.info("Unregistered connector: {}", connectorId);
        }
        return removed;
    }

    public Optional<ConnectorRegistration> getById(String connectorId) {
        requireId(connectorId);
        return Optional.ofNullable(connectors.get(connectorId));
    }

    public List<ConnectorRegistration> getAll() {
        return connectors.values().stream()
                .sorted(Comparator.comparing(ConnectorRegistration::getId))
                .collect(Collectors.toList());
    }

    public List<ConnectorRegistration> getBySourceType(String sourceType) {
        if (sourceType == null || sourceType.isBlank()) {
            throw new IllegalArgumentException("Source type must not be empty");
        }
        return getAll().stream()
                .filter(registration -> registration.servesSourceType(sourceType))
                .collect(Collectors.toList());
    }

    public boolean isRegistered(String connectorId) {
        return connectorId != null && connectors.containsKey(connectorId);
    }

    public int count() {
        return connectors.size();
    }

    private static ConnectorRegistration describe(Supplier<? extends DataSourceConnector> supplier) {
        DataSourceConnector instance;
        try {
            instance = supplier.get();
        } catch (RuntimeException e) {
            throw new ConnectorRegistrationException("Connector supplier failed: " + e.getMessage(), e);
        }
        if (instance == null) {
            throw new ConnectorRegistrationException("Connector supplier returned no instance");
        }
        try (DataSourceConnector connector = instance) {
            ConnectorMetadata metadata = connector.describeMetadata();
            if (metadata == null || !metadata.isComplete()) {
                throw new ConnectorRegistrationException("Connector type " + connector.getClass().getName()
                        + " does not describe an id, name and source type");
            }
            return new ConnectorRegistration(metadata.getId(), metadata.getName(), metadata.getSourceType(),
                    metadata.getDescription(), metadata.getVersion(),
                    List.copyOf(connector.getCapabilities().getSupportedSourceTypes()), connector.getClass(),
                    Instant.now(), supplier);
        }
    }

    private static void requireId(String connectorId) {
        if (connectorId == null || connectorId.isBlank()) {
            throw new IllegalArgumentException("Connector ID must not be empty");
        }
    }
}
