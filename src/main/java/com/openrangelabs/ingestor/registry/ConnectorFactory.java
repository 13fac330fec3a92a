package com.openrangelabs.ingestor.registry;

import com.openrangelabs.ingestor.connector.ConnectorConfiguration;
import com.openrangelabs.ingestor.connector.DataSourceConnector;
import com.openrangelabs.ingestor.exception.ConnectionException;
import com.openrangelabs.ingestor.exception.ConnectorNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Creates connector instances for registered ids through each registration's supplier
 */
@Component
public class ConnectorFactory {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorFactory.class);

    private final ConnectorRegistry registry;

    public ConnectorFactory(ConnectorRegistry registry) {
        this.registry = registry;
    }

    public DataSourceConnector create(String connectorId) {
        ConnectorRegistration registration = registry.getById(connectorId)
                .orElseThrow(() -> new ConnectorNotFoundException(connectorId));
        return instantiate(registration);
    }

    public DataSourceConnector createForSourceType(String sourceType) {
        return registry.getBySourceType(sourceType).stream()
                .findFirst()
                .map(this::instantiate)
                .orElseThrow(() -> new ConnectorNotFoundException(sourceType));
    }

    /**
     * Creates and initializes a connector; an instance whose initialization fails is closed
     * before the error is signalled.
     */
    public Mono<DataSourceConnector> createAndInitialize(String connectorId, ConnectorConfiguration configuration) {
        return Mono.fromCallable(() -> create(connectorId))
                .flatMap(connector -> initialize(connector, configuration));
    }

    public Mono<DataSourceConnector> initialize(DataSourceConnector connector, ConnectorConfiguration configuration) {
        return connector.initialize(configuration)
                .onErrorResume(e -> {
                    connector.close();
                    return Mono.error(new ConnectionException(connector.getId(),
                            "Failed to initialize connector " + connector.getId() + ": " + e.getMessage(), e));
                })
                .flatMap(initialized -> {
                    if (!initialized) {
                        connector.close();
                        return Mono.error(new ConnectionException(connector.getId(),
                                "Failed to initialize connector " + connector.getId()));
                    }
                    return Mono.just(connector);
                });
    }

    private DataSourceConnector instantiate(ConnectorRegistration registration) {
        DataSourceConnector connector = registration.newInstance();
        logger.debug("Created connector instance {} ({})", registration.getId(), registration.getConnectorType().getSimpleName());
        return connector;
    }
}
