package com.openrangelabs.ingestor.registry;

import com.openrangelabs.ingestor.connector.ConnectionState;
import com.openrangelabs.ingestor.connector.ConnectorConfiguration;
import com.openrangelabs.ingestor.connector.DataSourceConnector;
import com.openrangelabs.ingestor.connector.sample.SampleConnector;
import com.openrangelabs.ingestor.exception.ConnectionException;
import com.openrangelabs.ingestor.exception.ConnectorNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectorFactoryTest {

    private ConnectorFactory factory;

    @BeforeEach
    void setUp() {
        ConnectorRegistry registry = new ConnectorRegistry();
        registry.register(SampleConnector::new);
        factory = new ConnectorFactory(registry);
    }

    @Test
    void create_ReturnsFreshInstances() {
        DataSourceConnector first = factory.create(SampleConnector.CONNECTOR_ID);
        DataSourceConnector second = factory.createForSourceType("Sample");

        assertThat(first).isInstanceOf(SampleConnector.class);
        assertThat(second).isInstanceOf(SampleConnector.class).isNotSameAs(first);
        assertThat(first.getConnectionState()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void create_UnknownId_Throws() {
        assertThatThrownBy(() -> factory.create("ftp-connector"))
            .isInstanceOf(ConnectorNotFoundException.class)
            .hasMessageContaining("ftp-connector");
    }

    @Test
    void createAndInitialize_ValidConfiguration() {
        ConnectorConfiguration configuration = new ConnectorConfiguration(SampleConnector.CONNECTOR_ID, "Demo", null,
            Map.of("server", "sample.local", "apiKey", "k-123"));

        StepVerifier.create(factory.createAndInitialize(SampleConnector.CONNECTOR_ID, configuration))
            .assertNext(connector -> assertThat(connector.getId()).isEqualTo(SampleConnector.CONNECTOR_ID))
            .verifyComplete();
    }

    @Test
    void createAndInitialize_InvalidConfiguration_IsConnectionException() {
        ConnectorConfiguration configuration = new ConnectorConfiguration(SampleConnector.CONNECTOR_ID, "Demo", null,
            Map.of("server", "sample.local"));

        StepVerifier.create(factory.createAndInitialize(SampleConnector.CONNECTOR_ID, configuration))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(ConnectionException.class);
                assertThat(((ConnectionException) error).getConnectorId()).isEqualTo(SampleConnector.CONNECTOR_ID);
            })
            .verify();
    }

    @Test
    void createAndInitialize_UnknownId_SignalsError() {
        StepVerifier.create(factory.createAndInitialize("nope", new ConnectorConfiguration("nope", null, null, Map.of())))
            .expectError(ConnectorNotFoundException.class)
            .verify();
    }
}
