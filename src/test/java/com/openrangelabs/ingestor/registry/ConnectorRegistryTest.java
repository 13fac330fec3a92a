package com.openrangelabs.ingestor.registry;

import com.openrangelabs.ingestor.connector.ConnectorMetadata;
import com.openrangelabs.ingestor.connector.DataSourceConnector;
import com.openrangelabs.ingestor.connector.file.FileRepositoryConnector;
import com.openrangelabs.ingestor.connector.relational.PostgreSqlConnector;
import com.openrangelabs.ingestor.connector.sample.SampleConnector;
import com.openrangelabs.ingestor.exception.ConnectorRegistrationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectorRegistryTest {

    private ConnectorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectorRegistry();
    }

    @Test
    void register_ReadsMetadataFromConnector() {
        // Act
        ConnectorRegistration registration = registry.register(SampleConnector::new);

        // Assert
        assertThat(registration.getId()).isEqualTo(SampleConnector.CONNECTOR_ID);
        assertThat(registration.getName()).isEqualTo("Sample Connector");
        assertThat(registration.getSourceType()).isEqualTo("sample");
        assertThat(registration.getConnectorType()).isEqualTo(SampleConnector.class);
        assertThat(registration.getRegisteredAt()).isNotNull();
        assertThat(registry.isRegistered(SampleConnector.CONNECTOR_ID)).isTrue();
    }

    @Test
    void register_SameIdTwice_ReplacesEntry() {
        registry.register(SampleConnector::new);
        registry.register(SampleConnector::new);

        assertThat(registry.count()).isEqualTo(1);
    }

    @Test
    void register_RejectsSuppliersThatCannotDescribeAConnector() {
        assertThatThrownBy(() -> registry.register(() -> null))
            .isInstanceOf(ConnectorRegistrationException.class)
            .hasMessageContaining("returned no instance");
        assertThatThrownBy(() -> registry.register(() -> {
            throw new IllegalStateException("no driver");
        }))
            .isInstanceOf(ConnectorRegistrationException.class)
            .hasMessageContaining("no driver");
        assertThatThrownBy(() -> registry.register(UnnamedConnector::new))
            .isInstanceOf(ConnectorRegistrationException.class)
            .hasMessageContaining("does not describe an id, name and source type");
        assertThatThrownBy(() -> registry.register(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.count()).isZero();
    }

    @Test
    void newInstance_CallsTheRegisteredSupplierEachTime() {
        AtomicInteger created = new AtomicInteger();
        ConnectorRegistration registration = registry.register(() -> {
            created.incrementAndGet();
            return new SampleConnector();
        });

        DataSourceConnector first = registration.newInstance();
        DataSourceConnector second = registration.newInstance();

        assertThat(first).isNotSameAs(second);
        assertThat(created).hasValue(3);
    }

    @Test
    void lookups_ByIdAndSourceType() {
        registry.register(SampleConnector::new);
        registry.register(FileRepositoryConnector::new);
        registry.register(PostgreSqlConnector::new);

        assertThat(registry.getAll()).extracting(ConnectorRegistration::getId)
            .containsExactly(FileRepositoryConnector.CONNECTOR_ID, PostgreSqlConnector.CONNECTOR_ID, SampleConnector.CONNECTOR_ID);
        assertThat(registry.getById("missing")).isEmpty();
        assertThat(registry.getBySourceType("POSTGRESQL")).extracting(ConnectorRegistration::getId)
            .containsExactly(PostgreSqlConnector.CONNECTOR_ID);
        assertThat(registry.getBySourceType("ftp")).isEmpty();
        assertThatThrownBy(() -> registry.getBySourceType(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unregister_RemovesOnlyKnownIds() {
        registry.register(SampleConnector::new);

        assertThat(registry.unregister(SampleConnector.CONNECTOR_ID)).isTrue();
        assertThat(registry.unregister(SampleConnector.CONNECTOR_ID)).isFalse();
        assertThat(registry.isRegistered(null)).isFalse();
        assertThatThrownBy(() -> registry.getById(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static class UnnamedConnector extends SampleConnector {
        @Override
        public ConnectorMetadata describeMetadata() {
            return ConnectorMetadata.builder().id("unnamed").build();
        }
    }
}
