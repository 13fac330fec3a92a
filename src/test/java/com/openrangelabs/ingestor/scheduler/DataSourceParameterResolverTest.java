package com.openrangelabs.ingestor.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.entity.DataSource;
import com.openrangelabs.ingestor.exception.CredentialException;
import com.openrangelabs.ingestor.exception.IngestionException;
import com.openrangelabs.ingestor.service.CredentialStoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataSourceParameterResolverTest {

    @Mock
    private CredentialStoreService credentialStore;

    private DataSourceParameterResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DataSourceParameterResolver(credentialStore, new ObjectMapper());
    }

    @Test
    void resolve_OverlaysSecretsOnPlainParameters() {
        // Arrange
        DataSource dataSource = dataSource("{\"host\":\"db.internal\",\"password\":\"placeholder\"}",
            "{\"password\":\"crm-db.password\"}");
        when(credentialStore.get("crm-db.password")).thenReturn(Mono.just("s3cret"));

        // Act & Assert
        StepVerifier.create(resolver.resolve(dataSource))
            .assertNext(parameters -> assertThat(parameters)
                .containsEntry("host", "db.internal")
                .containsEntry("password", "s3cret")
                .hasSize(2))
            .verifyComplete();
    }

    @Test
    void resolve_MissingCredentialIsAnError() {
        DataSource dataSource = dataSource(null, "{\"apiKey\":\"sample.key\"}");
        when(credentialStore.get("sample.key")).thenReturn(Mono.empty());

        StepVerifier.create(resolver.resolve(dataSource))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(CredentialException.class)
                .hasMessageContaining("sample.key")
                .hasMessageContaining("apiKey"))
            .verify();
    }

    @Test
    void resolve_MalformedJsonIsAnError() {
        StepVerifier.create(resolver.resolve(dataSource("{host", null)))
            .expectError(IngestionException.class)
            .verify();
    }

    @Test
    void resolve_NoParametersAtAll() {
        StepVerifier.create(resolver.resolve(dataSource(null, null)))
            .assertNext(parameters -> assertThat(parameters).isEmpty())
            .verifyComplete();
    }

    private static DataSource dataSource(String parameters, String secrets) {
        DataSource dataSource = new DataSource(UUID.randomUUID(), "CRM", "postgresql");
        dataSource.setConnectionParametersJson(parameters);
        dataSource.setSecretParametersJson(secrets);
        return dataSource;
    }
}
