package com.openrangelabs.ingestor.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.entity.DataSource;
import com.openrangelabs.ingestor.exception.CredentialErrorKind;
import com.openrangelabs.ingestor.exception.CredentialException;
import com.openrangelabs.ingestor.exception.IngestionException;
import com.openrangelabs.ingestor.service.CredentialStoreService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the connection parameters for a data source: stored plain parameters overlaid with
 * secrets read from the credential store.
 */
@Component
public class DataSourceParameterResolver {

    private static final TypeReference<Map<String, String>> PARAMETERS_TYPE = new TypeReference<>() { };

    private final CredentialStoreService credentialStore;
    private final ObjectMapper objectMapper;

    @Autowired
    public DataSourceParameterResolver(CredentialStoreService credentialStore, ObjectMapper objectMapper) {
        this.credentialStore = credentialStore;
        this.objectMapper = objectMapper;
    }

    public Mono<Map<String, String>> resolve(DataSource dataSource) {
        Map<String, String> parameters;
        Map<String, String> secretKeys;
        try {
            parameters = readMap(dataSource.getConnectionParametersJson(), "connection parameters");
            secretKeys = readMap(dataSource.getSecretParametersJson(), "secret parameters");
        } catch (IngestionException e) {
            return Mono.error(e);
        }

        return Flux.fromIterable(secretKeys.entrySet())
                .concatMap(entry -> credentialStore.get(entry.getValue())
                        .switchIfEmpty(Mono.error(new CredentialException(CredentialErrorKind.RETRIEVAL,
                                "Credential '" + entry.getValue() + "' for parameter '" + entry.getKey()
                                        + "' is missing, disabled or expired")))
                        .map(secret -> Map.entry(entry.getKey(), secret)))
                .collectList()
                .map(secrets -> {
                    Map<String, String> merged = new LinkedHashMap<>(parameters);
                    secrets.forEach(secret -> merged.put(secret.getKey(), secret.getValue()));
                    return merged;
                });
    }

    private Map<String, String> readMap(String json, String what) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return new LinkedHashMap<>(objectMapper.readValue(json, PARAMETERS_TYPE));
        } catch (JsonProcessingException e) {
            throw new IngestionException("Invalid " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }
}
