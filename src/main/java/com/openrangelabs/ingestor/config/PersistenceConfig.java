package com.openrangelabs.ingestor.config;

import com.openrangelabs.ingestor.entity.Credential;
import com.openrangelabs.ingestor.entity.DataSource;
import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.mapping.event.BeforeConvertCallback;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Assigns UUID primary keys to new rows before they are inserted
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public BeforeConvertCallback<Credential> credentialIdCallback() {
        return (credential, table) -> {
            if (credential.getId() == null) {
                credential.setId(UUID.randomUUID());
            }
            return Mono.just(credential);
        };
    }

    @Bean
    public BeforeConvertCallback<DataSource> dataSourceIdCallback() {
        return (dataSource, table) -> {
            if (dataSource.getId() == null) {
                dataSource.setId(UUID.randomUUID());
            }
            return Mono.just(dataSource);
        };
    }

    @Bean
    public BeforeConvertCallback<IngestionJobDefinition> jobIdCallback() {
        return (job, table) -> {
            if (job.getId() == null) {
                job.setId(UUID.randomUUID());
            }
            return Mono.just(job);
        };
    }
}
