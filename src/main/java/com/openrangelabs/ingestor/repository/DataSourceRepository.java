package com.openrangelabs.ingestor.repository;

import com.openrangelabs.ingestor.entity.DataSource;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Repository for data source definitions
 */
@Repository
public interface DataSourceRepository extends R2dbcRepository<DataSource, UUID> {

    Flux<DataSource> findByTenantId(UUID tenantId);
}
