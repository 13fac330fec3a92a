package com.openrangelabs.ingestor.repository;

import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Repository for ingestion job definitions
 */
@Repository
public interface IngestionJobDefinitionRepository extends R2dbcRepository<IngestionJobDefinition, UUID> {

    @Query("SELECT * FROM ingestion_jobs WHERE tenant_id = :tenantId ORDER BY created_at")
    Flux<IngestionJobDefinition> findByTenantId(@Param("tenantId") UUID tenantId);

    /**
     * Jobs whose recurring trigger should be live
     */
    @Query("""
        SELECT * FROM ingestion_jobs
        WHERE cron_expression IS NOT NULL AND cron_expression <> '' AND is_paused = false
        """)
    Flux<IngestionJobDefinition> findSchedulable();
}
