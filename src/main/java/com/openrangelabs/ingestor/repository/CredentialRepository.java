package com.openrangelabs.ingestor.repository;

import com.openrangelabs.ingestor.entity.Credential;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Repository for encrypted credentials
 */
@Repository
public interface CredentialRepository extends R2dbcRepository<Credential, UUID> {

    @Query("SELECT * FROM credentials WHERE credential_key = :key")
    Mono<Credential> findByKey(@Param("key") String key);

    @Query("SELECT * FROM credentials ORDER BY credential_key")
    Flux<Credential> findAllOrderByKey();

    /**
     * Access statistics are bumped in one statement so concurrent reads never lose a count
     */
    @Modifying
    @Query("""
        UPDATE credentials
        SET access_count = access_count + 1, last_accessed_at = :accessedAt
        WHERE credential_key = :key
        """)
    Mono<Integer> recordAccess(@Param("key") String key, @Param("accessedAt") LocalDateTime accessedAt);

    @Modifying
    @Query("UPDATE credentials SET is_enabled = false, modified_at = :modifiedAt WHERE credential_key = :key")
    Mono<Integer> disable(@Param("key") String key, @Param("modifiedAt") LocalDateTime modifiedAt);

    @Modifying
    @Query("DELETE FROM credentials WHERE credential_key = :key")
    Mono<Integer> deleteByKey(@Param("key") String key);
}
