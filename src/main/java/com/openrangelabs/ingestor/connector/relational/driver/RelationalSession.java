package com.openrangelabs.ingestor.connector.relational.driver;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * One open connection to a relational backend.
 * Rows come back as column name to raw driver value.
 */
public interface RelationalSession {

    Mono<String> serverVersion();

    /**
     * Tables and views of a schema, with their columns.
     */
    Flux<TableDescriptor> describeTables(String schema);

    /**
     * A single table, or empty if it does not exist.
     */
    Mono<TableDescriptor> describeTable(String schema, String table);

    Flux<Map<String, Object>> select(SelectQuery query);

    Mono<ChangeTrackingState> changeTrackingState(TableDescriptor table);

    /**
     * Current image of every row changed after {@code fromVersion} up to {@code toVersion},
     * together with the change version and operation columns.
     */
    Flux<Map<String, Object>> selectChanges(TableDescriptor table, long fromVersion, long toVersion);

    Mono<Void> close();
}
