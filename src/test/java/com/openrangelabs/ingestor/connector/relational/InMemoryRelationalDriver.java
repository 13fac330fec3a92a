package com.openrangelabs.ingestor.connector.relational;

import com.openrangelabs.ingestor.connector.relational.driver.ChangeTrackingState;
import com.openrangelabs.ingestor.connector.relational.driver.RelationalConnectionSettings;
import com.openrangelabs.ingestor.connector.relational.driver.RelationalDriver;
import com.openrangelabs.ingestor.connector.relational.driver.RelationalSession;
import com.openrangelabs.ingestor.connector.relational.driver.SelectQuery;
import com.openrangelabs.ingestor.connector.relational.driver.SqlDialect;
import com.openrangelabs.ingestor.connector.relational.driver.TableDescriptor;
import com.openrangelabs.ingestor.extraction.RowPredicates;
import com.openrangelabs.ingestor.extraction.TrackingValueComparator;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Relational driver over in-memory tables, evaluating {@link SelectQuery} the way a database would.
 */
class InMemoryRelationalDriver implements RelationalDriver {

    private final SqlDialect dialect;
    private final Map<String, TableDescriptor> tables = new LinkedHashMap<>();
    private final Map<String, List<Map<String, Object>>> rows = new LinkedHashMap<>();
    private final Map<String, ChangeTrackingState> changeTracking = new LinkedHashMap<>();
    private final Map<String, List<Map<String, Object>>> changes = new LinkedHashMap<>();
    private final AtomicInteger openSessions = new AtomicInteger();

    private RelationalConnectionSettings lastSettings;
    private boolean failOnOpen;

    InMemoryRelationalDriver(SqlDialect dialect) {
        this.dialect = dialect;
    }

    InMemoryRelationalDriver table(TableDescriptor table, List<Map<String, Object>> data) {
        tables.put(table.qualifiedName(), table);
        rows.put(table.qualifiedName(), new ArrayList<>(data));
        return this;
    }

    InMemoryRelationalDriver changeTracking(String qualifiedName, ChangeTrackingState state, List<Map<String, Object>> changedRows) {
        changeTracking.put(qualifiedName, state);
        changes.put(qualifiedName, new ArrayList<>(changedRows));
        return this;
    }

    InMemoryRelationalDriver failOnOpen() {
        this.failOnOpen = true;
        return this;
    }

    void insert(String qualifiedName, Map<String, Object> row) {
        rows.get(qualifiedName).add(row);
    }

    int openSessions() {
        return openSessions.get();
    }

    RelationalConnectionSettings lastSettings() {
        return lastSettings;
    }

    @Override
    public SqlDialect dialect() {
        return dialect;
    }

    @Override
    public Mono<RelationalSession> open(RelationalConnectionSettings settings) {
        return Mono.defer(() -> {
            if (failOnOpen) {
                return Mono.error(new IllegalStateException("Connection refused: " + settings.getHost()));
            }
            lastSettings = settings;
            openSessions.incrementAndGet();
            return Mono.just(new Session());
        });
    }

    private final class Session implements RelationalSession {

        @Override
        public Mono<String> serverVersion() {
            return Mono.just("in-memory " + dialect.name());
        }

        @Override
        public Flux<TableDescriptor> describeTables(String schema) {
            return Flux.fromIterable(tables.values()).filter(table -> schema == null || schema.equals(table.schema()));
        }

        @Override
        public Mono<TableDescriptor> describeTable(String schema, String table) {
            return Mono.justOrEmpty(tables.get(schema == null ? table : schema + "." + table));
        }

        @Override
        public Flux<Map<String, Object>> select(SelectQuery query) {
            String name = query.getSchema() == null ? query.getTable() : query.getSchema() + "." + query.getTable();
            List<Map<String, Object>> data = rows.getOrDefault(name, List.of());
            FieldValue after = FieldValue.from(query.getTrackingAfter());

            Comparator<Map<String, Object>> order = (left, right) -> 0;
            for (String column : query.getOrderBy()) {
                order = order.thenComparing(row -> FieldValue.from(row.get(column)), TrackingValueComparator.INSTANCE);
            }
            List<Map<String, Object>> matching = data.stream()
                    .filter(row -> RowPredicates.matchesFilters(DataRow.of(row), query.getFilters()))
                    .filter(row -> !query.hasTrackingPredicate()
                            || RowPredicates.isAfter(DataRow.of(row), query.getTrackingField(), after))
                    .sorted(order)
                    .skip(query.getOffset())
                    .limit(query.getLimit() > 0 ? query.getLimit() : Long.MAX_VALUE)
                    .map(row -> project(row, query.getFields()))
                    .collect(Collectors.toList());
            return Flux.fromIterable(matching);
        }

        @Override
        public Mono<ChangeTrackingState> changeTrackingState(TableDescriptor table) {
            return Mono.just(changeTracking.getOrDefault(table.qualifiedName(), ChangeTrackingState.disabled()));
        }

        @Override
        public Flux<Map<String, Object>> selectChanges(TableDescriptor table, long fromVersion, long toVersion) {
            return Flux.fromIterable(changes.getOrDefault(table.qualifiedName(), List.of()))
                    .filter(change -> {
                        long version = ((Number) change.get("SYS_CHANGE_VERSION")).longValue();
                        return version > fromVersion && version <= toVersion;
                    });
        }

        @Override
        public Mono<Void> close() {
            return Mono.fromRunnable(openSessions::decrementAndGet);
        }

        private Map<String, Object> project(Map<String, Object> row, List<String> fields) {
            if (fields.isEmpty()) {
                return row;
            }
            Map<String, Object> projected = new LinkedHashMap<>();
            fields.forEach(field -> projected.put(field, row.get(field)));
            return projected;
        }
    }
}
