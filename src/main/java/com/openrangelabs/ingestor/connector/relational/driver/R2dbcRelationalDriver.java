package com.openrangelabs.ingestor.connector.relational.driver;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactoryOptions;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import io.r2dbc.spi.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Driver backed by whichever R2DBC driver is on the classpath for the dialect.
 *
 * <p>For {@link SqlDialect#H2} the host names the H2 protocol ({@code mem} or {@code file}).
 */
public class R2dbcRelationalDriver implements RelationalDriver {

    private static final Logger logger = LoggerFactory.getLogger(R2dbcRelationalDriver.class);

    private final SqlDialect dialect;

    public R2dbcRelationalDriver(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    @Override
    public SqlDialect dialect() {
        return dialect;
    }

    @Override
    public Mono<RelationalSession> open(RelationalConnectionSettings settings) {
        return Mono.defer(() -> Mono.from(ConnectionFactories.get(options(settings)).create()))
                .timeout(settings.getConnectTimeout())
                .doOnNext(connection -> logger.debug("Opened {} connection to {}", dialect, settings))
                .map(connection -> new R2dbcSession(dialect, connection, settings.getCommandTimeout()));
    }

    ConnectionFactoryOptions options(RelationalConnectionSettings settings) {
        ConnectionFactoryOptions.Builder builder = ConnectionFactoryOptions.builder()
                .option(ConnectionFactoryOptions.DRIVER, dialect.driverName())
                .option(ConnectionFactoryOptions.DATABASE, settings.getDatabase())
                .option(ConnectionFactoryOptions.CONNECT_TIMEOUT, settings.getConnectTimeout())
                .option(ConnectionFactoryOptions.STATEMENT_TIMEOUT, settings.getCommandTimeout());
        if (dialect == SqlDialect.H2) {
            builder.option(ConnectionFactoryOptions.PROTOCOL, settings.getHost());
        } else {
            builder.option(ConnectionFactoryOptions.HOST, settings.getHost())
                    .option(ConnectionFactoryOptions.PORT, settings.getPort())
                    .option(ConnectionFactoryOptions.SSL, settings.sslEnabled());
        }
        if (settings.getUsername() != null) {
            builder.option(ConnectionFactoryOptions.USER, settings.getUsername());
        }
        if (settings.getPassword() != null) {
            builder.option(ConnectionFactoryOptions.PASSWORD, settings.getPassword());
        }
        return builder.build();
    }

    static final class R2dbcSession implements RelationalSession {

        private final SqlDialect dialect;
        private final Connection connection;
        private final Duration commandTimeout;

        R2dbcSession(SqlDialect dialect, Connection connection, Duration commandTimeout) {
            this.dialect = dialect;
            this.connection = connection;
            this.commandTimeout = commandTimeout;
        }

        @Override
        public Mono<String> serverVersion() {
            return execute(new SqlDialect.Rendered(dialect.versionQuery(), List.of()),
                    (row, metadata) -> String.valueOf(row.get(0)))
                    .next()
                    .defaultIfEmpty("unknown");
        }

        @Override
        public Flux<TableDescriptor> describeTables(String schema) {
            return execute(dialect.renderTables(schema),
                    (row, metadata) -> new String[]{row.get("table_name", String.class), row.get("table_type", String.class)})
                    .collectList()
                    .flatMapMany(Flux::fromIterable)
                    .concatMap(table -> describe(schema, table[0], tableType(table[1])));
        }

        @Override
        public Mono<TableDescriptor> describeTable(String schema, String table) {
            return describe(schema, table, "table");
        }

        private Mono<TableDescriptor> describe(String schema, String table, String type) {
            Mono<List<String>> primaryKey = execute(dialect.renderPrimaryKey(schema, table),
                    (row, metadata) -> row.get("column_name", String.class))
                    .collectList();
            Mono<List<Object[]>> columns = execute(dialect.renderColumns(schema, table),
                    (row, metadata) -> new Object[]{
                            row.get("column_name", String.class),
                            row.get("data_type", String.class),
                            row.get("is_nullable", String.class),
                            row.get("max_length"),
                            row.get("num_precision"),
                            row.get("num_scale"),
                            row.get("ordinal")})
                    .collectList();
            return columns.zipWith(primaryKey)
                    .filter(tuple -> !tuple.getT1().isEmpty())
                    .map(tuple -> new TableDescriptor(schema, table, type, tuple.getT1().stream()
                            .map(column -> new ColumnDescriptor(
                                    (String) column[0],
                                    (String) column[1],
                                    "YES".equalsIgnoreCase((String) column[2]),
                                    tuple.getT2().contains((String) column[0]),
                                    asInteger(column[3]),
                                    asInteger(column[4]),
                                    asInteger(column[5]),
                                    Objects.requireNonNullElse(asInteger(column[6]), 0)))
                            .collect(Collectors.toList()), null));
        }

        @Override
        public Flux<Map<String, Object>> select(SelectQuery query) {
            return execute(dialect.renderSelect(query), R2dbcSession::toMap);
        }

        @Override
        public Mono<ChangeTrackingState> changeTrackingState(TableDescriptor table) {
            if (!dialect.supportsChangeTracking()) {
                return Mono.just(ChangeTrackingState.disabled());
            }
            return execute(dialect.renderChangeTrackingState(table), (row, metadata) -> new ChangeTrackingState(
                    asLong(row.get("enabled")) == 1,
                    asLong(row.get("current_version")),
                    asLong(row.get("min_valid_version"))))
                    .next()
                    .defaultIfEmpty(ChangeTrackingState.disabled());
        }

        @Override
        public Flux<Map<String, Object>> selectChanges(TableDescriptor table, long fromVersion, long toVersion) {
            return execute(dialect.renderChanges(table, fromVersion, toVersion), R2dbcSession::toMap);
        }

        @Override
        public Mono<Void> close() {
            return Mono.from(connection.close());
        }

        private <T> Flux<T> execute(SqlDialect.Rendered rendered, BiFunction<Row, RowMetadata, T> mapper) {
            return Flux.defer(() -> {
                logger.debug("Executing {} with {} bindings", rendered.sql(), rendered.bindings().size());
                Statement statement = connection.createStatement(rendered.sql());
                List<Object> bindings = rendered.bindings();
                for (int i = 0; i < bindings.size(); i++) {
                    statement.bind(i, bindings.get(i));
                }
                return Flux.from(statement.execute()).flatMap(result -> result.map(mapper));
            }).timeout(commandTimeout);
        }

        private static Map<String, Object> toMap(Row row, RowMetadata metadata) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < metadata.getColumnMetadatas().size(); i++) {
                values.put(metadata.getColumnMetadata(i).getName(), row.get(i));
            }
            return values;
        }

        private static String tableType(String catalogType) {
            return catalogType != null && catalogType.toUpperCase().contains("VIEW") ? "view" : "table";
        }

        private static Integer asInteger(Object value) {
            return value instanceof Number ? ((Number) value).intValue() : null;
        }

        private static long asLong(Object value) {
            return value instanceof Number ? ((Number) value).longValue() : 0L;
        }
    }
}
