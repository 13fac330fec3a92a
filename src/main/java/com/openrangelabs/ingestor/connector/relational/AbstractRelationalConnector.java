package com.openrangelabs.ingestor.connector.relational;

import com.openrangelabs.ingestor.connector.AbstractDataSourceConnector;
import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.ConnectionParameter;
import com.openrangelabs.ingestor.connector.ConnectionResult;
import com.openrangelabs.ingestor.connector.DataStructureInfo;
import com.openrangelabs.ingestor.connector.FieldInfo;
import com.openrangelabs.ingestor.connector.ValidationResult;
import com.openrangelabs.ingestor.connector.relational.driver.ColumnDescriptor;
import com.openrangelabs.ingestor.connector.relational.driver.R2dbcRelationalDriver;
import com.openrangelabs.ingestor.connector.relational.driver.RelationalConnectionSettings;
import com.openrangelabs.ingestor.connector.relational.driver.RelationalDriver;
import com.openrangelabs.ingestor.connector.relational.driver.RelationalSession;
import com.openrangelabs.ingestor.connector.relational.driver.SelectQuery;
import com.openrangelabs.ingestor.connector.relational.driver.SqlDialect;
import com.openrangelabs.ingestor.connector.relational.driver.TableDescriptor;
import com.openrangelabs.ingestor.exception.ConnectionException;
import com.openrangelabs.ingestor.exception.ExtractionException;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.StructureQuery;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Abstract base class for relational database connectors
 * Validates the common host/database/credential parameters, maps catalog types to canonical
 * types and answers extraction queries through a {@link RelationalDriver}
 */
public abstract class AbstractRelationalConnector extends AbstractDataSourceConnector {

    private static final Set<String> SSL_MODES = Set.of("disable", "none", "allow", "prefer", "preferred",
            "require", "required", "verify-ca", "verifyca", "verify-full", "verifyfull");

    private static final Map<String, String> COMMON_TYPES = new HashMap<>();

    static {
        for (String type : List.of("smallint", "int", "integer", "int2", "int4", "mediumint", "tinyint", "serial", "serial4")) {
            COMMON_TYPES.put(type, "integer");
        }
        for (String type : List.of("bigint", "int8", "bigserial", "serial8")) {
            COMMON_TYPES.put(type, "long");
        }
        for (String type : List.of("decimal", "numeric", "money", "smallmoney")) {
            COMMON_TYPES.put(type, "decimal");
        }
        for (String type : List.of("real", "float", "float4", "float8", "double", "double precision")) {
            COMMON_TYPES.put(type, "double");
        }
        for (String type : List.of("bool", "boolean", "bit")) {
            COMMON_TYPES.put(type, "boolean");
        }
        for (String type : List.of("timestamp", "timestamp without time zone", "datetime", "datetime2", "smalldatetime")) {
            COMMON_TYPES.put(type, "datetime");
        }
        for (String type : List.of("timestamptz", "timestamp with time zone", "datetimeoffset")) {
            COMMON_TYPES.put(type, "datetimeoffset");
        }
        COMMON_TYPES.put("date", "date");
        for (String type : List.of("time", "timetz", "time without time zone", "time with time zone")) {
            COMMON_TYPES.put(type, "time");
        }
        for (String type : List.of("bytea", "binary", "varbinary", "blob", "tinyblob", "mediumblob", "longblob", "image", "binary varying")) {
            COMMON_TYPES.put(type, "binary");
        }
        for (String type : List.of("uuid", "uniqueidentifier")) {
            COMMON_TYPES.put(type, "uuid");
        }
        for (String type : List.of("json", "jsonb")) {
            COMMON_TYPES.put(type, "json");
        }
    }

    private final RelationalDriver driver;

    private volatile RelationalSession session;
    private volatile String schema;

    protected AbstractRelationalConnector(RelationalDriver driver) {
        this.driver = driver;
    }

    protected AbstractRelationalConnector(SqlDialect dialect) {
        this(new R2dbcRelationalDriver(dialect));
    }

    protected abstract int defaultPort();

    /**
     * Schema used when the parameters name none.
     */
    protected abstract String defaultSchema(Map<String, String> parameters);

    /**
     * Backend-specific native type names, checked before the common table.
     */
    protected Map<String, String> nativeTypeOverrides() {
        return Map.of();
    }

    protected SqlDialect dialect() {
        return driver.dialect();
    }

    protected RelationalSession session() {
        RelationalSession current = session;
        if (current == null) {
            throw new ConnectionException(getId(), "Connector " + getId() + " has no open session");
        }
        return current;
    }

    protected String currentSchema() {
        return schema;
    }

    @Override
    public List<ConnectionParameter> describeParameters() {
        return List.of(
                ConnectionParameter.builder().name("host").displayName("Host").required(true)
                        .description("Database server host name or address").group("connection").order(1).build(),
                ConnectionParameter.builder().name("port").displayName("Port").type("integer")
                        .defaultValue(String.valueOf(defaultPort())).validation("range:1-65535").group("connection").order(2).build(),
                ConnectionParameter.builder().name("database").displayName("Database").required(true)
                        .group("connection").order(3).build(),
                ConnectionParameter.builder().name("schema").displayName("Schema")
                        .defaultValue(defaultSchema(Map.of())).group("connection").order(4).build(),
                ConnectionParameter.builder().name("username").displayName("Username").required(true)
                        .group("authentication").order(5).build(),
                ConnectionParameter.builder().name("password").displayName("Password").required(true).secret(true)
                        .group("authentication").order(6).build(),
                ConnectionParameter.builder().name("sslMode").displayName("SSL mode").type("enum")
                        .enumValues(List.of("disable", "prefer", "require", "verify-ca", "verify-full"))
                        .defaultValue("prefer").group("security").order(7).build(),
                ConnectionParameter.builder().name("connectTimeout").displayName("Connect timeout (s)").type("integer")
                        .defaultValue("30").group("advanced").order(8).build(),
                ConnectionParameter.builder().name("commandTimeout").displayName("Command timeout (s)").type("integer")
                        .defaultValue("300").group("advanced").order(9).build());
    }

    @Override
    protected ValidationResult validateParameters(Map<String, String> parameters) {
        ValidationResult result = ValidationResult.success();
        if (host(parameters) == null) {
            result.addError("host", "Host is required");
        }
        if (text(parameters, "database") == null) {
            result.addError("database", "Database name is required");
        }
        if (text(parameters, "username") == null) {
            result.addError("username", "Username is required");
        }
        if (text(parameters, "password") == null) {
            result.addError("password", "Password is required");
        }
        integer(parameters, "port", 1, 65535, result);
        integer(parameters, "connectTimeout", 1, 3600, result);
        integer(parameters, "commandTimeout", 1, 86400, result);
        String sslMode = text(parameters, "sslMode");
        if (sslMode != null && !SSL_MODES.contains(sslMode.toLowerCase(Locale.ROOT))) {
            result.addError("sslMode", "SSL mode must be one of: disable, prefer, require, verify-ca, verify-full");
        } else if (sslMode != null && ("disable".equalsIgnoreCase(sslMode) || "none".equalsIgnoreCase(sslMode))) {
            result.addWarning("SSL is disabled; credentials and data travel unencrypted");
        }
        return result;
    }

    @Override
    protected ConnectionResult openSession(Map<String, String> parameters, CancellationSignal signal) {
        RelationalConnectionSettings connection = settingsFrom(parameters);
        RelationalSession opened = driver.open(connection).block();
        if (opened == null) {
            return ConnectionResult.failure("Driver returned no session for " + connection);
        }
        String version = opened.serverVersion().block(connection.getCommandTimeout());
        this.session = opened;
        this.schema = connection.getSchema();

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("host", connection.getHost());
        info.put("port", connection.getPort());
        info.put("database", connection.getDatabase());
        info.put("schema", connection.getSchema());
        info.put("ssl", connection.sslEnabled());
        return ConnectionResult.success(newConnectionId(getSourceType()),
                "Connected to " + describeMetadata().getName().replace(" Connector", ""), version, info);
    }

    @Override
    protected void closeSession() {
        RelationalSession current = session;
        session = null;
        if (current != null) {
            current.close().block();
        }
    }

    @Override
    protected boolean checkReachable(Map<String, String> parameters, CancellationSignal signal) {
        RelationalConnectionSettings connection = settingsFrom(parameters);
        return driver.open(connection)
                .flatMap(session -> session.serverVersion()
                        .doOnNext(version -> logger.debug("Connection test for {} reached {}", getId(), version))
                        .then(session.close())
                        .thenReturn(true))
                .defaultIfEmpty(false)
                .block(connection.getConnectTimeout().plus(connection.getCommandTimeout()));
    }

    @Override
    protected Mono<List<DataStructureInfo>> doDiscover(Map<String, String> filter) {
        String discoverSchema = Optional.ofNullable(filter.get("schema")).orElse(schema);
        String pattern = Optional.ofNullable(filter.get("name")).map(name -> name.toLowerCase(Locale.ROOT)).orElse("");
        return session().describeTables(discoverSchema)
                .filter(table -> table.name().toLowerCase(Locale.ROOT).contains(pattern))
                .map(this::toStructure)
                .collectList();
    }

    @Override
    protected Mono<List<DataStructureInfo>> resolveTargets(ExtractionParameters parameters) {
        if (parameters.targetsAllStructures()) {
            return doDiscover(Map.of());
        }
        return Flux.fromIterable(parameters.getTargetStructures())
                .concatMap(target -> {
                    int dot = target.indexOf('.');
                    String targetSchema = dot > 0 ? target.substring(0, dot) : schema;
                    String table = dot > 0 ? target.substring(dot + 1) : target;
                    return session().describeTable(targetSchema, table)
                            .switchIfEmpty(Mono.error(() -> new ExtractionException("Structure '" + target + "' not found")));
                })
                .map(this::toStructure)
                .collectList();
    }

    @Override
    protected Flux<DataRow> read(StructureQuery query) {
        DataStructureInfo structure = query.getStructure();
        SelectQuery.SelectQueryBuilder select = SelectQuery.builder()
                .schema(structure.getSchema())
                .table(structure.getName())
                .fields(query.getFields())
                .orderBy(query.getOrderBy())
                .offset(query.getOffset())
                .limit(query.getLimit());
        query.getFilters().forEach(select::filter);
        if (query.hasTrackingBound()) {
            FieldInfo tracking = structure.findField(query.getTrackingField())
                    .orElseThrow(() -> new ExtractionException("Tracking field '" + query.getTrackingField() + "' does not exist"));
            select.trackingField(tracking.getName())
                    .trackingAfter(bindValue(query.getTrackingAfter(), tracking.getDataType()));
        }
        return session().select(select.build()).map(DataRow::of);
    }

    protected DataStructureInfo toStructure(TableDescriptor table) {
        List<FieldInfo> fields = table.columns().stream()
                .map(this::toField)
                .collect(Collectors.toList());
        Map<String, Object> properties = new HashMap<>();
        properties.put("primaryKey", table.primaryKeyColumns());
        return new DataStructureInfo(table.name(), table.schema(), table.type(), null, fields, table.estimatedRows(), properties);
    }

    protected FieldInfo toField(ColumnDescriptor column) {
        return FieldInfo.builder()
                .name(column.name())
                .nativeType(column.nativeType())
                .dataType(canonicalType(column.nativeType()))
                .nullable(column.nullable())
                .primaryKey(column.primaryKey())
                .maxLength(column.maxLength())
                .precision(column.precision())
                .scale(column.scale())
                .build();
    }

    /**
     * Maps a catalog type name to a canonical type; anything unknown is a string.
     */
    public String canonicalType(String nativeType) {
        if (nativeType == null) {
            return "string";
        }
        String normalized = nativeType.toLowerCase(Locale.ROOT).trim();
        int paren = normalized.indexOf('(');
        if (paren > 0) {
            normalized = normalized.substring(0, paren).trim();
        }
        String mapped = nativeTypeOverrides().get(normalized);
        if (mapped != null) {
            return mapped;
        }
        return COMMON_TYPES.getOrDefault(normalized, "string");
    }

    /**
     * Converts a tracking bound to the Java type the driver binds for the column.
     */
    static Object bindValue(FieldValue value, String canonicalType) {
        return switch (canonicalType == null ? "string" : canonicalType) {
            case "integer", "long" -> value.asNumber().map(BigDecimal::longValue)
                    .orElseThrow(() -> new ExtractionException("Tracking value '" + value.asString() + "' is not a number"));
            case "decimal", "double" -> value.asNumber()
                    .orElseThrow(() -> new ExtractionException("Tracking value '" + value.asString() + "' is not a number"));
            case "datetime" -> LocalDateTime.ofInstant(timestamp(value), ZoneOffset.UTC);
            case "datetimeoffset" -> OffsetDateTime.ofInstant(timestamp(value), ZoneOffset.UTC);
            case "date" -> LocalDate.ofInstant(timestamp(value), ZoneOffset.UTC);
            case "boolean" -> value.asBoolean().orElse(Boolean.FALSE);
            default -> value.asString();
        };
    }

    private static Instant timestamp(FieldValue value) {
        return value.asTimestamp()
                .orElseThrow(() -> new ExtractionException("Tracking value '" + value.asString() + "' is not a timestamp"));
    }

    protected RelationalConnectionSettings settingsFrom(Map<String, String> parameters) {
        Duration connectTimeout = Optional.ofNullable(text(parameters, "connectTimeout"))
                .map(seconds -> Duration.ofSeconds(Long.parseLong(seconds)))
                .orElse(settings().getConnectTimeout());
        Duration commandTimeout = Optional.ofNullable(text(parameters, "commandTimeout"))
                .map(seconds -> Duration.ofSeconds(Long.parseLong(seconds)))
                .orElse(settings().getCommandTimeout());
        return RelationalConnectionSettings.builder()
                .host(host(parameters))
                .port(Optional.ofNullable(text(parameters, "port")).map(Integer::parseInt).orElse(defaultPort()))
                .database(text(parameters, "database"))
                .username(text(parameters, "username"))
                .password(text(parameters, "password"))
                .schema(Optional.ofNullable(text(parameters, "schema")).orElse(defaultSchema(parameters)))
                .sslMode(Optional.ofNullable(text(parameters, "sslMode")).orElse("prefer"))
                .connectTimeout(connectTimeout)
                .commandTimeout(commandTimeout)
                .build();
    }

    private static String host(Map<String, String> parameters) {
        String host = text(parameters, "host");
        return host != null ? host : text(parameters, "server");
    }
}
