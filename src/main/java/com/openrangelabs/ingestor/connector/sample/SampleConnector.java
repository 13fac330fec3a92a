package com.openrangelabs.ingestor.connector.sample;

import com.openrangelabs.ingestor.connector.AbstractDataSourceConnector;
import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.ConnectionParameter;
import com.openrangelabs.ingestor.connector.ConnectionResult;
import com.openrangelabs.ingestor.connector.ConnectorCapabilities;
import com.openrangelabs.ingestor.connector.ConnectorMetadata;
import com.openrangelabs.ingestor.connector.DataStructureInfo;
import com.openrangelabs.ingestor.connector.FieldInfo;
import com.openrangelabs.ingestor.connector.ValidationResult;
import com.openrangelabs.ingestor.exception.ConnectionException;
import com.openrangelabs.ingestor.exception.ExtractionException;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.StructureQuery;
import com.openrangelabs.ingestor.model.DataRow;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Synthetic connector serving two generated tables.
 * Used for smoke tests, demos and exercising the extraction protocol without a backend.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class SampleConnector extends AbstractDataSourceConnector {

    public static final String CONNECTOR_ID = "sample-connector";
    public static final String TABLE_ITEMS = "sample_table_1";
    public static final String TABLE_CATEGORIES = "sample_table_2";

    private static final int DEFAULT_PORT = 1234;
    private static final int DEFAULT_RECORDS = 100;
    private static final String[] CATEGORIES = {"alpha", "beta", "gamma"};
    private static final Instant BASE_DATE = Instant.parse("2024-01-01T00:00:00Z");

    private static final ConnectorMetadata METADATA = ConnectorMetadata.builder()
            .id(CONNECTOR_ID)
            .name("Sample Connector")
            .sourceType("sample")
            .description("Generates deterministic sample tables for testing ingestion pipelines")
            .capability("incremental")
            .capability("preview")
            .category("testing")
            .build();

    private static final ConnectorCapabilities CAPABILITIES = ConnectorCapabilities.builder()
            .supportsIncremental(true)
            .supportsSchemaDiscovery(true)
            .supportsPreview(true)
            .supportsResume(true)
            .maxConcurrentExtractions(1)
            .authenticationMode("apikey")
            .supportedSourceType("sample")
            .supportedSourceType("synthetic")
            .supportedSourceType("test")
            .build();

    private final Map<String, List<DataRow>> tables = new ConcurrentHashMap<>();

    @Override
    public ConnectorMetadata describeMetadata() {
        return METADATA;
    }

    @Override
    public List<ConnectionParameter> describeParameters() {
        return List.of(
                ConnectionParameter.builder().name("server").displayName("Server").required(true)
                        .description("Sample server host name").group("connection").order(1).build(),
                ConnectionParameter.builder().name("port").displayName("Port").type("integer")
                        .defaultValue(String.valueOf(DEFAULT_PORT)).validation("range:1-65535").group("connection").order(2).build(),
                ConnectionParameter.builder().name("apiKey").displayName("API Key").required(true).secret(true)
                        .group("authentication").order(3).build(),
                ConnectionParameter.builder().name("useTls").displayName("Use TLS").type("boolean")
                        .defaultValue("true").group("connection").order(4).build(),
                ConnectionParameter.builder().name("maxRecords").displayName("Records per table").type("integer")
                        .defaultValue(String.valueOf(DEFAULT_RECORDS)).validation("range:1-10000").group("data").order(5).build(),
                ConnectionParameter.builder().name("simulateFailure").displayName("Simulate failure").type("boolean")
                        .defaultValue("false").description("Make every connection attempt fail").group("testing").order(6).build());
    }

    @Override
    public ConnectorCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    protected ValidationResult validateParameters(Map<String, String> parameters) {
        ValidationResult result = ValidationResult.success();
        if (text(parameters, "server") == null) {
            result.addError("server", "Server is required");
        }
        String apiKey = text(parameters, "apiKey");
        if (apiKey == null) {
            result.addError("apiKey", "API key is required");
        } else if (apiKey.length() < 16) {
            result.addWarning("API key is shorter than 16 characters");
        }
        integer(parameters, "port", 1, 65535, result);
        integer(parameters, "maxRecords", 1, 10000, result);
        if (!flag(parameters, "useTls", true)) {
            result.addWarning("Connection is not using TLS");
        }
        return result;
    }

    @Override
    protected ConnectionResult openSession(Map<String, String> parameters, CancellationSignal signal) {
        if (flag(parameters, "simulateFailure", false)) {
            return ConnectionResult.failure("Simulated connection failure");
        }
        int records = Optional.ofNullable(text(parameters, "maxRecords")).map(Integer::parseInt).orElse(DEFAULT_RECORDS);
        synchronized (tables) {
            if (tables.isEmpty()) {
                tables.put(TABLE_ITEMS, new CopyOnWriteArrayList<>());
                tables.put(TABLE_CATEGORIES, new CopyOnWriteArrayList<>());
                appendRows(records);
            }
        }
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("server", text(parameters, "server"));
        info.put("port", Optional.ofNullable(text(parameters, "port")).orElse(String.valueOf(DEFAULT_PORT)));
        info.put("tls", flag(parameters, "useTls", true));
        return ConnectionResult.success(newConnectionId("sample"), "Connected to sample source", "Sample 1.0", info);
    }

    @Override
    protected void closeSession() {
        logger.debug("Sample session closed");
    }

    @Override
    protected boolean checkReachable(Map<String, String> parameters, CancellationSignal signal) {
        return !flag(parameters, "simulateFailure", false);
    }

    /**
     * Appends {@code count} generated rows to both tables, continuing the id sequence.
     */
    public void appendRows(int count) {
        synchronized (tables) {
            if (tables.isEmpty()) {
                throw new ConnectionException(getId(), "Sample tables exist only after the first connect");
            }
            List<DataRow> items = tables.get(TABLE_ITEMS);
            List<DataRow> categories = tables.get(TABLE_CATEGORIES);
            int next = items.size() + 1;
            for (int i = next; i < next + count; i++) {
                items.add(new DataRow()
                        .set("id", (long) i)
                        .set("name", "Item " + i)
                        .set("value", BigDecimal.valueOf(i * 105L, 1))
                        .set("date", BASE_DATE.plus(i, ChronoUnit.DAYS)));
                categories.add(new DataRow()
                        .set("id", (long) i)
                        .set("category", CATEGORIES[i % CATEGORIES.length])
                        .set("is_active", i % 2 == 0));
            }
        }
    }

    @Override
    protected Mono<List<DataStructureInfo>> doDiscover(Map<String, String> filter) {
        String pattern = filter.getOrDefault("name", "").toLowerCase(Locale.ROOT);
        return Mono.fromSupplier(() -> structures().stream()
                .filter(structure -> structure.getName().contains(pattern))
                .collect(Collectors.toList()));
    }

    @Override
    protected Mono<List<DataStructureInfo>> resolveTargets(ExtractionParameters parameters) {
        return Mono.fromCallable(() -> {
            List<DataStructureInfo> all = structures();
            if (parameters.targetsAllStructures()) {
                return all;
            }
            List<DataStructureInfo> targets = new ArrayList<>();
            for (String name : parameters.getTargetStructures()) {
                targets.add(all.stream()
                        .filter(structure -> structure.getName().equalsIgnoreCase(name))
                        .findFirst()
                        .orElseThrow(() -> new ExtractionException("Structure '" + name + "' not found")));
            }
            return targets;
        });
    }

    @Override
    protected Flux<DataRow> read(StructureQuery query) {
        List<DataRow> rows = tables.getOrDefault(query.getStructure().getName(), List.of());
        return query.applyTo(Flux.fromIterable(rows).map(DataRow::copy));
    }

    @Override
    protected String defaultTrackingField(DataStructureInfo structure) {
        return "id";
    }

    private List<DataStructureInfo> structures() {
        long items = tables.getOrDefault(TABLE_ITEMS, List.of()).size();
        long categories = tables.getOrDefault(TABLE_CATEGORIES, List.of()).size();
        return List.of(
                new DataStructureInfo(TABLE_ITEMS, null, "table", "Generated items", List.of(
                        FieldInfo.builder().name("id").dataType("long").nativeType("bigint").nullable(false).primaryKey(true).build(),
                        FieldInfo.builder().name("name").dataType("string").nativeType("varchar").maxLength(100).build(),
                        FieldInfo.builder().name("value").dataType("decimal").nativeType("numeric").precision(10).scale(1).build(),
                        FieldInfo.builder().name("date").dataType("datetime").nativeType("timestamp").build()),
                        items, null),
                new DataStructureInfo(TABLE_CATEGORIES, null, "table", "Generated categories", List.of(
                        FieldInfo.builder().name("id").dataType("long").nativeType("bigint").nullable(false).primaryKey(true).build(),
                        FieldInfo.builder().name("category").dataType("string").nativeType("varchar").maxLength(50).build(),
                        FieldInfo.builder().name("is_active").dataType("boolean").nativeType("boolean").build()),
                        categories, null));
    }
}
