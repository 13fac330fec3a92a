package com.openrangelabs.ingestor.connector.relational;

import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.relational.driver.ColumnDescriptor;
import com.openrangelabs.ingestor.connector.relational.driver.SqlDialect;
import com.openrangelabs.ingestor.connector.relational.driver.TableDescriptor;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.ExtractionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class MySqlConnectorTest {

    private static final Map<String, String> PARAMETERS = Map.of(
            "host", "mysql.internal",
            "database", "shop",
            "username", "ingest",
            "password", "s3cret");

    private static final TableDescriptor CUSTOMERS = new TableDescriptor("shop", "customers", "BASE TABLE", List.of(
            new ColumnDescriptor("id", "int(11)", false, true, null, 11, 0, 1),
            new ColumnDescriptor("tier", "enum('gold','silver')", true, false, null, null, null, 2),
            new ColumnDescriptor("joined", "year", true, false, null, null, null, 3)),
            3L);

    private InMemoryRelationalDriver driver;
    private MySqlConnector connector;

    @BeforeEach
    void setUp() {
        driver = new InMemoryRelationalDriver(SqlDialect.MYSQL)
            .table(CUSTOMERS, List.of(
                customer(1, "gold", 2019),
                customer(2, "silver", 2021),
                customer(3, "gold", 2023)));
        connector = new MySqlConnector(driver);
    }

    @AfterEach
    void tearDown() {
        connector.close();
    }

    @Test
    void connect_DefaultsPortAndUsesDatabaseAsSchema() {
        connect();

        assertThat(driver.lastSettings().getPort()).isEqualTo(3306);
        assertThat(driver.lastSettings().getSchema()).isEqualTo("shop");
    }

    @Test
    void validateConnection_RejectsPortOutOfRange() {
        Map<String, String> parameters = new HashMap<>(PARAMETERS);
        parameters.put("port", "70000");

        StepVerifier.create(connector.validateConnection(parameters))
            .assertNext(result -> assertThat(result.getErrors()).extracting("fieldName").containsExactly("port"))
            .verifyComplete();
    }

    @Test
    void canonicalType_AppliesMySqlOverrides() {
        assertThat(connector.canonicalType("year")).isEqualTo("integer");
        assertThat(connector.canonicalType("enum('gold','silver')")).isEqualTo("string");
        assertThat(connector.canonicalType("tinyint(1)")).isEqualTo("integer");
        assertThat(connector.canonicalType("datetime(6)")).isEqualTo("datetime");
    }

    @Test
    void extractData_IncrementalReplayIsIdempotentUntilNewRowsArrive() {
        connect();
        ExtractionParameters parameters = ExtractionParameters.builder()
            .targetStructures(List.of("customers"))
            .incrementalExtraction(true)
            .trackingField("id")
            .build();

        ExtractionResult first = extract(parameters);
        assertThat(ids(first)).containsExactly(1L, 2L, 3L);
        assertThat(first.getContinuationToken()).isEqualTo("shop.customers|id|3");

        parameters.setContinuationToken(first.getContinuationToken());
        ExtractionResult replay = extract(parameters);
        assertThat(replay.getRows()).isEmpty();
        assertThat(replay.getContinuationToken()).isEqualTo("shop.customers|id|3");

        driver.insert("shop.customers", customer(4, "silver", 2024));
        ExtractionResult next = extract(parameters);
        assertThat(ids(next)).containsExactly(4L);
        assertThat(next.getContinuationToken()).isEqualTo("shop.customers|id|4");
    }

    @Test
    void extractData_FullExtractionPagesWithOffsetToken() {
        connect();
        ExtractionParameters parameters = ExtractionParameters.builder()
            .targetStructures(List.of("customers"))
            .maxRecords(2)
            .build();

        ExtractionResult firstPage = extract(parameters);
        assertThat(ids(firstPage)).containsExactly(1L, 2L);
        assertThat(firstPage.isHasMoreRecords()).isTrue();
        assertThat(firstPage.getContinuationToken()).isEqualTo("shop.customers|2");

        parameters.setContinuationToken(firstPage.getContinuationToken());
        ExtractionResult lastPage = extract(parameters);
        assertThat(ids(lastPage)).containsExactly(3L);
        assertThat(lastPage.isHasMoreRecords()).isFalse();
        assertThat(lastPage.getContinuationToken()).isNull();
    }

    private void connect() {
        assertThat(connector.connect(PARAMETERS, CancellationSignal.none()).block().isSuccess()).isTrue();
    }

    private ExtractionResult extract(ExtractionParameters parameters) {
        return connector.extractData(parameters, CancellationSignal.none()).block();
    }

    private static Map<String, Object> customer(int id, String tier, int joined) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("tier", tier);
        row.put("joined", joined);
        return row;
    }

    private static List<Long> ids(ExtractionResult result) {
        return result.getRows().stream()
            .map(row -> row.get("id").asNumber().orElseThrow().longValue())
            .collect(Collectors.toList());
    }
}
