package com.openrangelabs.ingestor.connector.relational;

import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.relational.driver.ChangeTrackingState;
import com.openrangelabs.ingestor.connector.relational.driver.ColumnDescriptor;
import com.openrangelabs.ingestor.connector.relational.driver.SqlDialect;
import com.openrangelabs.ingestor.connector.relational.driver.TableDescriptor;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.ExtractionResult;
import com.openrangelabs.ingestor.extraction.FailureReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SqlServerConnectorTest {

    private static final Map<String, String> PARAMETERS = Map.of(
            "server", "mssql.internal",
            "database", "erp",
            "username", "sa",
            "password", "Passw0rd!");

    private static final TableDescriptor ORDERS = new TableDescriptor("dbo", "orders", "BASE TABLE", List.of(
            new ColumnDescriptor("id", "int", false, true, null, 10, 0, 1),
            new ColumnDescriptor("status", "nvarchar", true, false, 20, null, null, 2),
            new ColumnDescriptor("modified", "datetime2", false, false, null, null, null, 3)),
            2L);

    private SqlServerConnector connector;

    @AfterEach
    void tearDown() {
        if (connector != null) {
            connector.close();
        }
    }

    @Test
    void changeTable_FirstSyncReadsAllChangesAndReturnsCurrentVersion() {
        connect(new ChangeTrackingState(true, 7, 0));

        ExtractionResult result = extract(incremental().build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(versions(result)).containsExactly(3L, 5L, 7L);
        assertThat(result.getContinuationToken()).isEqualTo("dbo.orders|SYS_CHANGE_VERSION|7");
        assertThat(result.isHasMoreRecords()).isFalse();
    }

    @Test
    void changeTable_ReplayedTokenReturnsOnlyLaterChanges() {
        connect(new ChangeTrackingState(true, 7, 0));

        ExtractionResult result = extract(incremental()
            .continuationToken("dbo.orders|SYS_CHANGE_VERSION|4")
            .build());

        assertThat(versions(result)).containsExactly(5L, 7L);
        assertThat(result.getRows().get(1).get("SYS_CHANGE_OPERATION").asString()).isEqualTo("D");
    }

    @Test
    void changeTable_VersionOlderThanRetention_RequiresFullReload() {
        connect(new ChangeTrackingState(true, 7, 5));

        ExtractionResult result = extract(incremental()
            .continuationToken("dbo.orders|SYS_CHANGE_VERSION|2")
            .build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.FULL_RELOAD_REQUIRED);
        assertThat(result.getRows()).isEmpty();
    }

    @Test
    void changeTable_TrackingDisabled_IsError() {
        connect(ChangeTrackingState.disabled());

        ExtractionResult result = extract(incremental().build());

        assertThat(result.getFailureReason()).isEqualTo(FailureReason.ERROR);
        assertThat(result.getErrorMessage()).contains("Change tracking is not enabled");
    }

    @Test
    void trackingColumn_UsesColumnBasedIncremental() {
        connect(new ChangeTrackingState(true, 7, 0));

        ExtractionResult result = extract(incremental()
            .trackingField("modified")
            .changesFrom("2024-05-01T12:00:00Z")
            .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRowCount()).isEqualTo(1);
        assertThat(result.getContinuationToken()).isEqualTo("dbo.orders|modified|2024-05-02T08:00:00Z");
    }

    @Test
    void usesChangeTable_DecidesFromTrackingFieldAndToken() {
        assertThat(SqlServerConnector.usesChangeTable(ExtractionParameters.builder().build())).isFalse();
        assertThat(SqlServerConnector.usesChangeTable(incremental().build())).isTrue();
        assertThat(SqlServerConnector.usesChangeTable(incremental().trackingField("modified").build())).isFalse();
        assertThat(SqlServerConnector.usesChangeTable(incremental().trackingField("sys_change_version").build())).isTrue();
        assertThat(SqlServerConnector.usesChangeTable(incremental().continuationToken("dbo.orders|modified|x").build())).isFalse();
        assertThat(SqlServerConnector.usesChangeTable(incremental().continuationToken("garbage").build())).isFalse();
    }

    @Test
    void previousVersion_FallsBackToOption() {
        ExtractionParameters parameters = incremental()
            .options(Map.of(SqlServerConnector.CHANGE_VERSION, "12"))
            .build();

        assertThat(SqlServerConnector.previousVersion(parameters, "dbo.orders")).isEqualTo(12L);
    }

    private void connect(ChangeTrackingState state) {
        InMemoryRelationalDriver driver = new InMemoryRelationalDriver(SqlDialect.SQLSERVER)
            .table(ORDERS, List.of(
                row(1, "open", "2024-05-01T08:00:00"),
                row(2, "shipped", "2024-05-02T08:00:00")))
            .changeTracking("dbo.orders", state, List.of(
                change(1, 3, "I"),
                change(2, 5, "U"),
                change(9, 7, "D")));
        connector = new SqlServerConnector(driver);
        assertThat(connector.connect(PARAMETERS, CancellationSignal.none()).block().isSuccess()).isTrue();
    }

    private ExtractionResult extract(ExtractionParameters parameters) {
        return connector.extractData(parameters, CancellationSignal.none()).block();
    }

    private static ExtractionParameters.ExtractionParametersBuilder incremental() {
        return ExtractionParameters.builder()
            .targetStructures(List.of("orders"))
            .incrementalExtraction(true);
    }

    private static Map<String, Object> row(int id, String status, String modified) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("status", status);
        row.put("modified", LocalDateTime.parse(modified));
        return row;
    }

    private static Map<String, Object> change(int id, long version, String operation) {
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("id", "D".equals(operation) ? null : id);
        change.put("ct_id", id);
        change.put("SYS_CHANGE_VERSION", version);
        change.put("SYS_CHANGE_OPERATION", operation);
        return change;
    }

    private static List<Long> versions(ExtractionResult result) {
        return result.getRows().stream()
            .map(row -> row.get("SYS_CHANGE_VERSION").asNumber().orElseThrow().longValue())
            .collect(Collectors.toList());
    }
}
