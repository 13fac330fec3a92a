package com.openrangelabs.ingestor.connector.relational;

import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.ConnectorCapabilities;
import com.openrangelabs.ingestor.connector.ConnectorMetadata;
import com.openrangelabs.ingestor.connector.DataStructureInfo;
import com.openrangelabs.ingestor.connector.FieldInfo;
import com.openrangelabs.ingestor.connector.relational.driver.ChangeTrackingState;
import com.openrangelabs.ingestor.connector.relational.driver.ColumnDescriptor;
import com.openrangelabs.ingestor.connector.relational.driver.RelationalDriver;
import com.openrangelabs.ingestor.connector.relational.driver.SqlDialect;
import com.openrangelabs.ingestor.connector.relational.driver.TableDescriptor;
import com.openrangelabs.ingestor.exception.ExtractionException;
import com.openrangelabs.ingestor.exception.InvalidExtractionRequestException;
import com.openrangelabs.ingestor.extraction.ContinuationToken;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.ExtractionResult;
import com.openrangelabs.ingestor.extraction.FailureReason;
import com.openrangelabs.ingestor.extraction.RowPredicates;
import com.openrangelabs.ingestor.model.DataRow;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * SQL Server connector
 *
 * <p>Besides column-based incremental extraction it reads the native change table. That path is
 * taken for incremental requests that name no tracking column, or that name or replay
 * {@code SYS_CHANGE_VERSION}. Its tokens look like {@code schema.table|SYS_CHANGE_VERSION|42}.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class SqlServerConnector extends AbstractRelationalConnector {

    public static final String CONNECTOR_ID = "sqlserver-connector";
    public static final String CHANGE_VERSION = "SYS_CHANGE_VERSION";

    private static final int CHANGE_BATCH = 500;

    private static final ConnectorMetadata METADATA = ConnectorMetadata.builder()
            .id(CONNECTOR_ID)
            .name("SQL Server Connector")
            .sourceType("sqlserver")
            .description("Connector for Microsoft SQL Server with native change tracking support")
            .capability("incremental")
            .capability("change-tracking")
            .capability("schema-discovery")
            .category("database")
            .category("relational")
            .build();

    private static final ConnectorCapabilities CAPABILITIES = ConnectorCapabilities.builder()
            .supportsIncremental(true)
            .supportsAdvancedFiltering(true)
            .supportsPreview(true)
            .supportsResume(true)
            .supportsNativeChangeTracking(true)
            .maxConcurrentExtractions(4)
            .authenticationMode("basic")
            .supportedSourceType("sqlserver")
            .supportedSourceType("mssql")
            .build();

    private static final Map<String, String> TYPES = Map.of(
            "nvarchar", "string",
            "nchar", "string",
            "ntext", "string",
            "xml", "string",
            "sql_variant", "string",
            "rowversion", "binary",
            "timestamp", "binary",
            "tinyint", "integer");

    public SqlServerConnector() {
        super(SqlDialect.SQLSERVER);
    }

    public SqlServerConnector(RelationalDriver driver) {
        super(driver);
    }

    @Override
    public ConnectorMetadata describeMetadata() {
        return METADATA;
    }

    @Override
    public ConnectorCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    protected int defaultPort() {
        return 1433;
    }

    @Override
    protected String defaultSchema(Map<String, String> parameters) {
        return "dbo";
    }

    @Override
    protected Map<String, String> nativeTypeOverrides() {
        return TYPES;
    }

    @Override
    protected Mono<ExtractionResult> doExtract(ExtractionParameters parameters, CancellationSignal signal) {
        if (!usesChangeTable(parameters)) {
            return super.doExtract(parameters, signal);
        }
        return resolveTargets(parameters).flatMap(targets -> {
            if (targets.size() != 1) {
                return Mono.error(new InvalidExtractionRequestException(String.format(
                        "Change tracking extraction addresses exactly one table, got %d", targets.size())));
            }
            return extractChanges(parameters, targets.get(0), signal);
        });
    }

    private Mono<ExtractionResult> extractChanges(ExtractionParameters parameters, DataStructureInfo structure,
                                                  CancellationSignal signal) {
        String target = structure.getQualifiedName();
        long lastVersion = previousVersion(parameters, target);
        TableDescriptor table = toTable(structure);

        return session().changeTrackingState(table).flatMap(state -> {
            if (!state.enabled()) {
                return Mono.error(new ExtractionException("Change tracking is not enabled for table " + target));
            }
            if (lastVersion < state.minValidVersion()) {
                logger.warn("Change tracking data for {} has been cleaned up: version {} is older than minimum valid version {}. Full reload required",
                        target, lastVersion, state.minValidVersion());
                return Mono.just(ExtractionResult.failure(FailureReason.FULL_RELOAD_REQUIRED, String.format(
                                "Last sync version %d for %s is older than the minimum valid version %d",
                                lastVersion, target, state.minValidVersion()))
                        .addStructureInfo(structure)
                        .build());
            }
            logger.debug("Reading changes of {} between versions {} and {}", target, lastVersion, state.currentVersion());
            return readChanges(parameters, structure, table, lastVersion, state, signal);
        });
    }

    private Mono<ExtractionResult> readChanges(ExtractionParameters parameters, DataStructureInfo structure, TableDescriptor table,
                                               long lastVersion, ChangeTrackingState state, CancellationSignal signal) {
        String target = structure.getQualifiedName();
        Map<String, Object> filters = parameters.getFilterCriteria() == null ? Map.of() : parameters.getFilterCriteria();
        int batch = parameters.getBatchSize() > 0 ? Math.min(parameters.getBatchSize(), CHANGE_BATCH) : CHANGE_BATCH;

        return rowCollector("changes:" + target, signal)
                .batchSize(batch)
                .includeFields(parameters.getIncludeFields())
                .collect(session().selectChanges(table, lastVersion, state.currentVersion())
                        .map(DataRow::of)
                        .filter(row -> RowPredicates.matchesFilters(row, filters)))
                .map(collected -> {
                    if (collected.isCancelled()) {
                        return ExtractionResult.failure(collected.failureReason(), String.format(
                                        "Change extraction of %s stopped after %d records", target, collected.processedCount()))
                                .processedCount(collected.processedCount())
                                .build();
                    }
                    logger.info("Detected {} changed rows in {} since version {}", collected.processedCount(), target, lastVersion);
                    return ExtractionResult.success()
                            .rows(collected.rows())
                            .processedCount(collected.processedCount())
                            .hasMoreRecords(false)
                            .continuationToken(ContinuationToken.tracking(target, CHANGE_VERSION,
                                    Long.toString(state.currentVersion())).encode())
                            .addStructureInfo(structure)
                            .build();
                });
    }

    static boolean usesChangeTable(ExtractionParameters parameters) {
        if (!parameters.isIncrementalExtraction()) {
            return false;
        }
        String trackingField = parameters.getTrackingField();
        if (trackingField != null && !trackingField.isBlank()) {
            return CHANGE_VERSION.equalsIgnoreCase(trackingField);
        }
        if (!parameters.hasContinuationToken()) {
            return true;
        }
        try {
            return CHANGE_VERSION.equalsIgnoreCase(ContinuationToken.parse(parameters.getContinuationToken()).getTrackingField());
        } catch (IllegalArgumentException e) {
            // column path reports the malformed token
            return false;
        }
    }

    static long previousVersion(ExtractionParameters parameters, String target) {
        if (parameters.hasContinuationToken()) {
            ContinuationToken token = ContinuationToken.parse(parameters.getContinuationToken());
            if (!token.isFor(target)) {
                throw new InvalidExtractionRequestException(String.format(
                        "Continuation token was issued for '%s', not '%s'", token.getTarget(), target));
            }
            return parseVersion(token.getValue());
        }
        Object option = parameters.option(CHANGE_VERSION);
        return option == null ? 0L : parseVersion(option.toString());
    }

    private static long parseVersion(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidExtractionRequestException("Change tracking version is not a number: " + value, e);
        }
    }

    private static TableDescriptor toTable(DataStructureInfo structure) {
        List<FieldInfo> fields = structure.getFields();
        List<ColumnDescriptor> columns = IntStream.range(0, fields.size())
                .mapToObj(i -> {
                    FieldInfo field = fields.get(i);
                    return new ColumnDescriptor(field.getName(), field.getNativeType(), field.isNullable(), field.isPrimaryKey(),
                            field.getMaxLength(), field.getPrecision(), field.getScale(), i + 1);
                })
                .collect(Collectors.toList());
        return new TableDescriptor(structure.getSchema(), structure.getName(), structure.getType(), columns,
                structure.getEstimatedRecordCount());
    }
}
