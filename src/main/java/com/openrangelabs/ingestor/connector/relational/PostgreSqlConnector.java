package com.openrangelabs.ingestor.connector.relational;

import com.openrangelabs.ingestor.connector.ConnectorCapabilities;
import com.openrangelabs.ingestor.connector.ConnectorMetadata;
import com.openrangelabs.ingestor.connector.relational.driver.RelationalDriver;
import com.openrangelabs.ingestor.connector.relational.driver.SqlDialect;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * PostgreSQL connector
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class PostgreSqlConnector extends AbstractRelationalConnector {

    public static final String CONNECTOR_ID = "postgresql-connector";

    private static final ConnectorMetadata METADATA = ConnectorMetadata.builder()
            .id(CONNECTOR_ID)
            .name("PostgreSQL Connector")
            .sourceType("postgresql")
            .description("Connector for PostgreSQL databases")
            .capability("incremental")
            .capability("schema-discovery")
            .category("database")
            .category("relational")
            .build();

    private static final ConnectorCapabilities CAPABILITIES = ConnectorCapabilities.builder()
            .supportsIncremental(true)
            .supportsAdvancedFiltering(true)
            .supportsPreview(true)
            .supportsResume(true)
            .maxConcurrentExtractions(4)
            .authenticationMode("basic")
            .supportedSourceType("postgresql")
            .supportedSourceType("postgres")
            .build();

    private static final Map<String, String> TYPES = Map.of(
            "character varying", "string",
            "character", "string",
            "text", "string",
            "interval", "string",
            "inet", "string");

    public PostgreSqlConnector() {
        super(SqlDialect.POSTGRESQL);
    }

    public PostgreSqlConnector(RelationalDriver driver) {
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
        return 5432;
    }

    @Override
    protected String defaultSchema(Map<String, String> parameters) {
        return "public";
    }

    @Override
    protected Map<String, String> nativeTypeOverrides() {
        return TYPES;
    }
}
