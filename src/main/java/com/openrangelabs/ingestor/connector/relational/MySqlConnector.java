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
 * MySQL connector. MySQL has no schemas inside a database, so the schema is the database.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class MySqlConnector extends AbstractRelationalConnector {

    public static final String CONNECTOR_ID = "mysql-connector";

    private static final ConnectorMetadata METADATA = ConnectorMetadata.builder()
            .id(CONNECTOR_ID)
            .name("MySQL Connector")
            .sourceType("mysql")
            .description("Connector for MySQL and MariaDB databases")
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
            .supportedSourceType("mysql")
            .supportedSourceType("mariadb")
            .build();

    private static final Map<String, String> TYPES = Map.of(
            "year", "integer",
            "enum", "string",
            "set", "string",
            "longtext", "string",
            "mediumtext", "string",
            "tinytext", "string");

    public MySqlConnector() {
        super(SqlDialect.MYSQL);
    }

    public MySqlConnector(RelationalDriver driver) {
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
        return 3306;
    }

    @Override
    protected String defaultSchema(Map<String, String> parameters) {
        return text(parameters, "database");
    }

    @Override
    protected Map<String, String> nativeTypeOverrides() {
        return TYPES;
    }
}
