package com.openrangelabs.ingestor.connector.relational.driver;

import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactoryOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class R2dbcRelationalDriverTest {

    private static final RelationalConnectionSettings SETTINGS = RelationalConnectionSettings.builder()
        .host("db.internal")
        .port(1433)
        .database("erp")
        .username("ingest")
        .password("s3cret")
        .sslMode("require")
        .build();

    @ParameterizedTest
    @EnumSource(value = SqlDialect.class, names = {"POSTGRESQL", "MYSQL", "SQLSERVER"})
    void options_ResolveToAnInstalledDriver(SqlDialect dialect) {
        ConnectionFactoryOptions options = new R2dbcRelationalDriver(dialect).options(SETTINGS);

        assertThat(ConnectionFactories.supports(options)).isTrue();
    }

    @Test
    void options_CarryHostPortAndSsl() {
        ConnectionFactoryOptions options = new R2dbcRelationalDriver(SqlDialect.SQLSERVER).options(SETTINGS);

        assertThat(options.getValue(ConnectionFactoryOptions.DRIVER)).isEqualTo("sqlserver");
        assertThat(options.getValue(ConnectionFactoryOptions.HOST)).isEqualTo("db.internal");
        assertThat(options.getValue(ConnectionFactoryOptions.PORT)).isEqualTo(1433);
        assertThat(options.getValue(ConnectionFactoryOptions.SSL)).isEqualTo(true);
    }
}
