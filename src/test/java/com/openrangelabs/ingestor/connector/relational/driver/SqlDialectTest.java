package com.openrangelabs.ingestor.connector.relational.driver;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlDialectTest {

    private final SelectQuery query = SelectQuery.builder()
        .schema("sales")
        .table("orders")
        .fields(List.of("id", "status"))
        .filter("status", "open")
        .filter("deleted_at", null)
        .trackingField("id")
        .trackingAfter(42L)
        .orderBy(List.of("id"))
        .offset(20)
        .limit(10)
        .build();

    @Test
    void renderSelect_Postgres() {
        SqlDialect.Rendered rendered = SqlDialect.POSTGRESQL.renderSelect(query);

        assertThat(rendered.sql()).isEqualTo("SELECT \"id\", \"status\" FROM \"sales\".\"orders\""
            + " WHERE \"status\" = $1 AND \"deleted_at\" IS NULL AND \"id\" > $2"
            + " ORDER BY \"id\" LIMIT 10 OFFSET 20");
        assertThat(rendered.bindings()).containsExactly("open", 42L);
    }

    @Test
    void renderSelect_MySqlUsesBackticksAndQuestionMarks() {
        SqlDialect.Rendered rendered = SqlDialect.MYSQL.renderSelect(query);

        assertThat(rendered.sql()).startsWith("SELECT `id`, `status` FROM `sales`.`orders`");
        assertThat(rendered.sql()).contains("`status` = ? AND");
    }

    @Test
    void renderSelect_SqlServerPagesWithOffsetFetch() {
        SqlDialect.Rendered rendered = SqlDialect.SQLSERVER.renderSelect(SelectQuery.builder()
            .table("orders")
            .offset(5)
            .limit(10)
            .build());

        assertThat(rendered.sql()).isEqualTo("SELECT * FROM [orders] ORDER BY (SELECT NULL) OFFSET 5 ROWS FETCH NEXT 10 ROWS ONLY");
    }

    @Test
    void quote_EscapesClosingQuote() {
        assertThat(SqlDialect.POSTGRESQL.quote("we\"ird")).isEqualTo("\"we\"\"ird\"");
        assertThat(SqlDialect.SQLSERVER.quote("a]b")).isEqualTo("[a]]b]");
    }

    @Test
    void renderChanges_RequiresChangeTrackingDialect() {
        TableDescriptor table = new TableDescriptor("dbo", "orders", "BASE TABLE",
            List.of(new ColumnDescriptor("id", "int", false, true, null, null, null, 1)), null);

        assertThat(SqlDialect.SQLSERVER.renderChanges(table, 3, 9).sql())
            .contains("CHANGETABLE(CHANGES [dbo].[orders], @p0)")
            .contains("t.[id] = CT.[id]");
        assertThatThrownBy(() -> SqlDialect.POSTGRESQL.renderChanges(table, 3, 9))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
