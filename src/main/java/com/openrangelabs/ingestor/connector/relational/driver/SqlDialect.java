package com.openrangelabs.ingestor.connector.relational.driver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SQL rendering rules of the supported backends.
 *
 * <p>Catalog queries go through {@code information_schema}, which every supported backend
 * exposes. Identifiers are always quoted; values are always bound.
 */
public enum SqlDialect {

    POSTGRESQL("postgresql", "\"", "\"", "SELECT version()") {
        @Override
        public String bindMarker(int index) {
            return "$" + (index + 1);
        }
    },
    MYSQL("mysql", "`", "`", "SELECT VERSION()") {
        @Override
        public String bindMarker(int index) {
            return "?";
        }
    },
    SQLSERVER("sqlserver", "[", "]", "SELECT @@VERSION") {
        @Override
        public String bindMarker(int index) {
            return "@p" + index;
        }

        @Override
        protected void appendPage(StringBuilder sql, long offset, int limit, boolean ordered) {
            if (!ordered) {
                sql.append(" ORDER BY (SELECT NULL)");
            }
            sql.append(" OFFSET ").append(offset).append(" ROWS");
            if (limit > 0) {
                sql.append(" FETCH NEXT ").append(limit).append(" ROWS ONLY");
            }
        }
    },
    H2("h2", "\"", "\"", "SELECT H2VERSION()") {
        @Override
        public String bindMarker(int index) {
            return "$" + (index + 1);
        }
    };

    private final String driverName;
    private final String openQuote;
    private final String closeQuote;
    private final String versionQuery;

    SqlDialect(String driverName, String openQuote, String closeQuote, String versionQuery) {
        this.driverName = driverName;
        this.openQuote = openQuote;
        this.closeQuote = closeQuote;
        this.versionQuery = versionQuery;
    }

    /**
     * Statement text plus positional bindings.
     */
    public record Rendered(String sql, List<Object> bindings) {
    }

    public abstract String bindMarker(int index);

    /**
     * R2DBC driver name used in connection factory options.
     */
    public String driverName() {
        return driverName;
    }

    public String versionQuery() {
        return versionQuery;
    }

    public String quote(String identifier) {
        String escaped = identifier.replace(closeQuote, closeQuote + closeQuote);
        return openQuote + escaped + closeQuote;
    }

    public String qualify(String schema, String table) {
        return schema == null || schema.isBlank() ? quote(table) : quote(schema) + "." + quote(table);
    }

    public Rendered renderSelect(SelectQuery query) {
        List<Object> bindings = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ");
        if (query.getFields().isEmpty()) {
            sql.append("*");
        } else {
            sql.append(String.join(", ", query.getFields().stream().map(this::quote).collect(Collectors.toList())));
        }
        sql.append(" FROM ").append(qualify(query.getSchema(), query.getTable()));

        List<String> predicates = new ArrayList<>();
        for (Map.Entry<String, Object> filter : query.getFilters().entrySet()) {
            if (filter.getValue() == null) {
                predicates.add(quote(filter.getKey()) + " IS NULL");
            } else {
                predicates.add(quote(filter.getKey()) + " = " + bindMarker(bindings.size()));
                bindings.add(filter.getValue());
            }
        }
        if (query.hasTrackingPredicate()) {
            predicates.add(quote(query.getTrackingField()) + " > " + bindMarker(bindings.size()));
            bindings.add(query.getTrackingAfter());
        }
        if (!predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
        boolean ordered = !query.getOrderBy().isEmpty();
        if (ordered) {
            sql.append(" ORDER BY ").append(String.join(", ", query.getOrderBy().stream().map(this::quote).collect(Collectors.toList())));
        }
        if (query.getLimit() > 0 || query.getOffset() > 0) {
            appendPage(sql, query.getOffset(), query.getLimit(), ordered);
        }
        return new Rendered(sql.toString(), bindings);
    }

    protected void appendPage(StringBuilder sql, long offset, int limit, boolean ordered) {
        if (limit > 0) {
            sql.append(" LIMIT ").append(limit);
        } else {
            sql.append(" LIMIT ").append(Long.MAX_VALUE);
        }
        if (offset > 0) {
            sql.append(" OFFSET ").append(offset);
        }
    }

    public Rendered renderTables(String schema) {
        return new Rendered("SELECT table_name AS table_name, table_type AS table_type FROM information_schema.tables"
                + " WHERE table_schema = " + bindMarker(0) + " ORDER BY table_name", List.of(schema));
    }

    public Rendered renderColumns(String schema, String table) {
        return new Rendered("SELECT column_name AS column_name, data_type AS data_type, is_nullable AS is_nullable,"
                + " character_maximum_length AS max_length, numeric_precision AS num_precision,"
                + " numeric_scale AS num_scale, ordinal_position AS ordinal"
                + " FROM information_schema.columns"
                + " WHERE table_schema = " + bindMarker(0) + " AND table_name = " + bindMarker(1)
                + " ORDER BY ordinal_position", List.of(schema, table));
    }

    public Rendered renderPrimaryKey(String schema, String table) {
        return new Rendered("SELECT k.column_name AS column_name FROM information_schema.table_constraints t"
                + " JOIN information_schema.key_column_usage k ON t.constraint_name = k.constraint_name"
                + " AND t.table_schema = k.table_schema AND t.table_name = k.table_name"
                + " WHERE t.constraint_type = 'PRIMARY KEY' AND t.table_schema = " + bindMarker(0)
                + " AND t.table_name = " + bindMarker(1)
                + " ORDER BY k.ordinal_position", List.of(schema, table));
    }

    public boolean supportsChangeTracking() {
        return this == SQLSERVER;
    }

    public Rendered renderChangeTrackingState(TableDescriptor table) {
        requireChangeTracking();
        String name = table.qualifiedName();
        return new Rendered("SELECT CASE WHEN OBJECTPROPERTYEX(OBJECT_ID(" + bindMarker(0) + "), 'TableHasChangeTracking') = 1"
                + " THEN 1 ELSE 0 END AS enabled,"
                + " CHANGE_TRACKING_CURRENT_VERSION() AS current_version,"
                + " CHANGE_TRACKING_MIN_VALID_VERSION(OBJECT_ID(" + bindMarker(1) + ")) AS min_valid_version",
                List.of(name, name));
    }

    /**
     * Joins the table with its change table so deleted rows still surface with their keys.
     */
    public Rendered renderChanges(TableDescriptor table, long fromVersion, long toVersion) {
        requireChangeTracking();
        List<String> keys = table.primaryKeyColumns();
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Table " + table.qualifiedName() + " has no primary key to join changes on");
        }
        String qualified = qualify(table.schema(), table.name());
        List<String> join = keys.stream().map(key -> "t." + quote(key) + " = CT." + quote(key)).collect(Collectors.toList());
        List<String> keyColumns = keys.stream().map(key -> "CT." + quote(key) + " AS " + quote("ct_" + key)).collect(Collectors.toList());
        String sql = "SELECT t.*, " + String.join(", ", keyColumns)
                + ", CT.SYS_CHANGE_VERSION, CT.SYS_CHANGE_OPERATION"
                + " FROM " + qualified + " AS t"
                + " RIGHT OUTER JOIN CHANGETABLE(CHANGES " + qualified + ", " + bindMarker(0) + ") AS CT"
                + " ON " + String.join(" AND ", join)
                + " WHERE CT.SYS_CHANGE_VERSION <= " + bindMarker(1)
                + " ORDER BY CT.SYS_CHANGE_VERSION";
        return new Rendered(sql, List.of(fromVersion, toVersion));
    }

    private void requireChangeTracking() {
        if (!supportsChangeTracking()) {
            throw new UnsupportedOperationException(name() + " has no native change tracking");
        }
    }
}
