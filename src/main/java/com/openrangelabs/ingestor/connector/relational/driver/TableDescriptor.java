package com.openrangelabs.ingestor.connector.relational.driver;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Table or view as reported by the backend catalog.
 */
public record TableDescriptor(String schema, String name, String type, List<ColumnDescriptor> columns, Long estimatedRows) {

    public TableDescriptor {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public String qualifiedName() {
        return schema == null ? name : schema + "." + name;
    }

    public List<String> primaryKeyColumns() {
        return columns.stream()
                .filter(ColumnDescriptor::primaryKey)
                .map(ColumnDescriptor::name)
                .collect(Collectors.toList());
    }
}
