package com.openrangelabs.ingestor.connector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A discoverable target (table, folder group, sample table) with its fields
 */
public class DataStructureInfo {

    private final String name;
    private final String schema;
    private final String type;
    private final String description;
    private final List<FieldInfo> fields;
    private final Long estimatedRecordCount;
    private final Map<String, Object> properties;

    public DataStructureInfo(String name, String schema, String type, String description,
                             List<FieldInfo> fields, Long estimatedRecordCount, Map<String, Object> properties) {
        this.name = name;
        this.schema = schema;
        this.type = type;
        this.description = description;
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.estimatedRecordCount = estimatedRecordCount;
        this.properties = properties == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static DataStructureInfo of(String name, String type, List<FieldInfo> fields) {
        return new DataStructureInfo(name, null, type, null, fields, null, null);
    }

    public String getName() { return name; }
    public String getSchema() { return schema; }
    public String getType() { return type; }
    public String getDescription() { return description; }
    public List<FieldInfo> getFields() { return fields; }
    public Long getEstimatedRecordCount() { return estimatedRecordCount; }
    public Map<String, Object> getProperties() { return properties; }

    /**
     * {@code schema.name} when a schema is known, otherwise the bare name.
     */
    public String getQualifiedName() {
        return schema == null || schema.isBlank() ? name : schema + "." + name;
    }

    public Optional<FieldInfo> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equalsIgnoreCase(fieldName)).findFirst();
    }

    public boolean hasField(String fieldName) {
        return findField(fieldName).isPresent();
    }

    public List<String> getFieldNames() {
        return fields.stream().map(FieldInfo::getName).collect(Collectors.toList());
    }

    public List<String> getPrimaryKeyFields() {
        return fields.stream().filter(FieldInfo::isPrimaryKey).map(FieldInfo::getName).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "DataStructureInfo{" + getQualifiedName() + ", type='" + type + "', fields=" + fields.size() + '}';
    }
}
