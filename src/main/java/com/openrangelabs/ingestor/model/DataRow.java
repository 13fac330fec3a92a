package com.openrangelabs.ingestor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A single extracted record: field name to tagged value, in insertion order
 */
public class DataRow {

    private final LinkedHashMap<String, FieldValue> fields;

    public DataRow() {
        this.fields = new LinkedHashMap<>();
    }

    public DataRow(Map<String, FieldValue> fields) {
        this.fields = new LinkedHashMap<>(fields);
    }

    /**
     * Builds a row from raw driver values.
     */
    public static DataRow of(Map<String, ?> raw) {
        DataRow row = new DataRow();
        raw.forEach((name, value) -> row.put(name, FieldValue.from(value)));
        return row;
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Returns the value of a field, or the null value when the field is absent.
     */
    public FieldValue get(String field) {
        FieldValue value = fields.get(field);
        return value != null ? value : FieldValue.ofNull();
    }

    public DataRow put(String field, FieldValue value) {
        fields.put(field, value != null ? value : FieldValue.ofNull());
        return this;
    }

    public DataRow set(String field, Object rawValue) {
        return put(field, FieldValue.from(rawValue));
    }

    public FieldValue remove(String field) {
        return fields.remove(field);
    }

    public Set<String> fieldNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(fields.keySet()));
    }

    public int size() {
        return fields.size();
    }

    public Map<String, FieldValue> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    public DataRow copy() {
        return new DataRow(fields);
    }

    /**
     * Copy with binary and temporal values rendered as transport-safe strings.
     */
    public DataRow toTransportSafe() {
        DataRow safe = new DataRow();
        fields.forEach((name, value) -> safe.put(name, value.toTransportSafe()));
        return safe;
    }

    public Map<String, Object> toPlainMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        fields.forEach((name, value) -> plain.put(name, value.toJavaObject()));
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((DataRow) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "DataRow" + fields;
    }
}
