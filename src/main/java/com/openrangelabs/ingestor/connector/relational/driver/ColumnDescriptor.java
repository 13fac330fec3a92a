package com.openrangelabs.ingestor.connector.relational.driver;

/**
 * Column as reported by the backend catalog.
 */
public record ColumnDescriptor(String name, String nativeType, boolean nullable, boolean primaryKey,
                               Integer maxLength, Integer precision, Integer scale, int ordinal) {
}
