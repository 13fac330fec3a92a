package com.openrangelabs.ingestor.connector;

/**
 * A field-scoped validation failure. Returned inside results, never thrown.
 */
public record ValidationError(String fieldName, String errorMessage) {

    @Override
    public String toString() {
        return fieldName + ": " + errorMessage;
    }
}
