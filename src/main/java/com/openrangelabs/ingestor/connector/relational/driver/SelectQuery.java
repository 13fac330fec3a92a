package com.openrangelabs.ingestor.connector.relational.driver;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Structured SELECT handed to a driver, rendered per dialect.
 * Filters are equality predicates; {@code trackingAfter} adds {@code trackingField > value}.
 */
@Value
@Builder
public class SelectQuery {

    String schema;
    String table;

    @Builder.Default
    List<String> fields = List.of();

    @Singular
    Map<String, Object> filters;

    String trackingField;
    Object trackingAfter;

    @Builder.Default
    List<String> orderBy = List.of();

    long offset;

    int limit;

    public boolean hasTrackingPredicate() {
        return trackingField != null && trackingAfter != null;
    }
}
