package com.openrangelabs.ingestor.extraction;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * In-memory evaluation of extraction filters for sources without a query language
 */
public final class RowPredicates {

    private RowPredicates() {
    }

    /**
     * Equality match on every criterion. A collection value matches any of its elements.
     */
    public static boolean matchesFilters(DataRow row, Map<String, Object> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
            if (!matches(row.get(criterion.getKey()), criterion.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean matches(FieldValue actual, Object expected) {
        if (expected instanceof Collection) {
            for (Object candidate : (Collection<?>) expected) {
                if (matches(actual, candidate)) {
                    return true;
                }
            }
            return false;
        }
        FieldValue wanted = FieldValue.from(expected);
        if (actual.isNull() || wanted.isNull()) {
            return actual.isNull() && wanted.isNull();
        }
        return TrackingValueComparator.INSTANCE.compare(actual, wanted) == 0;
    }

    public static boolean isAfter(DataRow row, String trackingField, FieldValue lowerBound) {
        if (lowerBound == null || lowerBound.isNull()) {
            return true;
        }
        return TrackingValueComparator.INSTANCE.isGreater(row.get(trackingField), lowerBound);
    }

    /**
     * Keeps only {@code includeFields}, in that order. An empty list keeps everything.
     */
    public static DataRow project(DataRow row, List<String> includeFields) {
        if (includeFields == null || includeFields.isEmpty()) {
            return row;
        }
        DataRow projected = new DataRow();
        for (String field : includeFields) {
            if (row.has(field)) {
                projected.put(field, row.get(field));
            }
        }
        return projected;
    }
}
