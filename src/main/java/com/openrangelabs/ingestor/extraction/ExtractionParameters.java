package com.openrangelabs.ingestor.extraction;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What to extract and how. Serialized as JSON on job definitions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionParameters {

    public static final String ALL_STRUCTURES = "*";
    public static final int DEFAULT_BATCH_SIZE = 1000;

    @Builder.Default
    private List<String> targetStructures = new ArrayList<>();

    @Builder.Default
    private List<String> includeFields = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> filterCriteria = new LinkedHashMap<>();

    /**
     * Row cap; 0 means "use the batch size".
     */
    @Builder.Default
    private int maxRecords = 0;

    @Builder.Default
    private int batchSize = DEFAULT_BATCH_SIZE;

    private boolean incrementalExtraction;

    @JsonAlias("changeTrackingField")
    private String trackingField;

    /**
     * Lower bound (exclusive) for the tracking field when no continuation token is supplied.
     */
    private String changesFrom;

    private String continuationToken;

    @Builder.Default
    private Map<String, Object> options = new LinkedHashMap<>();

    public int effectiveLimit() {
        if (maxRecords > 0) {
            return maxRecords;
        }
        return batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
    }

    public boolean targetsAllStructures() {
        return targetStructures == null || targetStructures.isEmpty() || targetStructures.contains(ALL_STRUCTURES);
    }

    public boolean hasContinuationToken() {
        return continuationToken != null && !continuationToken.isBlank();
    }

    public String option(String name) {
        Object value = options == null ? null : options.get(name);
        return value == null ? null : value.toString();
    }

    public boolean booleanOption(String name) {
        return Boolean.parseBoolean(option(name));
    }
}
