package com.openrangelabs.ingestor.transformation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule pipeline definition, stored as JSON on job definitions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransformationParameters {

    public static final int DEFAULT_BATCH_SIZE = 500;

    @Builder.Default
    private List<TransformationRule> rules = new ArrayList<>();

    /**
     * Work on a deep copy so the caller's rows stay untouched.
     */
    private boolean preserveOriginalData;

    private boolean failOnError;

    @Builder.Default
    private Map<String, Object> options = new LinkedHashMap<>();

    /**
     * Named right-hand row sets for join rules.
     */
    @Builder.Default
    private Map<String, List<Map<String, Object>>> joinSources = new LinkedHashMap<>();

    public int batchSize() {
        Object value = options == null ? null : options.get("batchSize");
        if (value == null) {
            return DEFAULT_BATCH_SIZE;
        }
        try {
            int parsed = Integer.parseInt(value.toString());
            return parsed > 0 ? parsed : DEFAULT_BATCH_SIZE;
        } catch (NumberFormatException e) {
            return DEFAULT_BATCH_SIZE;
        }
    }
}
