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
 * One step of a rule pipeline. Rules run in ascending {@code order}; ties keep list order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransformationRule {

    private String id;

    /**
     * map, filter, aggregate, join, format, add, remove, rename or custom.
     */
    private String type;

    @Builder.Default
    private List<String> sourceFields = new ArrayList<>();

    @Builder.Default
    private List<String> targetFields = new ArrayList<>();

    private String description;

    private String expression;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    private int order;

    /**
     * Per-row guard, {@code field op value}; rows that do not satisfy it are left alone.
     */
    private String condition;

    /**
     * Overrides the pipeline-level flag when set.
     */
    private Boolean failOnError;

    public String parameter(String name) {
        Object value = parameters == null ? null : parameters.get(name);
        return value == null ? null : value.toString();
    }

    public String parameter(String name, String defaultValue) {
        String value = parameter(name);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    public String firstSourceField() {
        return sourceFields == null || sourceFields.isEmpty() ? null : sourceFields.get(0);
    }

    public String firstTargetField() {
        return targetFields == null || targetFields.isEmpty() ? null : targetFields.get(0);
    }
}
