package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.extraction.TrackingValueComparator;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@code aggregate}: collapses rows into one row per {@code groupBy} key.
 *
 * <p>Inputs are the source fields (or the target fields when none are given), outputs are the
 * target fields (or the inputs). Groups appear in first-seen order. Rows the guard rejects are
 * kept unchanged after the aggregated rows.
 */
public class AggregateRuleHandler implements RuleHandler {

    @Override
    public String type() {
        return "aggregate";
    }

    @Override
    public List<DataRow> apply(TransformationRule rule, List<DataRow> rows, RuleContext context) {
        String function = rule.parameter("function", "sum").toLowerCase(Locale.ROOT);
        if (!List.of("sum", "avg", "min", "max", "count").contains(function)) {
            throw new IllegalArgumentException("Unsupported aggregate function: " + function);
        }
        List<String> groupBy = splitList(rule.parameter("groupBy"));
        List<String> inputs = !rule.getSourceFields().isEmpty() ? rule.getSourceFields() : rule.getTargetFields();
        List<String> outputs = !rule.getTargetFields().isEmpty() ? rule.getTargetFields() : inputs;
        if (inputs.isEmpty() && !"count".equals(function)) {
            throw new IllegalArgumentException("aggregate rule needs source or target fields");
        }

        Map<List<String>, List<DataRow>> groups = new LinkedHashMap<>();
        List<DataRow> untouched = new ArrayList<>();
        for (DataRow row : rows) {
            context.rowSeen();
            if (!context.guardAllows(row)) {
                untouched.add(row);
                continue;
            }
            List<String> key = groupBy.stream().map(field -> String.valueOf(row.get(field).asString())).collect(Collectors.toList());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            context.recordSuccess();
        }

        List<DataRow> result = new ArrayList<>(groups.size() + untouched.size());
        for (List<DataRow> group : groups.values()) {
            DataRow aggregated = new DataRow();
            DataRow first = group.get(0);
            groupBy.forEach(field -> aggregated.put(field, first.get(field)));
            if (inputs.isEmpty()) {
                aggregated.put(outputs.isEmpty() ? "count" : outputs.get(0), FieldValue.of(group.size()));
            }
            for (int i = 0; i < inputs.size(); i++) {
                String output = i < outputs.size() ? outputs.get(i) : inputs.get(i);
                aggregated.put(output, aggregate(function, inputs.get(i), group));
            }
            result.add(aggregated);
        }
        result.addAll(untouched);
        return result;
    }

    private static FieldValue aggregate(String function, String field, List<DataRow> group) {
        return switch (function) {
            case "count" -> FieldValue.of(group.stream().filter(row -> !row.get(field).isNull()).count());
            case "min" -> group.stream().map(row -> row.get(field)).filter(value -> !value.isNull())
                    .min(TrackingValueComparator.INSTANCE).orElse(FieldValue.ofNull());
            case "max" -> group.stream().map(row -> row.get(field)).filter(value -> !value.isNull())
                    .max(TrackingValueComparator.INSTANCE).orElse(FieldValue.ofNull());
            case "avg" -> {
                List<BigDecimal> numbers = numbers(field, group);
                if (numbers.isEmpty()) {
                    yield FieldValue.ofNull();
                }
                BigDecimal sum = numbers.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
                yield FieldValue.of(sum.divide(BigDecimal.valueOf(numbers.size()), MathContext.DECIMAL64));
            }
            default -> FieldValue.of(numbers(field, group).stream().reduce(BigDecimal.ZERO, BigDecimal::add));
        };
    }

    private static List<BigDecimal> numbers(String field, List<DataRow> group) {
        return group.stream()
                .map(row -> row.get(field).asNumber())
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toList());
    }
}
