package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@code join}: equality join against a named row set from the transformation parameters.
 *
 * <p>Parameters: {@code source} (required), {@code joinType} inner|left, {@code rightFields}
 * (defaults to the source fields). Right-side fields are merged as {@code <prefix>.<field>},
 * the prefix being the first target field or the source name. Several matches produce one
 * output row each. Rows with a null key component match nothing.
 */
public class JoinRuleHandler implements RuleHandler {

    @Override
    public String type() {
        return "join";
    }

    @Override
    public List<DataRow> apply(TransformationRule rule, List<DataRow> rows, RuleContext context) {
        String sourceName = rule.parameter("source");
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("join rule needs a 'source' parameter");
        }
        List<DataRow> right = context.joinSource(sourceName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown join source: " + sourceName));
        List<String> leftFields = rule.getSourceFields();
        if (leftFields.isEmpty()) {
            throw new IllegalArgumentException("join rule needs source fields to join on");
        }
        List<String> rightFields = rule.parameter("rightFields") != null
                ? Arrays.stream(rule.parameter("rightFields").split(",")).map(String::trim).collect(Collectors.toList())
                : leftFields;
        if (rightFields.size() != leftFields.size()) {
            throw new IllegalArgumentException("join rule has " + leftFields.size() + " left and " + rightFields.size() + " right fields");
        }
        String joinType = rule.parameter("joinType", "inner").toLowerCase(Locale.ROOT);
        if (!joinType.equals("inner") && !joinType.equals("left")) {
            throw new IllegalArgumentException("Unsupported join type: " + joinType);
        }
        String prefix = rule.firstTargetField() != null ? rule.firstTargetField() : sourceName;

        Map<List<String>, List<DataRow>> index = new HashMap<>();
        for (DataRow candidate : right) {
            List<String> key = keyOf(candidate, rightFields);
            if (key != null) {
                index.computeIfAbsent(key, k -> new ArrayList<>()).add(candidate);
            }
        }

        List<DataRow> joined = new ArrayList<>(rows.size());
        for (DataRow row : rows) {
            context.rowSeen();
            if (!context.guardAllows(row)) {
                joined.add(row);
                continue;
            }
            List<String> key = keyOf(row, leftFields);
            List<DataRow> matches = key == null ? List.of() : index.getOrDefault(key, List.of());
            if (matches.isEmpty()) {
                if (joinType.equals("left")) {
                    joined.add(row);
                }
            } else {
                for (DataRow match : matches) {
                    DataRow merged = row.copy();
                    match.asMap().forEach((field, value) -> merged.put(prefix + "." + field, value));
                    joined.add(merged);
                }
            }
            context.recordSuccess();
        }
        return joined;
    }

    /**
     * Join key of a row, or {@code null} when any key field is null; null never equals anything.
     */
    private static List<String> keyOf(DataRow row, List<String> fields) {
        List<String> key = new ArrayList<>(fields.size());
        for (String field : fields) {
            FieldValue value = row.get(field);
            if (value.isNull()) {
                return null;
            }
            key.add(value.asNumber().map(n -> n.stripTrailingZeros().toPlainString()).orElseGet(value::asString));
        }
        return key;
    }
}
