package com.openrangelabs.ingestor.transformation;

import com.openrangelabs.ingestor.extraction.TrackingValueComparator;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed {@code field op value} guard.
 *
 * <p>Operators: eq, ne, gt, lt, ge, le, contains, startswith, endswith, exists, notexists.
 * Values may be quoted with single or double quotes. Ordering comparisons use the
 * tracking-value comparator so {@code "10" gt "9"} holds.
 */
public final class RuleCondition {

    private static final Pattern CONDITION = Pattern.compile(
            "^\\s*(\\S+)\\s+(eq|ne|gt|lt|ge|le|contains|startswith|endswith|exists|notexists)(?:\\s+(.*?))?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private final String field;
    private final String operator;
    private final FieldValue value;

    private RuleCondition(String field, String operator, FieldValue value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    /**
     * Parses a condition, or returns empty if the text is not in {@code field op value} form.
     */
    public static Optional<RuleCondition> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = CONDITION.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String operator = matcher.group(2).toLowerCase(Locale.ROOT);
        String raw = matcher.group(3);
        boolean unary = operator.equals("exists") || operator.equals("notexists");
        if (!unary && raw == null) {
            return Optional.empty();
        }
        return Optional.of(new RuleCondition(matcher.group(1), operator, unary ? FieldValue.ofNull() : literal(raw)));
    }

    public static RuleCondition of(String field, String operator, Object value) {
        return new RuleCondition(field, operator.toLowerCase(Locale.ROOT), FieldValue.from(value));
    }

    private static FieldValue literal(String raw) {
        String text = raw.trim();
        if (text.length() >= 2 && ((text.startsWith("'") && text.endsWith("'")) || (text.startsWith("\"") && text.endsWith("\"")))) {
            return FieldValue.of(text.substring(1, text.length() - 1));
        }
        if ("null".equalsIgnoreCase(text)) {
            return FieldValue.ofNull();
        }
        return FieldValue.of(text);
    }

    public String getField() { return field; }
    public String getOperator() { return operator; }
    public FieldValue getValue() { return value; }

    public boolean test(DataRow row) {
        FieldValue actual = row.get(field);
        return switch (operator) {
            case "exists" -> row.has(field) && !actual.isNull();
            case "notexists" -> !row.has(field) || actual.isNull();
            case "eq" -> equalsLoosely(actual, value);
            case "ne" -> !equalsLoosely(actual, value);
            case "gt" -> !actual.isNull() && TrackingValueComparator.INSTANCE.compare(actual, value) > 0;
            case "lt" -> !actual.isNull() && TrackingValueComparator.INSTANCE.compare(actual, value) < 0;
            case "ge" -> !actual.isNull() && TrackingValueComparator.INSTANCE.compare(actual, value) >= 0;
            case "le" -> !actual.isNull() && TrackingValueComparator.INSTANCE.compare(actual, value) <= 0;
            case "contains" -> textOf(actual).contains(textOf(value));
            case "startswith" -> textOf(actual).startsWith(textOf(value));
            case "endswith" -> textOf(actual).endsWith(textOf(value));
            default -> throw new IllegalStateException("Unsupported operator: " + operator);
        };
    }

    private static boolean equalsLoosely(FieldValue left, FieldValue right) {
        if (left.isNull() || right.isNull()) {
            return left.isNull() && right.isNull();
        }
        return TrackingValueComparator.INSTANCE.compare(left, right) == 0;
    }

    private static String textOf(FieldValue value) {
        String text = value.asString();
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return field + " " + operator + (value.isNull() ? "" : " " + value.asString());
    }
}
