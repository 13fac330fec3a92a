package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code format}: string formatting of the first source field into the first target field
 * (or back into the source field).
 *
 * <p>The {@code format} parameter selects uppercase, lowercase, trim, replace
 * ({@code find}, {@code replacement}), substring ({@code start}, {@code length}),
 * date ({@code pattern}, optional {@code zone}), number ({@code pattern}) or
 * template ({@code template} with {@code {field}} placeholders).
 */
public class FormatRuleHandler extends AbstractRowRuleHandler {

    private static final List<String> FORMATS =
            List.of("uppercase", "lowercase", "trim", "replace", "substring", "date", "number", "template");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    @Override
    public String type() {
        return "format";
    }

    @Override
    protected void validate(TransformationRule rule) {
        String format = formatOf(rule);
        require(FORMATS.contains(format), "Unsupported format: " + format);
        if (format.equals("template")) {
            require(rule.parameter("template") != null, "template format needs a 'template' parameter");
            require(rule.firstTargetField() != null || rule.firstSourceField() != null, "template format needs a target field");
        } else {
            require(rule.firstSourceField() != null, "format rule needs a source field");
        }
        if (format.equals("date") || format.equals("number")) {
            require(rule.parameter("pattern") != null, format + " format needs a 'pattern' parameter");
        }
    }

    @Override
    protected void applyToRow(TransformationRule rule, DataRow row, RuleContext context) {
        String format = formatOf(rule);
        String target = rule.firstTargetField() != null ? rule.firstTargetField() : rule.firstSourceField();
        if (format.equals("template")) {
            row.put(target, FieldValue.of(fillTemplate(rule.parameter("template"), row)));
            return;
        }
        FieldValue value = row.get(rule.firstSourceField());
        if (value.isNull()) {
            return;
        }
        row.put(target, format(format, value, rule));
    }

    private static FieldValue format(String format, FieldValue value, TransformationRule rule) {
        String text = value.asString();
        return switch (format) {
            case "uppercase" -> FieldValue.of(text.toUpperCase(Locale.ROOT));
            case "lowercase" -> FieldValue.of(text.toLowerCase(Locale.ROOT));
            case "trim" -> FieldValue.of(text.trim());
            case "replace" -> {
                String find = rule.parameter("find", "");
                String replacement = rule.parameter("replacement") != null ? rule.parameter("replacement") : rule.parameter("replace", "");
                yield FieldValue.of(find.isEmpty() ? text : text.replace(find, replacement));
            }
            case "substring" -> {
                int start = Integer.parseInt(rule.parameter("start", "0"));
                if (start < 0 || start >= text.length()) {
                    yield FieldValue.of("");
                }
                int length = rule.parameter("length") != null ? Integer.parseInt(rule.parameter("length")) : text.length() - start;
                int end = (int) Math.min((long) start + Math.max(0, length), text.length());
                yield FieldValue.of(text.substring(start, end));
            }
            case "date" -> {
                Instant instant = value.asTimestamp()
                        .orElseThrow(() -> new IllegalArgumentException("Not a timestamp: " + text));
                DateTimeFormatter formatter = DateTimeFormatter.ofPattern(rule.parameter("pattern"))
                        .withZone(ZoneId.of(rule.parameter("zone", "UTC")));
                yield FieldValue.of(formatter.format(instant));
            }
            case "number" -> {
                BigDecimal number = value.asNumber()
                        .orElseThrow(() -> new IllegalArgumentException("Not a number: " + text));
                DecimalFormat decimalFormat = new DecimalFormat(rule.parameter("pattern"), DecimalFormatSymbols.getInstance(Locale.ROOT));
                yield FieldValue.of(decimalFormat.format(number));
            }
            default -> throw new IllegalArgumentException("Unsupported format: " + format);
        };
    }

    private static String fillTemplate(String template, DataRow row) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = row.get(matcher.group(1)).asString();
            matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String formatOf(TransformationRule rule) {
        String format = rule.parameter("format");
        if (format == null) {
            format = rule.parameter("function", "");
        }
        format = format.toLowerCase(Locale.ROOT);
        return format.equals("formatdate") ? "date" : format;
    }
}
