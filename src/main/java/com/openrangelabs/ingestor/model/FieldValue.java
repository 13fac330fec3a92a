package com.openrangelabs.ingestor.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;

/**
 * Tagged value carried by every extracted row.
 *
 * <p>A value is exactly one of string, number, boolean, timestamp, binary or null.
 * Rule handlers switch on {@link #kind()} instead of testing runtime types, and the
 * raw backend objects handed over by drivers are normalised once through {@link #from(Object)}.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public final class FieldValue {

    public enum Kind {
        STRING, NUMBER, BOOLEAN, TIMESTAMP, BINARY, NULL
    }

    private static final FieldValue NULL_VALUE = new FieldValue(Kind.NULL, null);
    private static final FieldValue TRUE_VALUE = new FieldValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final FieldValue FALSE_VALUE = new FieldValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private FieldValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static FieldValue ofNull() {
        return NULL_VALUE;
    }

    public static FieldValue of(String value) {
        return value == null ? NULL_VALUE : new FieldValue(Kind.STRING, value);
    }

    public static FieldValue of(BigDecimal value) {
        return value == null ? NULL_VALUE : new FieldValue(Kind.NUMBER, value);
    }

    public static FieldValue of(long value) {
        return new FieldValue(Kind.NUMBER, BigDecimal.valueOf(value));
    }

    public static FieldValue of(double value) {
        return new FieldValue(Kind.NUMBER, BigDecimal.valueOf(value));
    }

    public static FieldValue of(boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    public static FieldValue of(Instant value) {
        return value == null ? NULL_VALUE : new FieldValue(Kind.TIMESTAMP, value);
    }

    public static FieldValue of(byte[] value) {
        return value == null ? NULL_VALUE : new FieldValue(Kind.BINARY, value.clone());
    }

    /**
     * Normalises a raw driver or JSON value. Local date-times are taken as UTC.
     */
    public static FieldValue from(Object raw) {
        if (raw == null) {
            return NULL_VALUE;
        }
        if (raw instanceof FieldValue) {
            return (FieldValue) raw;
        }
        if (raw instanceof String) {
            return of((String) raw);
        }
        if (raw instanceof Character) {
            return of(raw.toString());
        }
        if (raw instanceof Boolean) {
            return of(((Boolean) raw).booleanValue());
        }
        if (raw instanceof BigDecimal) {
            return of((BigDecimal) raw);
        }
        if (raw instanceof BigInteger) {
            return of(new BigDecimal((BigInteger) raw));
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof Float || raw instanceof Double) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return of(raw.toString());
            }
            return of(d);
        }
        if (raw instanceof Number) {
            return of(new BigDecimal(raw.toString()));
        }
        if (raw instanceof Instant) {
            return of((Instant) raw);
        }
        if (raw instanceof OffsetDateTime) {
            return of(((OffsetDateTime) raw).toInstant());
        }
        if (raw instanceof ZonedDateTime) {
            return of(((ZonedDateTime) raw).toInstant());
        }
        if (raw instanceof LocalDateTime) {
            return of(((LocalDateTime) raw).toInstant(ZoneOffset.UTC));
        }
        if (raw instanceof LocalDate) {
            return of(((LocalDate) raw).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (raw instanceof Date) {
            return of(((Date) raw).toInstant());
        }
        if (raw instanceof byte[]) {
            return of((byte[]) raw);
        }
        if (raw instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) raw).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return new FieldValue(Kind.BINARY, bytes);
        }
        return of(raw.toString());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Text rendering: numbers in plain notation, timestamps as ISO-8601 instants,
     * binary as base64. Returns {@code null} for the null value.
     */
    public String asString() {
        return switch (kind) {
            case STRING -> (String) value;
            case NUMBER -> ((BigDecimal) value).toPlainString();
            case BOOLEAN -> value.toString();
            case TIMESTAMP -> DateTimeFormatter.ISO_INSTANT.format((Instant) value);
            case BINARY -> Base64.getEncoder().encodeToString((byte[]) value);
            case NULL -> null;
        };
    }

    /**
     * Numeric view. Strings are coerced when they parse as a decimal number.
     */
    public Optional<BigDecimal> asNumber() {
        return switch (kind) {
            case NUMBER -> Optional.of((BigDecimal) value);
            case STRING -> parseDecimal(((String) value).trim());
            default -> Optional.empty();
        };
    }

    public Optional<Boolean> asBoolean() {
        return switch (kind) {
            case BOOLEAN -> Optional.of((Boolean) value);
            case STRING -> {
                String text = ((String) value).trim();
                if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                    yield Optional.of(Boolean.parseBoolean(text));
                }
                yield Optional.empty();
            }
            case NUMBER -> Optional.of(((BigDecimal) value).signum() != 0);
            default -> Optional.empty();
        };
    }

    /**
     * Temporal view. Strings are coerced when they parse as an ISO instant,
     * offset date-time or local date-time (UTC).
     */
    public Optional<Instant> asTimestamp() {
        return switch (kind) {
            case TIMESTAMP -> Optional.of((Instant) value);
            case STRING -> parseTimestamp(((String) value).trim());
            default -> Optional.empty();
        };
    }

    public Optional<byte[]> asBinary() {
        if (kind == Kind.BINARY) {
            return Optional.of(((byte[]) value).clone());
        }
        return Optional.empty();
    }

    /**
     * Binary becomes base64 text and timestamps become ISO-8601 text; every other kind is unchanged.
     */
    public FieldValue toTransportSafe() {
        if (kind == Kind.BINARY || kind == Kind.TIMESTAMP) {
            return of(asString());
        }
        return this;
    }

    /**
     * Plain Java object for expression evaluation and JSON output.
     */
    public Object toJavaObject() {
        if (kind == Kind.BINARY) {
            return ((byte[]) value).clone();
        }
        return value;
    }

    private static Optional<BigDecimal> parseDecimal(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseTimestamp(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldValue that = (FieldValue) o;
        if (kind != that.kind) return false;
        return switch (kind) {
            case NULL -> true;
            case NUMBER -> ((BigDecimal) value).compareTo((BigDecimal) that.value) == 0;
            case BINARY -> Arrays.equals((byte[]) value, (byte[]) that.value);
            default -> value.equals(that.value);
        };
    }

    @Override
    public int hashCode() {
        return switch (kind) {
            case NULL -> 0;
            case NUMBER -> Objects.hash(kind, ((BigDecimal) value).stripTrailingZeros());
            case BINARY -> 31 * kind.hashCode() + Arrays.hashCode((byte[]) value);
            default -> Objects.hash(kind, value);
        };
    }

    @Override
    public String toString() {
        return kind == Kind.NULL ? "null" : kind.name().toLowerCase() + ":" + asString();
    }
}
