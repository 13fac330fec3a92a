package com.openrangelabs.ingestor.extraction;

import java.util.Objects;

/**
 * Pipe-delimited cursor produced by connectors.
 *
 * <p>Two shapes exist: {@code target|trackingField|value} for incremental extraction and
 * {@code target|offset} for resuming a paged full extraction. The value part may itself
 * contain pipes. Only connectors decode tokens; everyone else stores the encoded string.
 */
public final class ContinuationToken {

    private static final String SEPARATOR = "|";

    private final String target;
    private final String trackingField;
    private final String value;

    private ContinuationToken(String target, String trackingField, String value) {
        this.target = target;
        this.trackingField = trackingField;
        this.value = value;
    }

    public static ContinuationToken tracking(String target, String trackingField, String value) {
        return new ContinuationToken(requireText(target, "target"), requireText(trackingField, "trackingField"),
                Objects.requireNonNull(value, "value"));
    }

    public static ContinuationToken offset(String target, long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }
        return new ContinuationToken(requireText(target, "target"), null, Long.toString(offset));
    }

    /**
     * Decodes a token string.
     *
     * @throws IllegalArgumentException if the token is malformed
     */
    public static ContinuationToken parse(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Continuation token is empty");
        }
        String[] parts = token.split("\\|", 3);
        if (parts.length == 3) {
            return tracking(parts[0], parts[1], parts[2]);
        }
        if (parts.length == 2) {
            try {
                return offset(parts[0], Long.parseLong(parts[1]));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed offset in continuation token: " + token, e);
            }
        }
        throw new IllegalArgumentException("Malformed continuation token: " + token);
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Continuation token " + name + " is empty");
        }
        return value;
    }

    public String getTarget() { return target; }
    public String getTrackingField() { return trackingField; }
    public String getValue() { return value; }

    public boolean isOffset() {
        return trackingField == null;
    }

    public long getOffset() {
        if (!isOffset()) {
            throw new IllegalStateException("Not an offset token: " + encode());
        }
        return Long.parseLong(value);
    }

    public boolean isFor(String targetStructure) {
        return target.equalsIgnoreCase(targetStructure);
    }

    public String encode() {
        return isOffset() ? target + SEPARATOR + value : target + SEPARATOR + trackingField + SEPARATOR + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return encode().equals(((ContinuationToken) o).encode());
    }

    @Override
    public int hashCode() {
        return encode().hashCode();
    }

    @Override
    public String toString() {
        return encode();
    }
}
