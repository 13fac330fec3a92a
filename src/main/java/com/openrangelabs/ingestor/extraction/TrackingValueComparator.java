package com.openrangelabs.ingestor.extraction;

import com.openrangelabs.ingestor.model.FieldValue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Orders tracking-field values: numeric when both sides coerce to numbers, then temporal,
 * then plain string order. Nulls sort first.
 */
public final class TrackingValueComparator implements Comparator<FieldValue> {

    public static final TrackingValueComparator INSTANCE = new TrackingValueComparator();

    private TrackingValueComparator() {
    }

    @Override
    public int compare(FieldValue left, FieldValue right) {
        boolean leftNull = left == null || left.isNull();
        boolean rightNull = right == null || right.isNull();
        if (leftNull || rightNull) {
            return leftNull == rightNull ? 0 : (leftNull ? -1 : 1);
        }
        if (left.kind() == FieldValue.Kind.BOOLEAN && right.kind() == FieldValue.Kind.BOOLEAN) {
            return Boolean.compare(left.asBoolean().orElse(false), right.asBoolean().orElse(false));
        }

        Optional<BigDecimal> leftNumber = left.asNumber();
        Optional<BigDecimal> rightNumber = right.asNumber();
        if (leftNumber.isPresent() && rightNumber.isPresent()) {
            return leftNumber.get().compareTo(rightNumber.get());
        }

        Optional<Instant> leftTime = left.asTimestamp();
        Optional<Instant> rightTime = right.asTimestamp();
        if (leftTime.isPresent() && rightTime.isPresent()) {
            return leftTime.get().compareTo(rightTime.get());
        }

        return left.asString().compareTo(right.asString());
    }

    public boolean isGreater(FieldValue candidate, FieldValue bound) {
        return compare(candidate, bound) > 0;
    }

    /**
     * The larger of two values; nulls lose.
     */
    public FieldValue max(FieldValue current, FieldValue candidate) {
        if (current == null || current.isNull()) {
            return candidate;
        }
        if (candidate == null || candidate.isNull()) {
            return current;
        }
        return compare(candidate, current) > 0 ? candidate : current;
    }
}
