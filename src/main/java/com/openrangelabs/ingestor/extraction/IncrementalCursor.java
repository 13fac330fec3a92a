package com.openrangelabs.ingestor.extraction;

import com.openrangelabs.ingestor.exception.InvalidExtractionRequestException;
import com.openrangelabs.ingestor.model.FieldValue;

/**
 * Resolved position of an incremental extraction: which field is tracked on which target and
 * the last value already delivered. Produces the token for the next call.
 */
public final class IncrementalCursor {

    private final String target;
    private final String trackingField;
    private final FieldValue lastValue;
    private final String previousToken;

    private IncrementalCursor(String target, String trackingField, FieldValue lastValue, String previousToken) {
        this.target = target;
        this.trackingField = trackingField;
        this.lastValue = lastValue;
        this.previousToken = previousToken;
    }

    /**
     * Resolves the cursor for {@code target}. A replayed token wins over {@code changesFrom}.
     *
     * @param defaultTrackingField used when neither the parameters nor the token name a field; may be null
     * @throws InvalidExtractionRequestException if the token is malformed, belongs to another target,
     *                                           or no tracking field can be determined
     */
    public static IncrementalCursor resolve(ExtractionParameters parameters, String target, String defaultTrackingField) {
        String requestedField = hasText(parameters.getTrackingField()) ? parameters.getTrackingField() : null;

        if (parameters.hasContinuationToken()) {
            ContinuationToken token;
            try {
                token = ContinuationToken.parse(parameters.getContinuationToken());
            } catch (IllegalArgumentException e) {
                throw new InvalidExtractionRequestException(e.getMessage(), e);
            }
            if (token.isOffset()) {
                throw new InvalidExtractionRequestException("Continuation token is a paging offset, not an incremental cursor");
            }
            if (!token.isFor(target)) {
                throw new InvalidExtractionRequestException(String.format(
                        "Continuation token was issued for '%s', not '%s'", token.getTarget(), target));
            }
            if (requestedField != null && !requestedField.equalsIgnoreCase(token.getTrackingField())) {
                throw new InvalidExtractionRequestException(String.format(
                        "Continuation token tracks '%s' but '%s' was requested", token.getTrackingField(), requestedField));
            }
            return new IncrementalCursor(target, token.getTrackingField(), FieldValue.of(token.getValue()),
                    parameters.getContinuationToken());
        }

        String field = requestedField != null ? requestedField : defaultTrackingField;
        if (!hasText(field)) {
            throw new InvalidExtractionRequestException("Incremental extraction requires a tracking field");
        }
        FieldValue lower = hasText(parameters.getChangesFrom()) ? FieldValue.of(parameters.getChangesFrom()) : FieldValue.ofNull();
        return new IncrementalCursor(target, field, lower, null);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public String getTarget() { return target; }
    public String getTrackingField() { return trackingField; }
    public FieldValue getLastValue() { return lastValue; }
    public String getPreviousToken() { return previousToken; }

    public boolean hasLowerBound() {
        return !lastValue.isNull();
    }

    /**
     * Token for the next call. With nothing new observed the previous token (if any) is returned unchanged.
     */
    public String nextToken(FieldValue observedMax) {
        FieldValue max = TrackingValueComparator.INSTANCE.max(lastValue, observedMax);
        if (max == null || max.isNull()) {
            return previousToken;
        }
        if (previousToken != null && TrackingValueComparator.INSTANCE.compare(max, lastValue) == 0) {
            return previousToken;
        }
        return ContinuationToken.tracking(target, trackingField, max.asString()).encode();
    }
}
