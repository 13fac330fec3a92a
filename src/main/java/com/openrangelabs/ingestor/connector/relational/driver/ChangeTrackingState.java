package com.openrangelabs.ingestor.connector.relational.driver;

/**
 * Native change-tracking versions of a table. Backends without a change feed report {@link #disabled()}.
 */
public record ChangeTrackingState(boolean enabled, long currentVersion, long minValidVersion) {

    public static ChangeTrackingState disabled() {
        return new ChangeTrackingState(false, 0, 0);
    }
}
