package com.openrangelabs.ingestor.connector;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a connector instance.
 *
 * <p>Legal transitions: {@code DISCONNECTED -> CONNECTING -> {CONNECTED, ERROR}} and
 * {@code CONNECTED -> DISCONNECTING -> {DISCONNECTED, ERROR}}. {@code ERROR} is left only
 * through a fresh connect attempt.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DISCONNECTING,
    ERROR;

    public boolean canTransitionTo(ConnectionState target) {
        return allowedTargets().contains(target);
    }

    private Set<ConnectionState> allowedTargets() {
        return switch (this) {
            case DISCONNECTED, ERROR -> EnumSet.of(CONNECTING);
            case CONNECTING -> EnumSet.of(CONNECTED, ERROR);
            case CONNECTED -> EnumSet.of(DISCONNECTING);
            case DISCONNECTING -> EnumSet.of(DISCONNECTED, ERROR);
        };
    }
}
