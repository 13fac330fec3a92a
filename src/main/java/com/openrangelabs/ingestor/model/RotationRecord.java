package com.openrangelabs.ingestor.model;

import java.time.LocalDateTime;

/**
 * One entry of a credential's rotation history
 */
public record RotationRecord(LocalDateTime rotatedAt, String reason) {
}
