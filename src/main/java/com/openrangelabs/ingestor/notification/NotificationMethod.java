package com.openrangelabs.ingestor.notification;

public enum NotificationMethod {
    EMAIL,
    WEBHOOK,
    BOTH
}
