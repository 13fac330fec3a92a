package com.openrangelabs.ingestor.notification;

import java.util.UUID;

/**
 * JSON body posted to each configured webhook URL
 *
 * @param timestamp ISO-8601 instant of the notification
 */
public record WebhookPayload(UUID jobId, String jobName, UUID tenantId, String status, String timestamp, String message) {
}
