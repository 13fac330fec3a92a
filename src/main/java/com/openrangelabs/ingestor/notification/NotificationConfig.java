package com.openrangelabs.ingestor.notification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-job notification settings, stored as JSON on the job definition
 *
 * <p>{@code messageTemplate} may use the placeholders {jobId}, {jobName}, {status},
 * {timestamp} and {message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationConfig {

    @Builder.Default
    private NotificationMethod method = NotificationMethod.WEBHOOK;

    private boolean notifyOnCompletion;

    private boolean notifyOnFailure;

    @Builder.Default
    private List<String> emailRecipients = new ArrayList<>();

    @Builder.Default
    private List<String> webhookUrls = new ArrayList<>();

    private String messageTemplate;
}
