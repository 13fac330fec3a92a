package com.openrangelabs.ingestor.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import com.openrangelabs.ingestor.model.IngestionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Sends job status notifications over email and webhooks
 *
 * <p>Delivery problems are logged and reported as {@code false}; they never fail the job.
 */
@Service
public class JobNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(JobNotificationService.class);

    private static final DateTimeFormatter MESSAGE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final EmailSender emailSender;
    private final ObjectMapper objectMapper;
    private final Duration webhookTimeout;
    private final Clock clock;

    @Autowired
    public JobNotificationService(WebClient.Builder webClientBuilder,
                                  ObjectProvider<EmailSender> emailSender,
                                  ObjectMapper objectMapper,
                                  @Value("${ingestion.notifications.webhook-timeout:10s}") Duration webhookTimeout) {
        this(webClientBuilder.build(), emailSender.getIfAvailable(LoggingEmailSender::new), objectMapper, webhookTimeout, Clock.systemUTC());
    }

    JobNotificationService(WebClient webClient, EmailSender emailSender, ObjectMapper objectMapper,
                           Duration webhookTimeout, Clock clock) {
        this.webClient = webClient;
        this.emailSender = emailSender;
        this.objectMapper = objectMapper;
        this.webhookTimeout = webhookTimeout;
        this.clock = clock;
    }

    /**
     * Send a notification for the given status if the job asks for one
     *
     * @return true when every configured channel delivered
     */
    public Mono<Boolean> sendNotification(IngestionJobDefinition job, IngestionStatus status, String message) {
        NotificationConfig config = parseConfig(job.getNotificationConfigJson());
        if (!shouldSend(config, status)) {
            logger.debug("No notification configured for job {} with status {}", job.getId(), status);
            return Mono.just(false);
        }

        String text = formatMessage(job, config, status, message);
        return switch (config.getMethod()) {
            case EMAIL -> sendEmail(job, config, status, text);
            case WEBHOOK -> sendWebhooks(job, config, status, text);
            case BOTH -> Mono.zip(sendEmail(job, config, status, text), sendWebhooks(job, config, status, text))
                    .map(results -> results.getT1() && results.getT2());
        };
    }

    public NotificationConfig parseConfig(String json) {
        if (json == null || json.isBlank()) {
            return new NotificationConfig();
        }
        try {
            NotificationConfig config = objectMapper.readValue(json, NotificationConfig.class);
            if (config.getMethod() == null) {
                config.setMethod(NotificationMethod.WEBHOOK);
            }
            return config;
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse notification config: {}", e.getOriginalMessage());
            return new NotificationConfig();
        }
    }

    /**
     * Completion notices follow notifyOnCompletion; failures and pauses follow notifyOnFailure.
     */
    public boolean shouldSend(NotificationConfig config, IngestionStatus status) {
        return switch (status) {
            case COMPLETED -> config.isNotifyOnCompletion();
            case FAILED, PAUSED -> config.isNotifyOnFailure();
            default -> false;
        };
    }

    public String formatMessage(IngestionJobDefinition job, NotificationConfig config, IngestionStatus status, String message) {
        String statusText = statusText(status);
        String timestamp = MESSAGE_TIME.format(clock.instant());
        String template = config.getMessageTemplate();
        if (template != null && !template.isBlank()) {
            return template
                    .replace("{jobId}", String.valueOf(job.getId()))
                    .replace("{jobName}", String.valueOf(job.getName()))
                    .replace("{status}", statusText)
                    .replace("{timestamp}", timestamp)
                    .replace("{message}", message != null ? message : "");
        }

        String text = String.format("Ingestion job '%s' (ID: %s) %s at %s.", job.getName(), job.getId(), statusText, timestamp);
        if (message != null && !message.isBlank()) {
            text += "\n\nDetails: " + message;
        }
        return text;
    }

    private Mono<Boolean> sendEmail(IngestionJobDefinition job, NotificationConfig config, IngestionStatus status, String text) {
        List<String> recipients = config.getEmailRecipients();
        if (recipients == null || recipients.isEmpty()) {
            logger.warn("No email recipients configured for job {}", job.getId());
            return Mono.just(false);
        }
        String subject = String.format("Ingestion job '%s' %s", job.getName(), statusText(status));
        return emailSender.send(recipients, subject, text)
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    logger.error("Failed to send email notification for job {}: {}", job.getId(), error.getMessage());
                    return Mono.just(false);
                });
    }

    private Mono<Boolean> sendWebhooks(IngestionJobDefinition job, NotificationConfig config, IngestionStatus status, String text) {
        List<String> urls = config.getWebhookUrls();
        if (urls == null || urls.isEmpty()) {
            logger.warn("No webhook URLs configured for job {}", job.getId());
            return Mono.just(false);
        }
        WebhookPayload payload = new WebhookPayload(job.getId(), job.getName(), job.getTenantId(),
                status.name(), Instant.now(clock).toString(), text);

        return Flux.fromIterable(urls)
                .flatMap(url -> postWebhook(job, url, payload))
                .all(Boolean::booleanValue);
    }

    private Mono<Boolean> postWebhook(IngestionJobDefinition job, String url, WebhookPayload payload) {
        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .toBodilessEntity()
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .timeout(webhookTimeout)
                .onErrorResume(error -> {
                    logger.error("Failed to send webhook to {} for job {}: {}", url, job.getId(), error.getMessage());
                    return Mono.just(false);
                });
    }

    private static String statusText(IngestionStatus status) {
        return switch (status) {
            case COMPLETED -> "completed successfully";
            case FAILED -> "failed";
            case CANCELLED -> "was cancelled";
            case PAUSED -> "was paused";
            case RUNNING -> "is currently running";
            default -> status.name().toLowerCase(Locale.ROOT);
        };
    }
}
