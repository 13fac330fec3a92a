package com.openrangelabs.ingestor.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Email channel used when no {@link EmailSender} bean is present; records the logical send in the log.
 */
public class LoggingEmailSender implements EmailSender {

    private static final Logger logger = LoggerFactory.getLogger(LoggingEmailSender.class);

    @Override
    public Mono<Boolean> send(List<String> recipients, String subject, String body) {
        logger.info("Email to {} - {}: {}", String.join(", ", recipients), subject, body);
        return Mono.just(true);
    }
}
