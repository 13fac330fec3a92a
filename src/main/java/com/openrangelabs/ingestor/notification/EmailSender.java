package com.openrangelabs.ingestor.notification;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Outbound email channel for job notifications
 */
public interface EmailSender {

    /**
     * @return true when the message was accepted for every recipient
     */
    Mono<Boolean> send(List<String> recipients, String subject, String body);
}
