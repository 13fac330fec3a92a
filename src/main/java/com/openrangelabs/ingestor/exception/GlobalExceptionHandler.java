package com.openrangelabs.ingestor.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for the ingestor API.
 *
 * <p>Maps the ingestion exception hierarchy onto HTTP status codes with structured error
 * bodies. Cryptographic failures never expose their details.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(JobNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleJobNotFound(JobNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Job not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Job Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(ConnectorNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConnectorNotFound(ConnectorNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Connector not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Connector Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(CredentialNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCredentialNotFound(CredentialNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Credential not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Credential Not Found", ex.getMessage(), exchange);
    }

    /**
     * Pausing a paused job, resuming a running one, triggering a paused one, bad cron.
     */
    @ExceptionHandler(SchedulingException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleScheduling(SchedulingException ex, ServerWebExchange exchange) {
        log.warn("Scheduling conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Scheduling Conflict", ex.getMessage(), exchange);
    }

    @ExceptionHandler(CredentialEncryptionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCredentialEncryption(
            CredentialEncryptionException ex, ServerWebExchange exchange) {

        log.error("Credential {} error: {}", ex.getOperation(), ex.getMessage(), ex);

        // Don't expose internal encryption details
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Credential Processing Error",
                "Unable to process credential. Please try again.", exchange);
    }

    @ExceptionHandler(CredentialException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCredentialException(CredentialException ex, ServerWebExchange exchange) {
        log.error("Credential operation failed ({}): {}", ex.getKind(), ex.getMessage(), ex);
        return respond(HttpStatus.BAD_REQUEST, "Credential Operation Failed", ex.getMessage(), exchange);
    }

    @ExceptionHandler(ConnectorRegistrationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRegistration(ConnectorRegistrationException ex, ServerWebExchange exchange) {
        log.warn("Connector registration failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Connector Registration Failed", ex.getMessage(), exchange);
    }

    @ExceptionHandler(IngestionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIngestion(IngestionException ex, ServerWebExchange exchange) {
        log.warn("Ingestion request failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Ingestion Request Failed", ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ValidationErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        log.warn("Validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        ValidationErrorResponse error = ValidationErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Request validation failed")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .fieldErrors(fieldErrors)
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleBadInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Malformed request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getReason(), exchange);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(AccessDeniedException ex, ServerWebExchange exchange) {
        log.warn("Access denied: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Access Denied", "Insufficient privileges to access this resource", exchange);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again.", exchange);
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String error, String message,
                                                        ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
