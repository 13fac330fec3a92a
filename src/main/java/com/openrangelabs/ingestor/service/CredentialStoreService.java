package com.openrangelabs.ingestor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.entity.Credential;
import com.openrangelabs.ingestor.exception.CredentialErrorKind;
import com.openrangelabs.ingestor.exception.CredentialException;
import com.openrangelabs.ingestor.exception.CredentialNotFoundException;
import com.openrangelabs.ingestor.exception.CredentialRotationException;
import com.openrangelabs.ingestor.model.CredentialInfo;
import com.openrangelabs.ingestor.model.CredentialValidationResult;
import com.openrangelabs.ingestor.model.RotationRecord;
import com.openrangelabs.ingestor.repository.CredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Service for storing, serving and rotating encrypted credentials by key
 *
 * <p>Store, rotate, delete and disable run one at a time behind a single lock so read-modify-write
 * sequences never lose updates. Reads do not take the lock.
 */
@Service
public class CredentialStoreService {

    private static final Logger logger = LoggerFactory.getLogger(CredentialStoreService.class);

    static final int MAX_ROTATION_HISTORY = 10;

    private static final TypeReference<List<RotationRecord>> HISTORY_TYPE = new TypeReference<>() { };
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() { };

    private final CredentialRepository repository;
    private final AesCredentialEncryptor encryptor;
    private final ObjectMapper objectMapper;
    private final ReentrantLock mutationLock = new ReentrantLock();

    @Autowired
    public CredentialStoreService(CredentialRepository repository, AesCredentialEncryptor encryptor, ObjectMapper objectMapper) {
        this.repository = repository;
        this.encryptor = encryptor;
        this.objectMapper = objectMapper;
    }

    /**
     * Store a credential, replacing the value of an existing key
     */
    public Mono<CredentialInfo> store(String key, String value, String source, String group,
                                      Map<String, String> metadata, LocalDateTime expiresAt) {
        requireKey(key);
        Objects.requireNonNull(value, "value");
        return serialized(() -> repository.findByKey(key)
                .defaultIfEmpty(new Credential())
                .flatMap(credential -> {
                    boolean created = credential.getId() == null;
                    AesCredentialEncryptor.EncryptedSecret secret = encryptor.encrypt(value);
                    credential.setKey(key);
                    credential.setEncryptedValue(secret.cipherText());
                    credential.setIv(secret.iv());
                    credential.setSource(source);
                    credential.setGroup(group);
                    credential.setMetadataJson(metadata == null || metadata.isEmpty() ? null : toJson(metadata));
                    credential.setExpiresAt(expiresAt);
                    credential.setEnabled(true);
                    credential.touch();
                    return repository.save(credential)
                            .doOnSuccess(saved -> logger.info("{} credential {}", created ? "Stored" : "Updated", key));
                }))
                .map(this::toInfo)
                .onErrorMap(e -> !(e instanceof CredentialException),
                        e -> new CredentialException(CredentialErrorKind.STORAGE, "Failed to store credential: " + key, e));
    }

    public Mono<CredentialInfo> store(String key, String value) {
        return store(key, value, null, null, null, null);
    }

    /**
     * Decrypted value, or empty when the key is missing, disabled or expired
     */
    public Mono<String> get(String key) {
        requireKey(key);
        LocalDateTime now = LocalDateTime.now();
        return repository.findByKey(key)
                .onErrorMap(e -> new CredentialException(CredentialErrorKind.RETRIEVAL, "Failed to retrieve credential: " + key, e))
                .filter(credential -> {
                    if (!credential.isUsable(now)) {
                        logger.warn("Credential not found, disabled or expired: {}", key);
                        return false;
                    }
                    return true;
                })
                .map(credential -> {
                    String value = encryptor.decrypt(credential.getEncryptedValue(), credential.getIv());
                    recordAccess(key, now);
                    return value;
                })
                .doOnError(error -> logger.error("Failed to retrieve credential {}: {}", key, error.getMessage()));
    }

    public Mono<Boolean> hasCredential(String key) {
        requireKey(key);
        LocalDateTime now = LocalDateTime.now();
        return repository.findByKey(key)
                .map(credential -> credential.isUsable(now))
                .defaultIfEmpty(false);
    }

    /**
     * Re-encrypt with a new value and append to the capped rotation history
     */
    public Mono<CredentialInfo> rotate(String key, String newValue, String reason) {
        requireKey(key);
        Objects.requireNonNull(newValue, "newValue");
        return serialized(() -> repository.findByKey(key)
                .switchIfEmpty(Mono.error(() -> new CredentialNotFoundException(key)))
                .flatMap(credential -> {
                    LocalDateTime now = LocalDateTime.now();
                    List<RotationRecord> history = new ArrayList<>(readHistory(credential));
                    history.add(new RotationRecord(now, reason == null || reason.isBlank() ? "Manual rotation" : reason));
                    if (history.size() > MAX_ROTATION_HISTORY) {
                        history = new ArrayList<>(history.subList(history.size() - MAX_ROTATION_HISTORY, history.size()));
                    }
                    AesCredentialEncryptor.EncryptedSecret secret = encryptor.encrypt(newValue);
                    credential.setEncryptedValue(secret.cipherText());
                    credential.setIv(secret.iv());
                    credential.setRotationHistoryJson(toJson(history));
                    credential.setLastRotatedAt(now);
                    credential.touch();
                    return repository.save(credential);
                }))
                .doOnSuccess(saved -> logger.info("Rotated credential {}", key))
                .map(this::toInfo)
                .onErrorMap(e -> !(e instanceof CredentialNotFoundException) && !(e instanceof CredentialRotationException),
                        e -> new CredentialRotationException(key, e.getMessage(), e));
    }

    /**
     * Hard delete; false when the key does not exist
     */
    public Mono<Boolean> delete(String key) {
        requireKey(key);
        return serialized(() -> repository.deleteByKey(key))
                .map(deleted -> deleted > 0)
                .doOnNext(deleted -> {
                    if (deleted) {
                        logger.info("Deleted credential {}", key);
                    }
                })
                .onErrorMap(e -> new CredentialException(CredentialErrorKind.STORAGE, "Failed to delete credential: " + key, e));
    }

    /**
     * Soft delete: the record stays but {@link #get(String)} no longer serves it
     */
    public Mono<Boolean> disable(String key) {
        requireKey(key);
        return serialized(() -> repository.disable(key, LocalDateTime.now()))
                .map(updated -> updated > 0)
                .doOnNext(disabled -> {
                    if (disabled) {
                        logger.info("Disabled credential {}", key);
                    }
                });
    }

    public Mono<CredentialValidationResult> validate(String key) {
        requireKey(key);
        LocalDateTime now = LocalDateTime.now();
        return repository.findByKey(key)
                .map(credential -> {
                    List<String> issues = new ArrayList<>();
                    if (!Boolean.TRUE.equals(credential.getEnabled())) {
                        issues.add("Credential is disabled");
                    }
                    if (credential.isExpired(now)) {
                        issues.add("Credential expired on " + credential.getExpiresAt());
                    }
                    try {
                        encryptor.decrypt(credential.getEncryptedValue(), credential.getIv());
                    } catch (CredentialException e) {
                        logger.warn("Credential {} failed the decryption check: {}", key, e.getMessage());
                        issues.add("Credential decryption failed");
                    }
                    return issues.isEmpty()
                            ? CredentialValidationResult.success(key)
                            : CredentialValidationResult.failure(key, issues);
                })
                .defaultIfEmpty(CredentialValidationResult.failure(key, List.of("Credential not found: " + key)))
                .onErrorMap(e -> new CredentialException(CredentialErrorKind.VALIDATION, "Failed to validate credential: " + key, e));
    }

    public Flux<String> getCredentialKeys(String source, String group) {
        return repository.findAllOrderByKey()
                .filter(credential -> source == null || source.equals(credential.getSource()))
                .filter(credential -> group == null || group.equals(credential.getGroup()))
                .map(Credential::getKey);
    }

    public Mono<CredentialInfo> getCredentialInfo(String key) {
        requireKey(key);
        return repository.findByKey(key).map(this::toInfo);
    }

    private void recordAccess(String key, LocalDateTime accessedAt) {
        repository.recordAccess(key, accessedAt)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        updated -> logger.debug("Recorded access to credential {}", key),
                        error -> logger.warn("Failed to record access to credential {}: {}", key, error.getMessage()));
    }

    private <T> Mono<T> serialized(Supplier<Mono<T>> mutation) {
        return Mono.fromCallable(() -> {
            mutationLock.lock();
            try {
                return mutation.get().block();
            } finally {
                mutationLock.unlock();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private CredentialInfo toInfo(Credential credential) {
        return CredentialInfo.builder()
                .key(credential.getKey())
                .source(credential.getSource())
                .group(credential.getGroup())
                .metadata(readMetadata(credential))
                .createdAt(credential.getCreatedAt())
                .modifiedAt(credential.getModifiedAt())
                .expiresAt(credential.getExpiresAt())
                .lastAccessedAt(credential.getLastAccessedAt())
                .lastRotatedAt(credential.getLastRotatedAt())
                .accessCount(credential.getAccessCount() == null ? 0 : credential.getAccessCount())
                .enabled(Boolean.TRUE.equals(credential.getEnabled()))
                .expired(credential.isExpired(LocalDateTime.now()))
                .rotationHistory(readHistory(credential))
                .build();
    }

    private List<RotationRecord> readHistory(Credential credential) {
        String json = credential.getRotationHistoryJson();
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(json, HISTORY_TYPE);
        } catch (JsonProcessingException e) {
            logger.warn("Rotation history of credential {} is unreadable, starting a new one: {}", credential.getKey(), e.getMessage());
            return Collections.emptyList();
        }
    }

    private Map<String, String> readMetadata(Credential credential) {
        String json = credential.getMetadataJson();
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new CredentialException(CredentialErrorKind.RETRIEVAL, "Metadata of credential " + credential.getKey() + " is not valid JSON", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CredentialException(CredentialErrorKind.STORAGE, "Cannot serialize credential data", e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Credential key cannot be empty");
        }
    }
}
