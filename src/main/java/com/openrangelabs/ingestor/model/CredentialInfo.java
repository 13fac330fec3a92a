package com.openrangelabs.ingestor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything known about a credential except its value
 */
@Value
@Builder
@Schema(description = "Credential metadata; the secret value is never included")
public class CredentialInfo {

    @Schema(description = "Unique credential key", example = "crm-db.password")
    String key;

    String source;
    String group;
    Map<String, String> metadata;
    LocalDateTime createdAt;
    LocalDateTime modifiedAt;
    LocalDateTime expiresAt;
    LocalDateTime lastAccessedAt;
    LocalDateTime lastRotatedAt;
    long accessCount;
    boolean enabled;
    boolean expired;

    @Singular("rotation")
    List<RotationRecord> rotationHistory;
}
