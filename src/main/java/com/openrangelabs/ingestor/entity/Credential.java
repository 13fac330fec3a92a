package com.openrangelabs.ingestor.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Entity representing an encrypted secret stored under a unique key
 * The value is AES encrypted with a fresh IV per write; metadata and rotation history are JSON text
 */
@Table("credentials")
public class Credential {

    @Id
    private UUID id;

    @Column("credential_key")
    private String key;

    @Column("encrypted_value")
    private String encryptedValue;

    @Column("iv")
    private String iv;

    private String source;

    @Column("credential_group")
    private String group;

    @Column("metadata")
    private String metadataJson;

    @Column("expires_at")
    private LocalDateTime expiresAt;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column("modified_at")
    private LocalDateTime modifiedAt = LocalDateTime.now();

    @Column("last_accessed_at")
    private LocalDateTime lastAccessedAt;

    @Column("access_count")
    private Long accessCount = 0L;

    @Column("last_rotated_at")
    private LocalDateTime lastRotatedAt;

    @Column("rotation_history")
    private String rotationHistoryJson = "[]";

    @Column("is_enabled")
    private Boolean enabled = true;

    public Credential() {}

    public Credential(String key, String encryptedValue, String iv) {
        this.key = key;
        this.encryptedValue = encryptedValue;
        this.iv = iv;
    }

    // Business methods
    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isUsable(LocalDateTime now) {
        return Boolean.TRUE.equals(enabled) && !isExpired(now);
    }

    public void touch() {
        this.modifiedAt = LocalDateTime.now();
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getEncryptedValue() { return encryptedValue; }
    public void setEncryptedValue(String encryptedValue) { this.encryptedValue = encryptedValue; }

    public String getIv() { return iv; }
    public void setIv(String iv) { this.iv = iv; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }

    public String getMetadataJson() { return metadataJson; }
    public void setMetadataJson(String metadataJson) { this.metadataJson = metadataJson; }

    public LocalDateTime getExpiresAt() { return expiresAt; }
    public void setExpiresAt(LocalDateTime expiresAt) { this.expiresAt = expiresAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getModifiedAt() { return modifiedAt; }
    public void setModifiedAt(LocalDateTime modifiedAt) { this.modifiedAt = modifiedAt; }

    public LocalDateTime getLastAccessedAt() { return lastAccessedAt; }
    public void setLastAccessedAt(LocalDateTime lastAccessedAt) { this.lastAccessedAt = lastAccessedAt; }

    public Long getAccessCount() { return accessCount; }
    public void setAccessCount(Long accessCount) { this.accessCount = accessCount; }

    public LocalDateTime getLastRotatedAt() { return lastRotatedAt; }
    public void setLastRotatedAt(LocalDateTime lastRotatedAt) { this.lastRotatedAt = lastRotatedAt; }

    public String getRotationHistoryJson() { return rotationHistoryJson; }
    public void setRotationHistoryJson(String rotationHistoryJson) { this.rotationHistoryJson = rotationHistoryJson; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Credential that = (Credential) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Credential{" +
                "id=" + id +
                ", key='" + key + '\'' +
                ", source='" + source + '\'' +
                ", group='" + group + '\'' +
                ", expiresAt=" + expiresAt +
                ", enabled=" + enabled +
                ", accessCount=" + accessCount +
                '}';
    }
}
