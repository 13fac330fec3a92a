package com.openrangelabs.ingestor.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Entity describing where a job reads from
 *
 * <p>{@code secretParametersJson} maps connection parameter names to credential keys; the
 * values are resolved through the credential store at execution time and never stored here.
 */
@Table("data_sources")
public class DataSource {

    @Id
    private UUID id;

    @Column("tenant_id")
    private UUID tenantId;

    private String name;

    @Column("source_type")
    private String sourceType;

    @Column("connection_parameters")
    private String connectionParametersJson;

    @Column("secret_parameters")
    private String secretParametersJson;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column("updated_at")
    private LocalDateTime updatedAt = LocalDateTime.now();

    public DataSource() {}

    public DataSource(UUID tenantId, String name, String sourceType) {
        this.tenantId = tenantId;
        this.name = name;
        this.sourceType = sourceType;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getTenantId() { return tenantId; }
    public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSourceType() { return sourceType; }
    public void setSourceType(String sourceType) { this.sourceType = sourceType; }

    public String getConnectionParametersJson() { return connectionParametersJson; }
    public void setConnectionParametersJson(String connectionParametersJson) { this.connectionParametersJson = connectionParametersJson; }

    public String getSecretParametersJson() { return secretParametersJson; }
    public void setSecretParametersJson(String secretParametersJson) { this.secretParametersJson = secretParametersJson; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataSource that = (DataSource) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DataSource{" +
                "id=" + id +
                ", tenantId=" + tenantId +
                ", name='" + name + '\'' +
                ", sourceType='" + sourceType + '\'' +
                '}';
    }
}
