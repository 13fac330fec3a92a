package com.openrangelabs.ingestor.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Request DTO for storing an encrypted credential.
 *
 * <p><strong>Security Note:</strong> The 'value' field contains sensitive data and is never
 * echoed back or logged.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for storing an encrypted credential")
public class StoreCredentialRequest {

    @NotBlank(message = "Credential key is required")
    @Pattern(regexp = "^[A-Za-z0-9._:-]{1,200}$",
            message = "Credential key may only contain letters, digits, '.', '_', ':' and '-'")
    @Schema(description = "Unique credential key", example = "crm-db.password", required = true)
    private String key;

    @NotBlank(message = "Credential value is required")
    @Size(max = 4096, message = "Credential value cannot exceed 4096 characters")
    @Schema(description = "The credential value (will be encrypted)", required = true)
    private String value;

    @Size(max = 100, message = "Source cannot exceed 100 characters")
    @Schema(description = "System the credential belongs to", example = "postgresql")
    private String source;

    @Size(max = 100, message = "Group cannot exceed 100 characters")
    @Schema(description = "Free-form grouping", example = "crm")
    private String group;

    private Map<String, String> metadata;

    @Schema(description = "Optional expiration date for the credential", example = "2026-12-31T23:59:59")
    private LocalDateTime expiresAt;
}
