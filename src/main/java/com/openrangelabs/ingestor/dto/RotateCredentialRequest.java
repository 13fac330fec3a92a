package com.openrangelabs.ingestor.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for rotating a credential value")
public class RotateCredentialRequest {

    @NotBlank(message = "New credential value is required")
    @Size(max = 4096, message = "Credential value cannot exceed 4096 characters")
    private String value;

    @Size(max = 500, message = "Reason cannot exceed 500 characters")
    @Schema(description = "Why the value changed", example = "Quarterly rotation")
    private String reason;
}
