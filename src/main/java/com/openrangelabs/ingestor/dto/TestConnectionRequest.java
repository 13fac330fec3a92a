package com.openrangelabs.ingestor.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Connection parameters to validate and try against a connector")
public class TestConnectionRequest {

    @NotNull(message = "Connection parameters are required")
    private Map<String, String> parameters;
}
