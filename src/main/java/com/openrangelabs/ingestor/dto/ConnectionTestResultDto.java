package com.openrangelabs.ingestor.dto;

import com.openrangelabs.ingestor.connector.ValidationError;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Outcome of a connection test")
public class ConnectionTestResultDto {

    String connectorId;
    boolean valid;
    boolean connected;

    @Singular
    List<ValidationError> errors;

    @Singular
    List<String> warnings;
}
