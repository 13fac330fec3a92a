package com.openrangelabs.ingestor.dto;

import com.openrangelabs.ingestor.registry.ConnectorRegistration;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "Registered connector implementation")
public class ConnectorSummaryDto {

    @Schema(description = "Connector id", example = "postgresql-connector")
    String id;

    String name;
    String sourceType;
    List<String> sourceTypeAliases;
    String description;
    String version;
    Instant registeredAt;

    public static ConnectorSummaryDto fromRegistration(ConnectorRegistration registration) {
        return ConnectorSummaryDto.builder()
                .id(registration.getId())
                .name(registration.getName())
                .sourceType(registration.getSourceType())
                .sourceTypeAliases(registration.getSourceTypeAliases())
                .description(registration.getDescription())
                .version(registration.getVersion())
                .registeredAt(registration.getRegisteredAt())
                .build();
    }
}
