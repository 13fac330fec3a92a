package com.openrangelabs.ingestor.controller;

import com.openrangelabs.ingestor.dto.ConnectionTestResultDto;
import com.openrangelabs.ingestor.dto.ConnectorDetailsDto;
import com.openrangelabs.ingestor.dto.ConnectorSummaryDto;
import com.openrangelabs.ingestor.dto.TestConnectionRequest;
import com.openrangelabs.ingestor.connector.DataSourceConnector;
import com.openrangelabs.ingestor.registry.ConnectorFactory;
import com.openrangelabs.ingestor.registry.ConnectorRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST controller exposing the connector registry.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@Validated
@RestController
@RequestMapping(value = "/api/connectors", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Connectors", description = "Registered connector implementations")
@SecurityRequirement(name = "bearerAuth")
public class ConnectorController {

    private final ConnectorRegistry registry;
    private final ConnectorFactory factory;

    @Operation(summary = "List registered connectors")
    @GetMapping
    public Flux<ConnectorSummaryDto> getConnectors(@RequestParam(required = false) String sourceType) {
        return Flux.fromIterable(sourceType == null ? registry.getAll() : registry.getBySourceType(sourceType))
                .map(ConnectorSummaryDto::fromRegistration);
    }

    @Operation(summary = "Describe a connector", description = "Metadata, capabilities and connection parameters")
    @ApiResponse(responseCode = "404", description = "Connector not found")
    @GetMapping("/{connectorId}")
    public Mono<ConnectorDetailsDto> getConnector(@PathVariable String connectorId) {
        return Mono.using(() -> factory.create(connectorId), connector -> Mono.just(ConnectorDetailsDto.describe(connector)),
                DataSourceConnector::close);
    }

    /**
     * Validates the supplied parameters and, when they pass, opens and closes a connection.
     */
    @Operation(summary = "Test connection parameters against a connector")
    @ApiResponse(responseCode = "404", description = "Connector not found")
    @PostMapping(value = "/{connectorId}/test", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ConnectionTestResultDto> testConnection(@PathVariable String connectorId,
                                                       @Valid @RequestBody TestConnectionRequest request) {
        log.info("Testing connection for connector {}", connectorId);
        return Mono.using(() -> factory.create(connectorId),
                connector -> connector.validateConnection(request.getParameters())
                        .flatMap(validation -> {
                            ConnectionTestResultDto.ConnectionTestResultDtoBuilder result = ConnectionTestResultDto.builder()
                                    .connectorId(connectorId)
                                    .valid(validation.isValid())
                                    .errors(validation.getErrors())
                                    .warnings(validation.getWarnings());
                            if (!validation.isValid()) {
                                return Mono.just(result.connected(false).build());
                            }
                            return connector.testConnection(request.getParameters())
                                    .map(connected -> result.connected(connected).build());
                        }),
                DataSourceConnector::close);
    }
}
