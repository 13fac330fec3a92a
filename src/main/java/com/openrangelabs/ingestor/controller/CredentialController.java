package com.openrangelabs.ingestor.controller;

import com.openrangelabs.ingestor.dto.RotateCredentialRequest;
import com.openrangelabs.ingestor.dto.StoreCredentialRequest;
import com.openrangelabs.ingestor.exception.CredentialNotFoundException;
import com.openrangelabs.ingestor.model.CredentialInfo;
import com.openrangelabs.ingestor.model.CredentialValidationResult;
import com.openrangelabs.ingestor.service.CredentialStoreService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST controller for the credential store.
 *
 * <p><strong>Security Note:</strong> All endpoints require ADMIN role. Credential values
 * are accepted but never returned.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@Validated
@RestController
@RequestMapping(value = "/api/credentials", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Credential Management", description = "Encrypted credential storage and rotation")
@SecurityRequirement(name = "bearerAuth")
public class CredentialController {

    private final CredentialStoreService credentialStore;

    /**
     * Stores a credential, replacing the value if the key already exists.
     *
     * @param request the key, value and optional metadata
     * @return credential metadata (never the value)
     */
    @Operation(summary = "Store encrypted credential", description = "Upsert by key; values are never returned")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Credential stored",
                    content = @Content(schema = @Schema(implementation = CredentialInfo.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request data"),
            @ApiResponse(responseCode = "403", description = "Admin role required")
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CredentialInfo>> storeCredential(@Valid @RequestBody StoreCredentialRequest request) {
        log.info("Storing credential {}", request.getKey());
        return credentialStore.store(request.getKey(), request.getValue(), request.getSource(), request.getGroup(),
                        request.getMetadata(), request.getExpiresAt())
                .map(info -> ResponseEntity.status(HttpStatus.CREATED).body(info));
    }

    @Operation(summary = "List credential keys", description = "Optionally filtered by source and group")
    @GetMapping
    public Flux<String> getCredentialKeys(@RequestParam(required = false) String source,
                                          @RequestParam(required = false) String group) {
        return credentialStore.getCredentialKeys(source, group);
    }

    @Operation(summary = "Get credential metadata")
    @ApiResponse(responseCode = "404", description = "Credential not found")
    @GetMapping("/{key}")
    public Mono<CredentialInfo> getCredentialInfo(@PathVariable String key) {
        return credentialStore.getCredentialInfo(key)
                .switchIfEmpty(Mono.error(new CredentialNotFoundException(key)));
    }

    @Operation(summary = "Rotate credential value", description = "Re-encrypts and appends to the rotation history")
    @ApiResponse(responseCode = "404", description = "Credential not found")
    @PostMapping(value = "/{key}/rotate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CredentialInfo> rotateCredential(@PathVariable String key,
                                                 @Valid @RequestBody RotateCredentialRequest request) {
        log.info("Rotating credential {}", key);
        return credentialStore.rotate(key, request.getValue(), request.getReason());
    }

    @Operation(summary = "Validate a credential", description = "Checks enabled flag, expiry and decryptability")
    @GetMapping("/{key}/validate")
    public Mono<CredentialValidationResult> validateCredential(@PathVariable String key) {
        return credentialStore.validate(key);
    }

    @Operation(summary = "Disable a credential")
    @PostMapping("/{key}/disable")
    public Mono<ResponseEntity<Void>> disableCredential(@PathVariable String key) {
        return credentialStore.disable(key)
                .flatMap(disabled -> disabled
                        ? Mono.just(ResponseEntity.noContent().<Void>build())
                        : Mono.error(new CredentialNotFoundException(key)));
    }

    @Operation(summary = "Delete a credential")
    @DeleteMapping("/{key}")
    public Mono<ResponseEntity<Void>> deleteCredential(@PathVariable String key) {
        log.info("Deleting credential {}", key);
        return credentialStore.delete(key)
                .flatMap(deleted -> deleted
                        ? Mono.just(ResponseEntity.noContent().<Void>build())
                        : Mono.error(new CredentialNotFoundException(key)));
    }
}
