package com.openrangelabs.ingestor.connector;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Capability descriptor advertised by a connector
 */
@Value
@Builder
public class ConnectorCapabilities {

    @Builder.Default
    boolean supportsIncremental = false;

    @Builder.Default
    boolean supportsSchemaDiscovery = true;

    @Builder.Default
    boolean supportsAdvancedFiltering = false;

    @Builder.Default
    boolean supportsPreview = false;

    @Builder.Default
    boolean supportsResume = false;

    @Builder.Default
    boolean supportsScheduling = true;

    @Builder.Default
    boolean supportsTransformation = true;

    @Builder.Default
    boolean supportsProgressReporting = true;

    /**
     * Backend exposes a native change feed usable without a tracking column.
     */
    @Builder.Default
    boolean supportsNativeChangeTracking = false;

    @Builder.Default
    int maxConcurrentExtractions = 1;

    @Singular
    List<String> authenticationModes;

    @Singular
    List<String> supportedSourceTypes;

    public List<String> getAuthenticationModes() {
        return authenticationModes.isEmpty() ? List.of("basic") : authenticationModes;
    }

    public List<String> getSupportedSourceTypes() {
        return supportedSourceTypes.isEmpty() ? List.of("generic") : supportedSourceTypes;
    }
}
