package com.openrangelabs.ingestor.connector;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Static self-description of a connector implementation.
 *
 * <p>Returned by {@link DataSourceConnector#describeMetadata()} and read by the registry
 * when the implementation is registered. {@code id}, {@code name} and {@code sourceType}
 * are mandatory.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Value
@Builder
public class ConnectorMetadata {

    String id;
    String name;
    String sourceType;
    String description;

    @Builder.Default
    String version = "1.0.0";

    @Builder.Default
    String author = "OpenRange Labs";

    String documentationUrl;

    @Singular
    List<String> capabilities;

    @Singular
    List<String> categories;

    public boolean isComplete() {
        return hasText(id) && hasText(name) && hasText(sourceType);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
