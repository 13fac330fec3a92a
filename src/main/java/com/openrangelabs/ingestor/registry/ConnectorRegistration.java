package com.openrangelabs.ingestor.registry;

import com.openrangelabs.ingestor.connector.DataSourceConnector;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Immutable registry entry describing one connector implementation
 */
@Value
public class ConnectorRegistration {

    String id;
    String name;
    String sourceType;
    String description;
    String version;
    List<String> sourceTypeAliases;
    Class<? extends DataSourceConnector> connectorType;
    Instant registeredAt;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Supplier<? extends DataSourceConnector> supplier;

    /**
     * Fresh, unconnected instance of this connector.
     */
    public DataSourceConnector newInstance() {
        return supplier.get();
    }

    /**
     * True when the source type or one of its aliases matches, ignoring case.
     */
    public boolean servesSourceType(String candidate) {
        if (candidate == null) {
            return false;
        }
        String normalized = candidate.toLowerCase(Locale.ROOT);
        return sourceType.toLowerCase(Locale.ROOT).equals(normalized)
                || sourceTypeAliases.stream().anyMatch(alias -> alias.toLowerCase(Locale.ROOT).equals(normalized));
    }
}
