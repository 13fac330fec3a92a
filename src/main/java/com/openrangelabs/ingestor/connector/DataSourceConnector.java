package com.openrangelabs.ingestor.connector;

import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.ExtractionResult;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.TransformationParameters;
import com.openrangelabs.ingestor.transformation.TransformationResult;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Base interface for all data source connectors
 * Provides a unified connect/extract/transform API over different backends
 */
public interface DataSourceConnector extends AutoCloseable {

    /**
     * Static self-description read by the registry
     */
    ConnectorMetadata describeMetadata();

    /**
     * Connection parameters this connector understands
     */
    List<ConnectionParameter> describeParameters();

    ConnectorCapabilities getCapabilities();

    default String getId() {
        return describeMetadata().getId();
    }

    default String getName() {
        return describeMetadata().getName();
    }

    default String getSourceType() {
        return describeMetadata().getSourceType();
    }

    default String getVersion() {
        return describeMetadata().getVersion();
    }

    ConnectionState getConnectionState();

    /**
     * Identifier of the current session, null when not connected
     */
    String getConnectionId();

    void addListener(ConnectorListener listener);

    void removeListener(ConnectorListener listener);

    /**
     * Store configuration and validate its parameters; never connects
     */
    Mono<Boolean> initialize(ConnectorConfiguration configuration);

    /**
     * Validate connection parameters without touching the backend
     */
    Mono<ValidationResult> validateConnection(Map<String, String> connectionParameters);

    /**
     * Open a session. Serialized per instance
     */
    Mono<ConnectionResult> connect(Map<String, String> connectionParameters, CancellationSignal cancellation);

    /**
     * Open and immediately close a throwaway session
     */
    Mono<Boolean> testConnection(Map<String, String> connectionParameters);

    /**
     * Close the session. Returns true when already disconnected
     */
    Mono<Boolean> disconnect(CancellationSignal cancellation);

    /**
     * List the structures available on the connected backend
     */
    Mono<List<DataStructureInfo>> discoverDataStructures(Map<String, String> filter);

    Mono<ExtractionResult> extractData(ExtractionParameters parameters, CancellationSignal cancellation);

    Mono<TransformationResult> transformData(List<DataRow> rows, TransformationParameters parameters,
                                             CancellationSignal cancellation);

    /**
     * Disconnect if needed and release resources. Further calls fail.
     */
    @Override
    void close();
}
