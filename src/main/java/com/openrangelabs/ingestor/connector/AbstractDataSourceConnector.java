package com.openrangelabs.ingestor.connector;

import com.openrangelabs.ingestor.exception.ConnectionException;
import com.openrangelabs.ingestor.exception.InvalidExtractionRequestException;
import com.openrangelabs.ingestor.exception.OperationCancelledException;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.ExtractionResult;
import com.openrangelabs.ingestor.extraction.FailureReason;
import com.openrangelabs.ingestor.extraction.RowCollector;
import com.openrangelabs.ingestor.extraction.StructureExtractor;
import com.openrangelabs.ingestor.extraction.StructureQuery;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.TransformationEngine;
import com.openrangelabs.ingestor.transformation.TransformationParameters;
import com.openrangelabs.ingestor.transformation.TransformationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Abstract base class for data source connectors
 * Owns the lifecycle state machine, the per-instance connection lock and listener fan-out,
 * and runs the shared extraction protocol over the subclass's reader
 */
public abstract class AbstractDataSourceConnector implements DataSourceConnector {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final ReentrantLock connectionLock = new ReentrantLock();
    private final List<ConnectorListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private volatile ConnectorConfiguration configuration;
    private volatile String connectionId;
    private volatile Map<String, String> connectionParameters = Collections.emptyMap();
    private volatile boolean closed;

    private ConnectorSettings settings = ConnectorSettings.defaults();
    private TransformationEngine transformationEngine = new TransformationEngine();

    @Autowired(required = false)
    public void setConnectorSettings(ConnectorSettings settings) {
        this.settings = settings;
    }

    @Autowired(required = false)
    public void setTransformationEngine(TransformationEngine transformationEngine) {
        this.transformationEngine = transformationEngine;
    }

    protected ConnectorSettings settings() {
        return settings;
    }

    @Override
    public ConnectionState getConnectionState() {
        return connectionState;
    }

    @Override
    public String getConnectionId() {
        return connectionId;
    }

    public ConnectorConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Parameters of the live session
     */
    protected Map<String, String> connectionParameters() {
        return connectionParameters;
    }

    @Override
    public void addListener(ConnectorListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(ConnectorListener listener) {
        listeners.remove(listener);
    }

    // Lifecycle

    @Override
    public Mono<Boolean> initialize(ConnectorConfiguration configuration) {
        ensureOpen();
        Objects.requireNonNull(configuration, "configuration");
        return Mono.fromCallable(() -> {
            if (!getId().equalsIgnoreCase(configuration.getConnectorId())) {
                logger.warn("Configuration for connector {} handed to connector {}", configuration.getConnectorId(), getId());
                return false;
            }
            ValidationResult validation = validateParameters(configuration.getConnectionParameters());
            if (!validation.isValid()) {
                logger.warn("Configuration for connector {} rejected: {}", getId(), validation.describeErrors());
                return false;
            }
            validation.getWarnings().forEach(warning -> logger.warn("Connector {}: {}", getId(), warning));
            this.configuration = configuration;
            logger.info("Initialized connector {} with {}", getId(), configuration);
            return true;
        });
    }

    @Override
    public Mono<ValidationResult> validateConnection(Map<String, String> connectionParameters) {
        ensureOpen();
        Map<String, String> parameters = copyOf(connectionParameters);
        return Mono.fromSupplier(() -> validateParameters(parameters));
    }

    @Override
    public Mono<ConnectionResult> connect(Map<String, String> connectionParameters, CancellationSignal cancellation) {
        ensureOpen();
        Map<String, String> parameters = effectiveParameters(connectionParameters);
        CancellationSignal signal = cancellation != null ? cancellation : CancellationSignal.none();
        return Mono.fromCallable(() -> connectLocked(parameters, signal))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ConnectionResult connectLocked(Map<String, String> parameters, CancellationSignal cancellation) {
        connectionLock.lock();
        try {
            if (connectionState == ConnectionState.CONNECTED) {
                logger.debug("Connector {} already connected ({})", getId(), connectionId);
                return ConnectionResult.alreadyConnected(connectionId);
            }
            ValidationResult validation = validateParameters(parameters);
            if (!validation.isValid()) {
                logger.warn("Connection parameters for {} are invalid: {}", getId(), validation.describeErrors());
                return ConnectionResult.invalid(validation);
            }
            CancellationSignal linked = cancellation.withTimeout(settings.getConnectTimeout());
            if (linked.isCancellationRequested()) {
                return ConnectionResult.cancelled(linked.reason());
            }

            transition(ConnectionState.CONNECTING);
            try {
                ConnectionResult result = openSession(parameters, linked);
                if (result.isSuccess() && linked.isCancellationRequested()) {
                    closeSessionQuietly();
                    transition(ConnectionState.ERROR);
                    return ConnectionResult.cancelled(linked.reason());
                }
                if (result.isSuccess()) {
                    this.connectionId = result.getConnectionId();
                    this.connectionParameters = parameters;
                    transition(ConnectionState.CONNECTED);
                    logger.info("Connector {} connected ({}, server {})", getId(), connectionId, result.getServerVersion());
                } else {
                    transition(ConnectionState.ERROR);
                    notifyError("connect", result.getMessage(), null);
                }
                return result;
            } catch (Exception e) {
                Throwable cause = Exceptions.unwrap(e);
                transition(ConnectionState.ERROR);
                CancellationSignal.Reason reason = linked.reason();
                if (reason != CancellationSignal.Reason.NONE || cause instanceof TimeoutException) {
                    CancellationSignal.Reason effective = reason != CancellationSignal.Reason.NONE ? reason : CancellationSignal.Reason.TIMEOUT;
                    logger.warn("Connection attempt for {} stopped: {}", getId(), effective);
                    return ConnectionResult.cancelled(effective);
                }
                logger.error("Connection failed for connector {}: {}", getId(), cause.getMessage(), cause);
                notifyError("connect", cause.getMessage(), cause);
                return ConnectionResult.failure("Connection failed: " + cause.getMessage());
            }
        } finally {
            connectionLock.unlock();
        }
    }

    @Override
    public Mono<Boolean> testConnection(Map<String, String> connectionParameters) {
        ensureOpen();
        Map<String, String> parameters = effectiveParameters(connectionParameters);
        return Mono.fromCallable(() -> {
                    ValidationResult validation = validateParameters(parameters);
                    if (!validation.isValid()) {
                        logger.warn("Connection test for {} skipped, parameters invalid: {}", getId(), validation.describeErrors());
                        return false;
                    }
                    return checkReachable(parameters, CancellationSignal.none().withTimeout(settings.getConnectTimeout()));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    logger.warn("Connection test failed for connector {}: {}", getId(), Exceptions.unwrap(e).getMessage());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<Boolean> disconnect(CancellationSignal cancellation) {
        ensureOpen();
        return Mono.fromCallable(this::disconnectLocked)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private boolean disconnectLocked() {
        connectionLock.lock();
        try {
            if (connectionState == ConnectionState.DISCONNECTED) {
                return true;
            }
            if (connectionState == ConnectionState.ERROR) {
                // no session to hand back; a fresh connect leaves ERROR
                closeSessionQuietly();
                connectionId = null;
                return true;
            }
            transition(ConnectionState.DISCONNECTING);
            try {
                closeSession();
                connectionId = null;
                connectionParameters = Collections.emptyMap();
                transition(ConnectionState.DISCONNECTED);
                logger.info("Connector {} disconnected", getId());
                return true;
            } catch (Exception e) {
                transition(ConnectionState.ERROR);
                logger.error("Disconnect failed for connector {}: {}", getId(), e.getMessage(), e);
                notifyError("disconnect", e.getMessage(), e);
                return false;
            }
        } finally {
            connectionLock.unlock();
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        try {
            disconnectLocked();
        } catch (RuntimeException e) {
            logger.warn("Connector {} did not disconnect cleanly on close: {}", getId(), e.getMessage());
        } finally {
            closed = true;
            listeners.clear();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // Discovery and extraction

    @Override
    public Mono<List<DataStructureInfo>> discoverDataStructures(Map<String, String> filter) {
        ensureOpen();
        if (connectionState != ConnectionState.CONNECTED) {
            return Mono.error(new ConnectionException(getId(), "Connector " + getId() + " is not connected"));
        }
        return Mono.defer(() -> doDiscover(copyOf(filter)))
                .doOnError(e -> notifyError("discover", e.getMessage(), e));
    }

    @Override
    public Mono<ExtractionResult> extractData(ExtractionParameters parameters, CancellationSignal cancellation) {
        ensureOpen();
        Objects.requireNonNull(parameters, "parameters");
        if (connectionState != ConnectionState.CONNECTED) {
            return Mono.error(new ConnectionException(getId(), "Connector " + getId() + " is not connected"));
        }
        CancellationSignal signal = (cancellation != null ? cancellation : CancellationSignal.none())
                .withTimeout(settings.getCommandTimeout());
        long start = System.nanoTime();

        return Mono.defer(() -> doExtract(parameters, signal))
                .onErrorResume(InvalidExtractionRequestException.class, e -> {
                    logger.warn("Extraction request for {} rejected: {}", getId(), e.getMessage());
                    return Mono.just(ExtractionResult.failure(FailureReason.INVALID_REQUEST, e.getMessage()).build());
                })
                .onErrorResume(OperationCancelledException.class, e -> Mono.just(
                        ExtractionResult.failure(failureReasonOf(e.getReason()), e.getMessage())
                                .processedCount(e.getProcessedCount())
                                .build()))
                .onErrorResume(e -> {
                    Throwable cause = Exceptions.unwrap(e);
                    if (cause instanceof TimeoutException) {
                        return Mono.just(ExtractionResult.failure(FailureReason.TIMEOUT, "Extraction timed out").build());
                    }
                    logger.error("Extraction failed for connector {}: {}", getId(), cause.getMessage(), cause);
                    notifyError("extract", cause.getMessage(), cause);
                    return Mono.just(ExtractionResult.failure(FailureReason.ERROR, cause.getMessage()).build());
                })
                .map(result -> result.withExecutionTime(Duration.ofNanos(System.nanoTime() - start).toMillis()))
                .doOnNext(result -> logger.debug("Connector {} extraction finished: {}", getId(), result));
    }

    @Override
    public Mono<TransformationResult> transformData(List<DataRow> rows, TransformationParameters parameters,
                                                    CancellationSignal cancellation) {
        ensureOpen();
        return Mono.fromCallable(() -> transformationEngine.transform(rows, parameters, cancellation))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Default extraction: resolve the targets, then run the shared full/incremental protocol
     * over {@link #read(StructureQuery)}.
     */
    protected Mono<ExtractionResult> doExtract(ExtractionParameters parameters, CancellationSignal signal) {
        return resolveTargets(parameters)
                .flatMap(targets -> new StructureExtractor(this::read, operation -> rowCollector(operation, signal),
                        this::defaultTrackingField).extract(parameters, targets));
    }

    protected RowCollector rowCollector(String operation, CancellationSignal signal) {
        return RowCollector.forOperation(getId(), operation, signal)
                .progressInterval(progressInterval())
                .onProgress(this::notifyProgress);
    }

    protected int progressInterval() {
        return settings.getProgressInterval();
    }

    /**
     * Tracking field used for incremental extraction when the request names none.
     */
    protected String defaultTrackingField(DataStructureInfo structure) {
        return null;
    }

    // Template methods

    protected abstract ValidationResult validateParameters(Map<String, String> parameters);

    /**
     * Build the backend session. Called under the connection lock.
     */
    protected abstract ConnectionResult openSession(Map<String, String> parameters, CancellationSignal signal) throws Exception;

    /**
     * Release the backend session. Called under the connection lock.
     */
    protected abstract void closeSession() throws Exception;

    /**
     * Open and close a throwaway session without touching instance state.
     */
    protected abstract boolean checkReachable(Map<String, String> parameters, CancellationSignal signal) throws Exception;

    protected abstract Mono<List<DataStructureInfo>> doDiscover(Map<String, String> filter);

    /**
     * Structures named by the request; {@code "*"} or an empty list means every discoverable structure.
     */
    protected abstract Mono<List<DataStructureInfo>> resolveTargets(ExtractionParameters parameters);

    protected abstract Flux<DataRow> read(StructureQuery query);

    // Helpers

    protected void transition(ConnectionState target) {
        ConnectionState previous = connectionState;
        if (!previous.canTransitionTo(target)) {
            throw new IllegalStateException(String.format("Connector %s cannot move from %s to %s", getId(), previous, target));
        }
        connectionState = target;
        for (ConnectorListener listener : listeners) {
            try {
                listener.onStateChanged(getId(), previous, target);
            } catch (RuntimeException e) {
                logger.warn("State listener failed for connector {}: {}", getId(), e.getMessage());
            }
        }
    }

    protected void notifyProgress(ProgressUpdate progress) {
        logger.debug("Connector {} progress {}: {}/{}", getId(), progress.operation(), progress.current(), progress.total());
        for (ConnectorListener listener : listeners) {
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                logger.warn("Progress listener failed for connector {}: {}", getId(), e.getMessage());
            }
        }
    }

    protected void notifyError(String operation, String message, Throwable error) {
        for (ConnectorListener listener : listeners) {
            try {
                listener.onError(getId(), operation, message, error);
            } catch (RuntimeException e) {
                logger.warn("Error listener failed for connector {}: {}", getId(), e.getMessage());
            }
        }
    }

    protected void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connector " + getId() + " has been closed");
        }
    }

    protected static String newConnectionId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    protected static FailureReason failureReasonOf(CancellationSignal.Reason reason) {
        return reason == CancellationSignal.Reason.TIMEOUT ? FailureReason.TIMEOUT : FailureReason.CANCELLED;
    }

    protected static String text(Map<String, String> parameters, String name) {
        String value = parameters.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    protected static boolean flag(Map<String, String> parameters, String name, boolean defaultValue) {
        String value = text(parameters, name);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    /**
     * Parses an integer parameter, recording an error when it is not a number or out of range.
     */
    protected static Integer integer(Map<String, String> parameters, String name, int min, int max, ValidationResult result) {
        String value = text(parameters, name);
        if (value == null) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < min || parsed > max) {
                result.addError(name, String.format("%s must be between %d and %d", name, min, max));
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            result.addError(name, name + " must be a number");
            return null;
        }
    }

    private Map<String, String> effectiveParameters(Map<String, String> supplied) {
        Map<String, String> merged = new HashMap<>();
        if (configuration != null) {
            merged.putAll(configuration.getConnectionParameters());
        }
        if (supplied != null) {
            merged.putAll(supplied);
        }
        return Collections.unmodifiableMap(merged);
    }

    private static Map<String, String> copyOf(Map<String, String> parameters) {
        return parameters == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(parameters));
    }

    private void closeSessionQuietly() {
        try {
            closeSession();
        } catch (Exception e) {
            logger.warn("Releasing session of connector {} failed: {}", getId(), e.getMessage());
        }
    }
}
