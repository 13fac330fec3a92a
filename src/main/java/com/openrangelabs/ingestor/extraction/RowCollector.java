package com.openrangelabs.ingestor.extraction;

import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.ProgressUpdate;
import com.openrangelabs.ingestor.exception.OperationCancelledException;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Drains a row stream into memory batch by batch.
 *
 * <p>Rows are made transport-safe, the cancellation signal is polled before every batch is
 * accepted, progress is reported every {@code progressInterval} rows and the maximum of the
 * tracking field is kept. A cancelled drain keeps no rows, only the count accepted so far.
 */
public class RowCollector {

    /**
     * Drained rows plus the bookkeeping the caller needs to build a result.
     */
    public record Collected(List<DataRow> rows, long processedCount, FieldValue maxTrackingValue,
                            CancellationSignal.Reason cancellation) {

        public boolean isCancelled() {
            return cancellation != CancellationSignal.Reason.NONE;
        }

        public FailureReason failureReason() {
            return cancellation == CancellationSignal.Reason.TIMEOUT ? FailureReason.TIMEOUT : FailureReason.CANCELLED;
        }
    }

    private final String connectorId;
    private final String operation;
    private final CancellationSignal signal;
    private int batchSize = 500;
    private int progressInterval = 100;
    private long expectedTotal = -1;
    private String trackingField;
    private List<String> includeFields = List.of();
    private Consumer<ProgressUpdate> progressConsumer = progress -> { };

    private RowCollector(String connectorId, String operation, CancellationSignal signal) {
        this.connectorId = connectorId;
        this.operation = operation;
        this.signal = signal != null ? signal : CancellationSignal.none();
    }

    public static RowCollector forOperation(String connectorId, String operation, CancellationSignal signal) {
        return new RowCollector(connectorId, operation, signal);
    }

    public RowCollector batchSize(int batchSize) {
        this.batchSize = Math.max(1, batchSize);
        return this;
    }

    public RowCollector progressInterval(int progressInterval) {
        this.progressInterval = Math.max(1, progressInterval);
        return this;
    }

    public RowCollector expectedTotal(long expectedTotal) {
        this.expectedTotal = expectedTotal;
        return this;
    }

    public RowCollector trackingField(String trackingField) {
        this.trackingField = trackingField;
        return this;
    }

    /**
     * Projection applied after the tracking value is read, so the tracking field may be left out.
     */
    public RowCollector includeFields(List<String> includeFields) {
        this.includeFields = includeFields == null ? List.of() : includeFields;
        return this;
    }

    public RowCollector onProgress(Consumer<ProgressUpdate> progressConsumer) {
        this.progressConsumer = progressConsumer;
        return this;
    }

    public Mono<Collected> collect(Flux<DataRow> source) {
        return Mono.defer(() -> {
            List<DataRow> rows = new ArrayList<>();
            AtomicLong processed = new AtomicLong();
            AtomicReference<FieldValue> max = new AtomicReference<>(FieldValue.ofNull());

            signal.throwIfCancellationRequested(0);
            return source
                    .map(DataRow::toTransportSafe)
                    .buffer(batchSize)
                    .concatMap(batch -> {
                        signal.throwIfCancellationRequested(processed.get());
                        accept(batch, rows, processed, max);
                        return Mono.just(batch.size());
                    })
                    .then(Mono.fromCallable(() -> new Collected(rows, processed.get(), max.get(), CancellationSignal.Reason.NONE)));
        }).onErrorResume(OperationCancelledException.class, e -> Mono.just(
                new Collected(List.of(), e.getProcessedCount(), FieldValue.ofNull(), e.getReason())));
    }

    private void accept(List<DataRow> batch, List<DataRow> rows, AtomicLong processed, AtomicReference<FieldValue> max) {
        for (DataRow row : batch) {
            if (trackingField != null) {
                max.set(TrackingValueComparator.INSTANCE.max(max.get(), row.get(trackingField)));
            }
            rows.add(RowPredicates.project(row, includeFields));
            long count = processed.incrementAndGet();
            if (count % progressInterval == 0) {
                progressConsumer.accept(new ProgressUpdate(connectorId, operation, count, expectedTotal,
                        String.format("Extracted %d records", count)));
            }
        }
    }
}
