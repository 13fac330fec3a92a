package com.openrangelabs.ingestor.extraction;

import com.openrangelabs.ingestor.connector.DataStructureInfo;
import com.openrangelabs.ingestor.connector.FieldInfo;
import com.openrangelabs.ingestor.exception.ExtractionException;
import com.openrangelabs.ingestor.exception.InvalidExtractionRequestException;
import com.openrangelabs.ingestor.model.DataRow;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Full and incremental extraction over any source that can answer a {@link StructureQuery}.
 *
 * <p>Full extraction orders by primary key and pages with {@code target|offset} tokens.
 * Incremental extraction reads rows past the cursor in tracking-field order and hands back a
 * {@code target|field|max} token. Either way {@code hasMoreRecords} is {@code returned == limit}.
 */
public class StructureExtractor {

    private static final int MAX_FLUSH_BATCH = 500;

    private final Function<StructureQuery, Flux<DataRow>> reader;
    private final Function<String, RowCollector> collectors;
    private final Function<DataStructureInfo, String> defaultTrackingField;

    /**
     * @param reader               answers a query against the backend
     * @param collectors           creates a collector for an operation name, wired to the connector's progress
     * @param defaultTrackingField tracking field used when the request names none; may return null
     */
    public StructureExtractor(Function<StructureQuery, Flux<DataRow>> reader,
                              Function<String, RowCollector> collectors,
                              Function<DataStructureInfo, String> defaultTrackingField) {
        this.reader = reader;
        this.collectors = collectors;
        this.defaultTrackingField = defaultTrackingField;
    }

    public Mono<ExtractionResult> extract(ExtractionParameters parameters, List<DataStructureInfo> targets) {
        return Mono.defer(() -> {
            if (targets.isEmpty()) {
                return Mono.just(ExtractionResult.success().build());
            }
            if (parameters.isIncrementalExtraction()) {
                if (targets.size() != 1) {
                    return Mono.error(new InvalidExtractionRequestException(String.format(
                            "Incremental extraction addresses exactly one target structure, got %d", targets.size())));
                }
                return incremental(parameters, targets.get(0));
            }
            return full(parameters, targets);
        });
    }

    private Mono<ExtractionResult> full(ExtractionParameters parameters, List<DataStructureInfo> targets) {
        int limit = parameters.effectiveLimit();
        long startOffset = 0;
        if (parameters.hasContinuationToken()) {
            if (targets.size() != 1) {
                throw new InvalidExtractionRequestException("A continuation token addresses exactly one target structure");
            }
            ContinuationToken token = parseToken(parameters.getContinuationToken());
            if (!token.isOffset()) {
                throw new InvalidExtractionRequestException("Continuation token is an incremental cursor; request incremental extraction to replay it");
            }
            if (!token.isFor(targets.get(0).getQualifiedName())) {
                throw new InvalidExtractionRequestException(String.format(
                        "Continuation token was issued for '%s', not '%s'", token.getTarget(), targets.get(0).getQualifiedName()));
            }
            startOffset = token.getOffset();
        }
        long offset = startOffset;

        return Flux.fromIterable(targets)
                .concatMap(structure -> {
                    StructureQuery query = StructureQuery.builder(structure)
                            .fields(parameters.getIncludeFields())
                            .filters(parameters.getFilterCriteria())
                            .orderBy(stableOrder(structure, null))
                            .offset(offset)
                            .limit(limit)
                            .options(parameters.getOptions())
                            .build();
                    return collector("extract:" + structure.getQualifiedName(), parameters)
                            .includeFields(parameters.getIncludeFields())
                            .collect(reader.apply(query))
                            .map(collected -> new TargetOutcome(structure, collected));
                })
                .takeUntil(outcome -> outcome.collected.isCancelled())
                .collectList()
                .map(outcomes -> assembleFull(outcomes, targets, limit, offset));
    }

    private ExtractionResult assembleFull(List<TargetOutcome> outcomes, List<DataStructureInfo> targets, int limit, long offset) {
        List<DataRow> rows = new ArrayList<>();
        List<DataStructureInfo> structures = new ArrayList<>();
        long processed = 0;
        boolean hasMore = false;
        for (TargetOutcome outcome : outcomes) {
            RowCollector.Collected collected = outcome.collected;
            if (collected.isCancelled()) {
                return ExtractionResult.failure(collected.failureReason(), String.format(
                                "Extraction of %s stopped after %d records", outcome.structure.getQualifiedName(),
                                processed + collected.processedCount()))
                        .processedCount(processed + collected.processedCount())
                        .build();
            }
            rows.addAll(collected.rows());
            structures.add(outcome.structure);
            processed += collected.processedCount();
            hasMore |= collected.processedCount() == limit;
        }
        String token = targets.size() == 1 && hasMore
                ? ContinuationToken.offset(targets.get(0).getQualifiedName(), offset + processed).encode()
                : null;
        return ExtractionResult.success()
                .rows(rows)
                .processedCount(processed)
                .hasMoreRecords(hasMore)
                .continuationToken(token)
                .structureInfo(structures)
                .build();
    }

    private Mono<ExtractionResult> incremental(ExtractionParameters parameters, DataStructureInfo structure) {
        String target = structure.getQualifiedName();
        IncrementalCursor cursor = IncrementalCursor.resolve(parameters, target, defaultTrackingField.apply(structure));
        FieldInfo trackingField = structure.findField(cursor.getTrackingField())
                .orElseThrow(() -> new ExtractionException(String.format(
                        "Tracking field '%s' does not exist on '%s'", cursor.getTrackingField(), target)));
        int limit = parameters.effectiveLimit();

        StructureQuery query = StructureQuery.builder(structure)
                .fields(parameters.getIncludeFields())
                .filters(parameters.getFilterCriteria())
                .trackingAfter(trackingField.getName(), cursor.getLastValue())
                .orderBy(stableOrder(structure, trackingField.getName()))
                .limit(limit)
                .options(parameters.getOptions())
                .build();

        return collector("incremental:" + target, parameters)
                .trackingField(trackingField.getName())
                .includeFields(parameters.getIncludeFields())
                .collect(reader.apply(query))
                .map(collected -> {
                    if (collected.isCancelled()) {
                        return ExtractionResult.failure(collected.failureReason(), String.format(
                                        "Incremental extraction of %s stopped after %d records", target, collected.processedCount()))
                                .processedCount(collected.processedCount())
                                .build();
                    }
                    return ExtractionResult.success()
                            .rows(collected.rows())
                            .processedCount(collected.processedCount())
                            .hasMoreRecords(collected.processedCount() == limit)
                            .continuationToken(cursor.nextToken(collected.maxTrackingValue()))
                            .addStructureInfo(structure)
                            .build();
                });
    }

    private RowCollector collector(String operation, ExtractionParameters parameters) {
        int batch = parameters.getBatchSize() > 0 ? Math.min(parameters.getBatchSize(), MAX_FLUSH_BATCH) : MAX_FLUSH_BATCH;
        return collectors.apply(operation).batchSize(batch);
    }

    /**
     * Tracking field first (if any), then the primary key, falling back to the first field.
     */
    static List<String> stableOrder(DataStructureInfo structure, String trackingField) {
        List<String> order = new ArrayList<>();
        if (trackingField != null) {
            order.add(trackingField);
        }
        for (String key : structure.getPrimaryKeyFields()) {
            if (!order.contains(key)) {
                order.add(key);
            }
        }
        if (order.isEmpty() && !structure.getFields().isEmpty()) {
            order.add(structure.getFields().get(0).getName());
        }
        return order;
    }

    private static ContinuationToken parseToken(String token) {
        try {
            return ContinuationToken.parse(token);
        } catch (IllegalArgumentException e) {
            throw new InvalidExtractionRequestException(e.getMessage(), e);
        }
    }

    private record TargetOutcome(DataStructureInfo structure, RowCollector.Collected collected) {
    }
}
