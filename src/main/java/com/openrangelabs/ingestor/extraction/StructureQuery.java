package com.openrangelabs.ingestor.extraction;

import com.openrangelabs.ingestor.connector.DataStructureInfo;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend-neutral read request for one structure: equality filters, an optional exclusive
 * lower bound on the tracking field, a deterministic ordering and a window.
 *
 * <p>Relational connectors translate it into SQL; sources without a query language evaluate
 * it with {@link #applyTo(Flux)}.
 */
public final class StructureQuery {

    private final DataStructureInfo structure;
    private final List<String> fields;
    private final Map<String, Object> filters;
    private final String trackingField;
    private final FieldValue trackingAfter;
    private final List<String> orderBy;
    private final long offset;
    private final int limit;
    private final Map<String, Object> options;

    private StructureQuery(Builder builder) {
        this.structure = builder.structure;
        this.fields = List.copyOf(builder.fields);
        this.filters = new LinkedHashMap<>(builder.filters);
        this.trackingField = builder.trackingField;
        this.trackingAfter = builder.trackingAfter;
        this.orderBy = List.copyOf(builder.orderBy);
        this.offset = builder.offset;
        this.limit = builder.limit;
        this.options = new LinkedHashMap<>(builder.options);
    }

    public static Builder builder(DataStructureInfo structure) {
        return new Builder(structure);
    }

    public DataStructureInfo getStructure() { return structure; }
    public List<String> getFields() { return fields; }
    public Map<String, Object> getFilters() { return filters; }
    public String getTrackingField() { return trackingField; }
    public FieldValue getTrackingAfter() { return trackingAfter; }
    public List<String> getOrderBy() { return orderBy; }
    public long getOffset() { return offset; }
    public int getLimit() { return limit; }
    public Map<String, Object> getOptions() { return options; }

    public boolean booleanOption(String name) {
        Object value = options.get(name);
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /**
     * Copy without the given filter keys, for sources that evaluate some criteria themselves.
     */
    public StructureQuery withoutFilters(Collection<String> keys) {
        Map<String, Object> remaining = new LinkedHashMap<>(filters);
        remaining.keySet().removeAll(keys);
        return new Builder(structure)
                .fields(fields)
                .filters(remaining)
                .trackingAfter(trackingField, trackingAfter)
                .orderBy(orderBy)
                .offset(offset)
                .limit(limit)
                .options(options)
                .build();
    }

    public boolean hasTrackingBound() {
        return trackingField != null && trackingAfter != null && !trackingAfter.isNull();
    }

    /**
     * Evaluates the query over every row of the structure.
     */
    public Flux<DataRow> applyTo(Flux<DataRow> allRows) {
        Flux<DataRow> matching = allRows
                .filter(row -> RowPredicates.matchesFilters(row, filters))
                .filter(row -> !hasTrackingBound() || RowPredicates.isAfter(row, trackingField, trackingAfter));
        Flux<DataRow> ordered = orderBy.isEmpty()
                ? matching
                : matching.collectSortedList(rowOrder()).flatMapIterable(rows -> rows);
        return ordered.skip(offset).take(limit);
    }

    private Comparator<DataRow> rowOrder() {
        Comparator<DataRow> order = null;
        for (String field : orderBy) {
            Comparator<DataRow> next = Comparator.comparing(row -> row.get(field), TrackingValueComparator.INSTANCE);
            order = order == null ? next : order.thenComparing(next);
        }
        return order;
    }

    public static final class Builder {
        private final DataStructureInfo structure;
        private List<String> fields = new ArrayList<>();
        private Map<String, Object> filters = new LinkedHashMap<>();
        private String trackingField;
        private FieldValue trackingAfter = FieldValue.ofNull();
        private List<String> orderBy = new ArrayList<>();
        private long offset;
        private int limit = ExtractionParameters.DEFAULT_BATCH_SIZE;
        private Map<String, Object> options = new LinkedHashMap<>();

        private Builder(DataStructureInfo structure) {
            this.structure = structure;
        }

        public Builder fields(List<String> fields) {
            this.fields = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
            return this;
        }

        public Builder filters(Map<String, Object> filters) {
            this.filters = filters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(filters);
            return this;
        }

        public Builder trackingAfter(String trackingField, FieldValue lowerBound) {
            this.trackingField = trackingField;
            this.trackingAfter = lowerBound == null ? FieldValue.ofNull() : lowerBound;
            return this;
        }

        public Builder orderBy(List<String> orderBy) {
            this.orderBy = orderBy == null ? new ArrayList<>() : new ArrayList<>(orderBy);
            return this;
        }

        public Builder offset(long offset) {
            this.offset = Math.max(0, offset);
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder options(Map<String, Object> options) {
            this.options = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
            return this;
        }

        public StructureQuery build() {
            return new StructureQuery(this);
        }
    }

    @Override
    public String toString() {
        return "StructureQuery{" + structure.getQualifiedName() +
                ", filters=" + filters.keySet() +
                (hasTrackingBound() ? ", " + trackingField + " > " + trackingAfter.asString() : "") +
                ", orderBy=" + orderBy +
                ", offset=" + offset +
                ", limit=" + limit +
                '}';
    }
}
