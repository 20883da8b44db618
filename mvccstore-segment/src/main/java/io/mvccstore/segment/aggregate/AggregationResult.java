package io.mvccstore.segment.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The final result of an aggregation: one row per group, ordered by group key.
 */
public final class AggregationResult {
    @JsonProperty("rows")
    public final List<Row> rows;
    @JsonProperty("docCount")
    public final long docCount;

    @JsonCreator
    public AggregationResult(@JsonProperty("rows") List<Row> rows,
                             @JsonProperty("docCount") long docCount) {
        this.rows = rows == null ? Collections.<Row>emptyList() : Collections.unmodifiableList(rows);
        this.docCount = docCount;
    }

    public static final class Row {
        @JsonProperty("key")
        public final String key;
        @JsonProperty("docCount")
        public final long docCount;
        @JsonProperty("values")
        public final Map<String, Object> values;

        @JsonCreator
        public Row(@JsonProperty("key") String key,
                   @JsonProperty("docCount") long docCount,
                   @JsonProperty("values") Map<String, Object> values) {
            this.key = key;
            this.docCount = docCount;
            this.values = values == null
                    ? Collections.<String, Object>emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public Object value(String metric) {
            return values.get(metric);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Row)) return false;
            Row row = (Row) o;
            return docCount == row.docCount && key.equals(row.key) && values.equals(row.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, docCount, values);
        }

        @Override
        public String toString() {
            return key + "(" + docCount + ")" + values;
        }
    }

    /**
     * Turn merged partial state into rows, applying the aggregation's limit. An ungrouped aggregation always has exactly
     * one row, keyed {@value IntermediateResult#ALL_KEY}, even over no docs.
     */
    public static AggregationResult finish(AggregationSpec spec, IntermediateResult merged) {
        Map<String, IntermediateResult.Bucket> buckets = merged.buckets();
        List<Row> rows = new ArrayList<>();
        if (!spec.isGrouped() && buckets.isEmpty()) {
            rows.add(row(spec, IntermediateResult.ALL_KEY, new IntermediateResult.Bucket()));
        }
        for (Map.Entry<String, IntermediateResult.Bucket> e : buckets.entrySet()) {
            if (spec.limit > 0 && rows.size() >= spec.limit) {
                break;
            }
            rows.add(row(spec, e.getKey(), e.getValue()));
        }
        return new AggregationResult(rows, merged.docCount());
    }

    private static Row row(AggregationSpec spec, String key, IntermediateResult.Bucket bucket) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (MetricSpec m : spec.metrics) {
            MetricState state = bucket.metric(m.name);
            values.put(m.name, (state == null ? new MetricState() : state).value(m.type));
        }
        return new Row(key, bucket.docCount(), values);
    }

    /**
     * @return the row of the group, or null.
     */
    public Row row(String key) {
        for (Row r : rows) {
            if (r.key.equals(key)) {
                return r;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregationResult)) return false;
        AggregationResult that = (AggregationResult) o;
        return docCount == that.docCount && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, docCount);
    }

    @Override
    public String toString() {
        return "AggregationResult{rows=" + rows + ", docCount=" + docCount + '}';
    }
}
