package io.mvccstore.segment.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The partial state of one metric in one group, enough to finalize any {@link MetricType}.
 */
public final class MetricState {
    /** Values seen, or docs for a field-less COUNT. */
    @JsonProperty("count")
    long count;
    /** Numeric values seen. */
    @JsonProperty("numeric")
    long numeric;
    @JsonProperty("sum")
    double sum;
    @JsonProperty("min")
    Double min;
    @JsonProperty("max")
    Double max;

    public MetricState() {}

    @JsonCreator
    MetricState(@JsonProperty("count") long count,
                @JsonProperty("numeric") long numeric,
                @JsonProperty("sum") double sum,
                @JsonProperty("min") Double min,
                @JsonProperty("max") Double max) {
        this.count = count;
        this.numeric = numeric;
        this.sum = sum;
        this.min = min;
        this.max = max;
    }

    public void addDoc() {
        count++;
    }

    public void add(Object value) {
        if (value == null) {
            return;
        }
        count++;
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            numeric++;
            sum += d;
            min = min == null ? d : Math.min(min, d);
            max = max == null ? d : Math.max(max, d);
        }
    }

    public void merge(MetricState other) {
        count += other.count;
        numeric += other.numeric;
        sum += other.sum;
        if (other.min != null) {
            min = min == null ? other.min : Math.min(min, other.min);
        }
        if (other.max != null) {
            max = max == null ? other.max : Math.max(max, other.max);
        }
    }

    public MetricState copy() {
        return new MetricState(count, numeric, sum, min, max);
    }

    /**
     * COUNT gives a Long, the others a Double, or null if no numeric value was seen.
     */
    public Object value(MetricType type) {
        switch (type) {
            case COUNT:
                return count;
            case SUM:
                return numeric == 0 ? null : sum;
            case MIN:
                return min;
            case MAX:
                return max;
            case AVG:
                return numeric == 0 ? null : sum / numeric;
            default:
                throw new IllegalArgumentException("Unsupported metric type: " + type);
        }
    }

    @Override
    public String toString() {
        return "MetricState{" +
                "count=" + count +
                ", sum=" + sum +
                ", min=" + min +
                ", max=" + max +
                '}';
    }
}
