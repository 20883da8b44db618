package io.mvccstore.segment.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import io.mvccstore.segment.index.StoredDocument;
import io.mvccstore.segment.index.Terms;

/**
 * A partial aggregation over some segments. Partial results merge associatively, the order of merging does not
 * change the final result.
 */
public final class IntermediateResult {
    public static final String ALL_KEY = "_all";

    @JsonProperty("buckets")
    private final TreeMap<String, Bucket> buckets;
    @JsonProperty("segments")
    private int segments;

    public IntermediateResult() {
        this(null, 0);
    }

    @JsonCreator
    IntermediateResult(@JsonProperty("buckets") Map<String, Bucket> buckets,
                       @JsonProperty("segments") int segments) {
        this.buckets = buckets == null ? new TreeMap<>() : new TreeMap<>(buckets);
        this.segments = segments;
    }

    public static final class Bucket {
        @JsonProperty("docCount")
        long docCount;
        @JsonProperty("metrics")
        final LinkedHashMap<String, MetricState> metrics;

        Bucket() {
            this(0, null);
        }

        @JsonCreator
        Bucket(@JsonProperty("docCount") long docCount,
               @JsonProperty("metrics") Map<String, MetricState> metrics) {
            this.docCount = docCount;
            this.metrics = metrics == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metrics);
        }

        public long docCount() {
            return docCount;
        }

        public MetricState metric(String name) {
            return metrics.get(name);
        }
    }

    /**
     * Fold one doc in.
     */
    public void collect(AggregationSpec spec, StoredDocument doc, int bucketLimit) {
        String key = spec.isGrouped() ? Terms.normalize(doc.field(spec.groupBy)) : ALL_KEY;
        Bucket bucket = bucket(key, bucketLimit);
        bucket.docCount++;
        for (MetricSpec m : spec.metrics) {
            MetricState state = bucket.metrics.get(m.name);
            if (state == null) {
                state = new MetricState();
                bucket.metrics.put(m.name, state);
            }
            if (m.field == null) {
                state.addDoc();
            } else {
                state.add(doc.field(m.field));
            }
        }
    }

    public void segmentDone() {
        segments++;
    }

    /**
     * Merge the other result into this one. The other one is left untouched.
     */
    public IntermediateResult merge(IntermediateResult other, int bucketLimit) {
        for (Map.Entry<String, Bucket> e : other.buckets.entrySet()) {
            Bucket into = bucket(e.getKey(), bucketLimit);
            into.docCount += e.getValue().docCount;
            for (Map.Entry<String, MetricState> m : e.getValue().metrics.entrySet()) {
                MetricState state = into.metrics.get(m.getKey());
                if (state == null) {
                    into.metrics.put(m.getKey(), m.getValue().copy());
                } else {
                    state.merge(m.getValue());
                }
            }
        }
        segments += other.segments;
        return this;
    }

    public Map<String, Bucket> buckets() {
        return buckets;
    }

    /**
     * How many segments went into this result.
     */
    public int segmentCount() {
        return segments;
    }

    public long docCount() {
        long total = 0;
        for (Bucket b : buckets.values()) {
            total += b.docCount;
        }
        return total;
    }

    private Bucket bucket(String key, int bucketLimit) {
        Bucket bucket = buckets.get(key);
        if (bucket == null) {
            if (bucketLimit > 0 && buckets.size() >= bucketLimit) {
                throw new BucketLimitExceededException(bucketLimit);
            }
            bucket = new Bucket();
            buckets.put(key, bucket);
        }
        return bucket;
    }
}
