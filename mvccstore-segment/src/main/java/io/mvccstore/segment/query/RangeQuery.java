package io.mvccstore.segment.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import io.mvccstore.segment.index.SegmentIndex;
import io.mvccstore.segment.index.Terms;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;

/**
 * Docs whose field lies in a range. A null bound is unbounded. Docs without the field never match.
 */
public class RangeQuery extends SearchQuery {
    @JsonProperty("field")
    public final String field;
    @JsonProperty("lower")
    public final Object lower;
    @JsonProperty("upper")
    public final Object upper;
    @JsonProperty("includeLower")
    public final boolean includeLower;
    @JsonProperty("includeUpper")
    public final boolean includeUpper;

    @JsonCreator
    public RangeQuery(@JsonProperty("field") String field,
                      @JsonProperty("lower") Object lower,
                      @JsonProperty("upper") Object upper,
                      @JsonProperty("includeLower") boolean includeLower,
                      @JsonProperty("includeUpper") boolean includeUpper) {
        this.field = Preconditions.checkNotNull(field);
        this.lower = lower;
        this.upper = upper;
        this.includeLower = includeLower;
        this.includeUpper = includeUpper;
    }

    /**
     * [lower, upper)
     */
    public static RangeQuery of(String field, Object lower, Object upper) {
        return new RangeQuery(field, lower, upper, true, false);
    }

    public boolean matches(Object value) {
        if (value == null) {
            return false;
        }
        if (lower != null) {
            int c = Terms.compare(value, lower);
            if (c < 0 || (c == 0 && !includeLower)) {
                return false;
            }
        }
        if (upper != null) {
            int c = Terms.compare(value, upper);
            if (c > 0 || (c == 0 && !includeUpper)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public IntArrayList search(SegmentIndex index) {
        IntArrayList docs = new IntArrayList();
        IntIterator it = index.liveDocs().iterator();
        while (it.hasNext()) {
            int docId = it.nextInt();
            if (matches(index.doc(docId).field(field))) {
                docs.add(docId);
            }
        }
        return docs;
    }

    @Override
    public String toString() {
        return field + ":" + (includeLower ? "[" : "(") + lower + "," + upper + (includeUpper ? "]" : ")");
    }
}
