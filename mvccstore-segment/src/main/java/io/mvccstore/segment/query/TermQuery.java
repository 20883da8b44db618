package io.mvccstore.segment.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Objects;

import io.mvccstore.segment.index.SegmentIndex;
import io.mvccstore.segment.index.Terms;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Docs whose field equals the value.
 */
public class TermQuery extends SearchQuery {
    @JsonProperty("field")
    public final String field;
    @JsonProperty("value")
    public final Object value;

    @JsonCreator
    public TermQuery(@JsonProperty("field") String field,
                     @JsonProperty("value") Object value) {
        this.field = Preconditions.checkNotNull(field);
        this.value = value;
    }

    @Override
    public IntArrayList search(SegmentIndex index) {
        int[] postings = index.postings(field, value);
        IntArrayList docs = new IntArrayList(postings.length);
        for (int docId : postings) {
            if (!index.isDeleted(docId)) {
                docs.add(docId);
            }
        }
        return docs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TermQuery)) return false;
        TermQuery that = (TermQuery) o;
        return field.equals(that.field) && Terms.normalize(value).equals(Terms.normalize(that.value));
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, Terms.normalize(value));
    }

    @Override
    public String toString() {
        return field + ":" + value;
    }
}
