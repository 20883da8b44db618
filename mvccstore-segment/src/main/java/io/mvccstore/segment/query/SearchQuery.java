package io.mvccstore.segment.query;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import io.mvccstore.segment.index.SegmentIndex;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * A boolean filter over the documents of a segment. Matches are unscored.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AllQuery.class, name = "all"),
        @JsonSubTypes.Type(value = TermQuery.class, name = "term"),
        @JsonSubTypes.Type(value = RangeQuery.class, name = "range"),
        @JsonSubTypes.Type(value = AndQuery.class, name = "and")})
public abstract class SearchQuery {

    /**
     * @return the matching doc ids in ascending order. Deleted docs never match.
     */
    public abstract IntArrayList search(SegmentIndex index);
}
