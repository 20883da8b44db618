package io.mvccstore.segment.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.mvccstore.segment.query.AllQuery;
import io.mvccstore.segment.query.SearchQuery;

/**
 * An aggregation request: which docs, how to group them and what to compute per group.
 */
public final class AggregationSpec {
    @JsonProperty("query")
    public final SearchQuery query;
    /** Null for a single group over all docs. */
    @JsonProperty("groupBy")
    public final String groupBy;
    @JsonProperty("metrics")
    public final List<MetricSpec> metrics;
    /** Max groups in the final result, 0 for no limit. */
    @JsonProperty("limit")
    public final int limit;

    @JsonCreator
    public AggregationSpec(@JsonProperty("query") SearchQuery query,
                           @JsonProperty("groupBy") String groupBy,
                           @JsonProperty("metrics") List<MetricSpec> metrics,
                           @JsonProperty("limit") int limit) {
        Preconditions.checkArgument(limit >= 0, "negative limit");
        this.query = query == null ? new AllQuery() : query;
        this.groupBy = groupBy;
        this.metrics = metrics == null
                ? Collections.<MetricSpec>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(metrics));
        this.limit = limit;
        Set<String> names = new HashSet<>();
        for (MetricSpec m : this.metrics) {
            Preconditions.checkArgument(names.add(m.name), "duplicate metric name %s", m.name);
        }
    }

    public boolean isGrouped() {
        return groupBy != null;
    }

    @Override
    public String toString() {
        return "AggregationSpec{" +
                "query=" + query +
                ", groupBy=" + groupBy +
                ", metrics=" + metrics +
                ", limit=" + limit +
                '}';
    }
}
