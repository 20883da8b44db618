package io.mvccstore.segment.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

/**
 * One output column of an aggregation. COUNT without a field counts docs, with a field it counts non-null values.
 */
public final class MetricSpec {
    @JsonProperty("name")
    public final String name;
    @JsonProperty("type")
    public final MetricType type;
    @JsonProperty("field")
    public final String field;

    @JsonCreator
    public MetricSpec(@JsonProperty("name") String name,
                      @JsonProperty("type") MetricType type,
                      @JsonProperty("field") String field) {
        Preconditions.checkArgument(!StringUtils.isBlank(name), "metric name required");
        Preconditions.checkNotNull(type, "metric type required");
        Preconditions.checkArgument(type == MetricType.COUNT || field != null, "%s needs a field", type);
        this.name = name;
        this.type = type;
        this.field = field;
    }

    public static MetricSpec count(String name) {
        return new MetricSpec(name, MetricType.COUNT, null);
    }

    public static MetricSpec of(String name, MetricType type, String field) {
        return new MetricSpec(name, type, field);
    }

    @Override
    public String toString() {
        return name + "=" + type + "(" + (field == null ? "*" : field) + ")";
    }
}
