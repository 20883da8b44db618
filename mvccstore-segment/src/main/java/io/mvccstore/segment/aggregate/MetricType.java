package io.mvccstore.segment.aggregate;

public enum MetricType {
    COUNT,
    SUM,
    MIN,
    MAX,
    AVG
}
