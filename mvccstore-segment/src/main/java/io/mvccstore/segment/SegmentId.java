package io.mvccstore.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

import java.util.UUID;

/**
 * Identifies one segment of an index. Unique in the whole system and never reused.
 */
public final class SegmentId implements Comparable<SegmentId> {
    private final String id;

    private SegmentId(String id) {
        this.id = id;
    }

    public static SegmentId generate() {
        return new SegmentId(UUID.randomUUID().toString().replace("-", ""));
    }

    @JsonCreator
    public static SegmentId of(String id) {
        Preconditions.checkArgument(!StringUtils.isBlank(id), "empty segment id");
        return new SegmentId(id);
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * The first eight characters, enough to tell segments apart in logs.
     */
    public String shortId() {
        return id.length() <= 8 ? id : id.substring(0, 8);
    }

    @Override
    public int compareTo(SegmentId o) {
        return id.compareTo(o.id);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof SegmentId && id.equals(((SegmentId) o).id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
