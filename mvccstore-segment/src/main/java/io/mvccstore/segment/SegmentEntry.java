package io.mvccstore.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Objects;

import io.mvccstore.host.HeapTuple;

/**
 * The metadata record of one segment, as kept in the segment list.
 *
 * Entries are versioned like heap rows: {@link #xmin()} is the transaction which created the segment and
 * {@link #xmax()} the one which dropped it, e.g. because it was merged away.
 */
public final class SegmentEntry {
    private final SegmentId id;
    private final long numDocs;
    private final long numDeletedDocs;
    private final long xmin;
    private final long xmax;
    private final SegmentContent content;

    @JsonCreator
    public SegmentEntry(@JsonProperty("id") SegmentId id,
                        @JsonProperty("numDocs") long numDocs,
                        @JsonProperty("numDeletedDocs") long numDeletedDocs,
                        @JsonProperty("xmin") long xmin,
                        @JsonProperty("xmax") long xmax,
                        @JsonProperty("content") SegmentContent content) {
        Preconditions.checkArgument(numDocs >= 0 && numDeletedDocs >= 0, "negative doc count");
        this.id = Preconditions.checkNotNull(id);
        this.numDocs = numDocs;
        this.numDeletedDocs = numDeletedDocs;
        this.xmin = xmin;
        this.xmax = xmax;
        this.content = Preconditions.checkNotNull(content);
    }

    public static SegmentEntry created(SegmentId id, long numDocs, long xmin, SegmentContent content) {
        return new SegmentEntry(id, numDocs, 0, xmin, HeapTuple.INVALID_XID, content);
    }

    @JsonProperty("id")
    public SegmentId id() {
        return id;
    }

    /**
     * Approximate number of documents in the segment, deleted ones included.
     */
    @JsonProperty("numDocs")
    public long numDocs() {
        return numDocs;
    }

    @JsonProperty("numDeletedDocs")
    public long numDeletedDocs() {
        return numDeletedDocs;
    }

    @JsonProperty("xmin")
    public long xmin() {
        return xmin;
    }

    @JsonProperty("xmax")
    public long xmax() {
        return xmax;
    }

    @JsonProperty("content")
    public SegmentContent content() {
        return content;
    }

    @JsonIgnore
    public boolean isPersisted() {
        return content.isPersisted();
    }

    @JsonIgnore
    public boolean isDeleted() {
        return xmax != HeapTuple.INVALID_XID;
    }

    @JsonIgnore
    public long pintestBlock() {
        return content.pintestBlock();
    }

    public SegmentEntry withXmax(long xmax) {
        return new SegmentEntry(id, numDocs, numDeletedDocs, xmin, xmax, content);
    }

    public SegmentEntry withDeletes(long numDeletedDocs, SegmentContent content) {
        return new SegmentEntry(id, numDocs, numDeletedDocs, xmin, xmax, content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SegmentEntry)) return false;
        SegmentEntry that = (SegmentEntry) o;
        return numDocs == that.numDocs
                && numDeletedDocs == that.numDeletedDocs
                && xmin == that.xmin
                && xmax == that.xmax
                && id.equals(that.id)
                && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, numDocs, numDeletedDocs, xmin, xmax, content);
    }

    @Override
    public String toString() {
        return "SegmentEntry{" +
                "id=" + id.shortId() +
                ", numDocs=" + numDocs +
                ", numDeletedDocs=" + numDeletedDocs +
                ", xmin=" + xmin +
                ", xmax=" + xmax +
                ", content=" + content +
                '}';
    }
}
