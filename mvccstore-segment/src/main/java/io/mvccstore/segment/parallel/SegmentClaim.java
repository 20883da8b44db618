package io.mvccstore.segment.parallel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;

/**
 * A segment handed to the workers of a parallel scan, together with its deleted doc count at planning time.
 */
public final class SegmentClaim {
    @JsonProperty("id")
    public final SegmentId id;
    @JsonProperty("numDeletedDocs")
    public final long numDeletedDocs;

    @JsonCreator
    public SegmentClaim(@JsonProperty("id") SegmentId id,
                        @JsonProperty("numDeletedDocs") long numDeletedDocs) {
        this.id = id;
        this.numDeletedDocs = numDeletedDocs;
    }

    public static SegmentClaim of(SegmentEntry entry) {
        return new SegmentClaim(entry.id(), entry.numDeletedDocs());
    }

    @Override
    public String toString() {
        return id.shortId() + "/" + numDeletedDocs;
    }
}
