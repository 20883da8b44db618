package io.mvccstore.segment.storage;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Set;

import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;

/**
 * A consistent read of the segment list and the merge list.
 */
public final class CatalogState {
    public final List<SegmentEntry> entries;
    public final Set<SegmentId> mergeList;
    public final long generation;

    public CatalogState(List<SegmentEntry> entries, Set<SegmentId> mergeList, long generation) {
        this.entries = ImmutableList.copyOf(entries);
        this.mergeList = ImmutableSet.copyOf(mergeList);
        this.generation = generation;
    }

    /**
     * @return the entry, or null.
     */
    public SegmentEntry find(SegmentId id) {
        for (SegmentEntry e : entries) {
            if (e.id().equals(id)) {
                return e;
            }
        }
        return null;
    }
}
