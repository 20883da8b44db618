package io.mvccstore.segment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import io.mvccstore.segment.snapshot.SnapshotMode;
import io.mvccstore.segment.snapshot.VisibilityRule;

/**
 * The segments a scan may read, in scheduling order, together with the rule governing row visibility in them.
 */
public final class SegmentSet implements Iterable<SegmentEntry> {
    private final SnapshotMode mode;
    private final VisibilityRule rule;
    private final ImmutableList<SegmentEntry> entries;
    private final ImmutableMap<SegmentId, SegmentEntry> byId;

    public SegmentSet(SnapshotMode mode, VisibilityRule rule, List<SegmentEntry> orderedEntries) {
        this.mode = mode;
        this.rule = rule;
        this.entries = ImmutableList.copyOf(orderedEntries);
        ImmutableMap.Builder<SegmentId, SegmentEntry> builder = ImmutableMap.builder();
        for (SegmentEntry e : orderedEntries) {
            builder.put(e.id(), e);
        }
        this.byId = builder.build();
    }

    public SnapshotMode mode() {
        return mode;
    }

    public VisibilityRule rule() {
        return rule;
    }

    public List<SegmentEntry> entries() {
        return entries;
    }

    public Map<SegmentId, SegmentEntry> byId() {
        return byId;
    }

    /**
     * @return the entry, or null if the segment is not part of this set.
     */
    public SegmentEntry get(SegmentId id) {
        return byId.get(id);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long totalDocs() {
        long total = 0;
        for (SegmentEntry e : entries) {
            total += e.numDocs();
        }
        return total;
    }

    @Override
    public Iterator<SegmentEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SegmentSet{mode=").append(mode).append(", rule=").append(rule).append(", [");
        for (int i = 0; i < entries.size(); i++) {
            SegmentEntry e = entries.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(e.id().shortId()).append(e.isPersisted() ? ":" : ":mem:").append(e.numDocs());
        }
        return sb.append("]}").toString();
    }
}
