package io.mvccstore.segment;

import java.util.Comparator;

/**
 * The scheduling order of segments: cheapest first.
 *
 * A persisted segment costs its document count. A memory segment has to be indexed before it can be read, which
 * dominates everything else, so it is placed after any persisted segment by adding {@link #MEMORY_BASE_COST}.
 * That offset is a heuristic, not a cost model.
 */
public class SegmentCost {
    public static final long MEMORY_BASE_COST = 0xFFFF_FFFFL;

    public static long cost(SegmentEntry entry) {
        return entry.isPersisted() ? entry.numDocs() : MEMORY_BASE_COST + entry.numDocs();
    }

    /**
     * Ascending by cost, ties broken by id so the order is total.
     */
    public static final Comparator<SegmentEntry> CHEAPEST_FIRST = new Comparator<SegmentEntry>() {
        @Override
        public int compare(SegmentEntry e1, SegmentEntry e2) {
            if (e1 == e2) {
                return 0;
            }
            int res = Long.compare(cost(e1), cost(e2));
            if (res != 0) {
                return res;
            }
            return e1.id().compareTo(e2.id());
        }
    };
}
