package io.mvccstore.segment.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.mvccstore.host.Snapshot;
import io.mvccstore.host.TransactionStatus;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SystemConfig;
import io.mvccstore.segment.visibility.TupleVisibility;

/**
 * Decides which segments a snapshot mode sees, and how rows in them are filtered.
 *
 * A pure function of its inputs: the same committed metadata and mode always give the same resolution.
 */
public class SnapshotResolver {
    private static final Logger log = LoggerFactory.getLogger(SnapshotResolver.class);

    private final Snapshot snapshot;
    private final TransactionStatus transactions;

    public SnapshotResolver(Snapshot snapshot, TransactionStatus transactions) {
        this.snapshot = snapshot;
        this.transactions = transactions;
    }

    /**
     * @param all       every entry of the segment list, dropped ones included.
     * @param mergeList the segments claimed by in-flight merges.
     */
    public Resolution resolve(SnapshotMode mode, Collection<SegmentEntry> all, Set<SegmentId> mergeList) {
        switch (mode.kind()) {
            case SNAPSHOT:
                return new Resolution(live(all), VisibilityRule.MVCC);
            case VACUUM:
                return new Resolution(new ArrayList<>(all), VisibilityRule.ANY);
            case MERGEABLE: {
                List<SegmentEntry> mergeable = new ArrayList<>();
                for (SegmentEntry e : live(all)) {
                    if (!mergeList.contains(e.id())) {
                        mergeable.add(e);
                    }
                }
                return new Resolution(mergeable, VisibilityRule.ANY);
            }
            case LARGEST_SEGMENT_ONLY: {
                SegmentEntry largest = null;
                for (SegmentEntry e : live(all)) {
                    if (largest == null
                            || e.numDocs() > largest.numDocs()
                            || (e.numDocs() == largest.numDocs() && e.id().compareTo(largest.id()) < 0)) {
                        largest = e;
                    }
                }
                List<SegmentEntry> one = new ArrayList<>(1);
                if (largest != null) {
                    one.add(largest);
                }
                return new Resolution(one, VisibilityRule.MVCC);
            }
            case PARALLEL_WORKER_SUBSET:
                return resolveSubset(mode, all);
            default:
                throw new SnapshotMismatchException("Unsupported snapshot mode: " + mode);
        }
    }

    /**
     * The leader applied the merge list when it resolved the base mode, and merges claimed since then must not take
     * segments away from its workers. So the subset is checked against the base mode without any claims.
     */
    private Resolution resolveSubset(SnapshotMode mode, Collection<SegmentEntry> all) {
        Resolution base = resolve(mode.base(), all, Collections.<SegmentId>emptySet());
        Map<SegmentId, SegmentEntry> baseById = new HashMap<>();
        for (SegmentEntry e : base.eligible) {
            baseById.put(e.id(), e);
        }
        List<SegmentEntry> subset = new ArrayList<>(mode.segmentIds().size());
        for (SegmentId id : mode.segmentIds()) {
            SegmentEntry e = baseById.get(id);
            if (e == null) {
                if (SystemConfig.FAILFAST.getBool()) {
                    throw new SnapshotMismatchException(String.format(
                            "Segment %s assigned to a worker is not visible to %s", id, mode.base()));
                }
                log.warn("Segment not found! [segment: {}, mode: {}]", id, mode.base());
                continue;
            }
            subset.add(e);
        }
        return new Resolution(subset, base.rule);
    }

    private List<SegmentEntry> live(Collection<SegmentEntry> all) {
        List<SegmentEntry> live = new ArrayList<>(all.size());
        for (SegmentEntry e : all) {
            if (TupleVisibility.satisfiesMvcc(e.xmin(), e.xmax(), snapshot, transactions)) {
                live.add(e);
            }
        }
        return live;
    }
}
