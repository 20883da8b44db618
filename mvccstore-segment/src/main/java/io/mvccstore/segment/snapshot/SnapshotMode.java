package io.mvccstore.segment.snapshot;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

import io.mvccstore.segment.SegmentId;

/**
 * Which consistency a scan asks for. A closed set: the four constants, plus the worker subsets built by
 * {@link #parallelWorker(SnapshotMode, Collection)}.
 */
public final class SnapshotMode {
    public enum Kind {
        SNAPSHOT,
        VACUUM,
        MERGEABLE,
        LARGEST_SEGMENT_ONLY,
        PARALLEL_WORKER_SUBSET
    }

    /**
     * Ordinary visibility of the current transaction.
     */
    public static final SnapshotMode SNAPSHOT = new SnapshotMode(Kind.SNAPSHOT, null, null);
    /**
     * Used by reclamation, sees every segment and every row, dead ones included.
     */
    public static final SnapshotMode VACUUM = new SnapshotMode(Kind.VACUUM, null, null);
    /**
     * Used by background merging, sees the live segments no other merge has claimed.
     */
    public static final SnapshotMode MERGEABLE = new SnapshotMode(Kind.MERGEABLE, null, null);
    /**
     * Maintenance and diagnostics, only the segment with the most documents.
     */
    public static final SnapshotMode LARGEST_SEGMENT_ONLY = new SnapshotMode(Kind.LARGEST_SEGMENT_ONLY, null, null);

    private final Kind kind;
    private final SnapshotMode base;
    private final ImmutableSortedSet<SegmentId> segmentIds;

    private SnapshotMode(Kind kind, SnapshotMode base, ImmutableSortedSet<SegmentId> segmentIds) {
        this.kind = kind;
        this.base = base;
        this.segmentIds = segmentIds;
    }

    /**
     * The view of a parallel worker: only the given segments out of what {@link #SNAPSHOT} would resolve to.
     */
    public static SnapshotMode parallelWorker(Collection<SegmentId> segmentIds) {
        return parallelWorker(SNAPSHOT, segmentIds);
    }

    /**
     * The view of a parallel worker: only the given segments out of what the base mode would resolve to.
     */
    public static SnapshotMode parallelWorker(SnapshotMode base, Collection<SegmentId> segmentIds) {
        Preconditions.checkArgument(base.kind == Kind.SNAPSHOT || base.kind == Kind.VACUUM || base.kind == Kind.MERGEABLE,
                "a worker subset can not be split from %s", base);
        return new SnapshotMode(Kind.PARALLEL_WORKER_SUBSET, base, ImmutableSortedSet.copyOf(segmentIds));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The mode a worker subset was split from, the mode itself otherwise.
     */
    public SnapshotMode base() {
        return base == null ? this : base;
    }

    /**
     * The segments of a worker subset, null for any other mode.
     */
    public Set<SegmentId> segmentIds() {
        return segmentIds;
    }

    public boolean isWorkerSubset() {
        return kind == Kind.PARALLEL_WORKER_SUBSET;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SnapshotMode)) return false;
        SnapshotMode that = (SnapshotMode) o;
        return kind == that.kind && Objects.equals(base, that.base) && Objects.equals(segmentIds, that.segmentIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, base, segmentIds);
    }

    @Override
    public String toString() {
        if (isWorkerSubset()) {
            return "parallel_worker(" + base.toString() + ", " + segmentIds.size() + " segments)";
        }
        return kind.name().toLowerCase();
    }
}
