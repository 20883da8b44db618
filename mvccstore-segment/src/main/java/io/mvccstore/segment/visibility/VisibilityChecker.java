package io.mvccstore.segment.visibility;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.longs.Long2BooleanOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import it.unimi.dsi.fastutil.longs.LongSets;

import io.mvccstore.host.HeapAccess;
import io.mvccstore.host.HeapTuple;
import io.mvccstore.host.RowIds;
import io.mvccstore.host.Snapshot;
import io.mvccstore.host.TransactionStatus;
import io.mvccstore.segment.CancellationFlag;
import io.mvccstore.segment.snapshot.VisibilityRule;

/**
 * Answers whether a row id is visible to a snapshot.
 *
 * The fast path trusts the heap's visibility summary: a row on an all-visible block is visible without looking at
 * it. Otherwise the row is fetched and its version chain walked until a visible version turns up or the chain
 * ends.
 *
 * A checker is a cursor with scratch state and must be used by one thread at a time. Use {@link #copy()} to get an
 * independent one for another thread.
 */
public class VisibilityChecker {
    private static final Logger log = LoggerFactory.getLogger(VisibilityChecker.class);
    // Chains longer than a block can hold tuples are corrupt.
    private static final int MAX_CHAIN_LENGTH = RowIds.MAX_OFFSET + 1;

    private enum State {
        IDLE,
        PROBING
    }

    private final HeapAccess heap;
    private final TransactionStatus transactions;
    private final Snapshot snapshot;
    private final VisibilityRule rule;
    private final CancellationFlag cancellation;

    private State state = State.IDLE;
    private long probing = RowIds.INVALID;
    private final LongOpenHashSet missing = new LongOpenHashSet();

    private long fastPathHits;
    private long slowPathProbes;

    public VisibilityChecker(HeapAccess heap,
                             TransactionStatus transactions,
                             Snapshot snapshot,
                             VisibilityRule rule,
                             CancellationFlag cancellation) {
        this.heap = Preconditions.checkNotNull(heap);
        this.transactions = Preconditions.checkNotNull(transactions);
        this.snapshot = Preconditions.checkNotNull(snapshot);
        this.rule = Preconditions.checkNotNull(rule);
        this.cancellation = cancellation == null ? new CancellationFlag() : cancellation;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public VisibilityRule rule() {
        return rule;
    }

    public boolean isVisible(long rowId) {
        enter(rowId);
        try {
            if (heap.isAllVisible(RowIds.block(rowId))) {
                fastPathHits++;
                return true;
            }
            return walkChain(rowId) != null;
        } finally {
            leave();
        }
    }

    /**
     * Filter row ids, keeping the order. The result is the same as calling {@link #isVisible(long)} on each of them,
     * but the visibility summary is only consulted once per block.
     */
    public LongArrayList filterVisible(long[] rowIds) {
        LongArrayList visible = new LongArrayList(rowIds.length);
        Long2BooleanOpenHashMap allVisibleBlocks = new Long2BooleanOpenHashMap();
        for (long rowId : rowIds) {
            enter(rowId);
            try {
                long block = RowIds.block(rowId);
                boolean allVisible;
                if (allVisibleBlocks.containsKey(block)) {
                    allVisible = allVisibleBlocks.get(block);
                } else {
                    allVisible = heap.isAllVisible(block);
                    allVisibleBlocks.put(block, allVisible);
                }
                if (allVisible) {
                    fastPathHits++;
                    visible.add(rowId);
                } else if (walkChain(rowId) != null) {
                    visible.add(rowId);
                }
            } finally {
                leave();
            }
        }
        return visible;
    }

    /**
     * Fetch the version of the row visible to the snapshot, always taking the slow path since the row data is
     * needed.
     *
     * @return the visible version, or null. If null because the row is physically gone,
     * {@link #wasMissing(long)} answers true afterwards.
     */
    public HeapTuple fetchVisible(long rowId) {
        enter(rowId);
        try {
            return walkChain(rowId);
        } finally {
            leave();
        }
    }

    /**
     * Whether a probe of this row found its slot physically absent.
     */
    public boolean wasMissing(long rowId) {
        return missing.contains(rowId);
    }

    public LongSet missingRows() {
        return LongSets.unmodifiable(missing);
    }

    public long fastPathHits() {
        return fastPathHits;
    }

    public long slowPathProbes() {
        return slowPathProbes;
    }

    /**
     * A new cursor on the same heap and snapshot, sharing no scratch state with this one.
     */
    public VisibilityChecker copy() {
        return new VisibilityChecker(heap, transactions, snapshot, rule, cancellation);
    }

    private HeapTuple walkChain(long rowId) {
        slowPathProbes++;
        long current = rowId;
        for (int hops = 0; hops < MAX_CHAIN_LENGTH; hops++) {
            HeapTuple tuple = heap.fetch(current);
            if (tuple == null) {
                if (hops == 0) {
                    missing.add(rowId);
                }
                return null;
            }
            if (tuple.isRedirect()) {
                current = tuple.nextVersion();
                continue;
            }
            if (TupleVisibility.satisfies(tuple, rule, snapshot, transactions)) {
                return tuple;
            }
            if (!tuple.isHotUpdated() || tuple.nextVersion() == RowIds.INVALID) {
                return null;
            }
            current = tuple.nextVersion();
        }
        log.warn("Version chain starting at {} in {} is too long, treat as invisible", RowIds.toString(rowId), heap.name());
        return null;
    }

    private void enter(long rowId) {
        cancellation.checkForInterrupts();
        Preconditions.checkState(state == State.IDLE,
                "visibility checker is already probing %s, it is not meant to be shared", RowIds.toString(probing));
        state = State.PROBING;
        probing = rowId;
    }

    private void leave() {
        state = State.IDLE;
        probing = RowIds.INVALID;
    }
}
