package io.mvccstore.segment.parallel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;

import io.mvccstore.host.IndexRelation;
import io.mvccstore.host.Snapshot;
import io.mvccstore.segment.CancellationFlag;
import io.mvccstore.segment.ScanCancelledException;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SegmentSet;
import io.mvccstore.segment.SegmentStore;
import io.mvccstore.segment.aggregate.AggregationSpec;
import io.mvccstore.segment.aggregate.IntermediateResult;
import io.mvccstore.segment.aggregate.SegmentCollector;
import io.mvccstore.segment.snapshot.SnapshotMode;
import io.mvccstore.util.JsonUtil;

/**
 * One participant of a parallel aggregation: a background worker, the leader, or the only participant of a
 * sequential run. It claims its share of the segments, opens its own store over exactly those, and folds them into
 * a partial result.
 */
public class ParallelAggregationWorker {
    private static final Logger logger = LoggerFactory.getLogger(ParallelAggregationWorker.class);

    private final ParallelAggregationState state;
    private final IndexRelation relation;
    private final Snapshot snapshot;
    private final SnapshotMode baseMode;
    private final AggregationSpec spec;
    private final List<SegmentClaim> claims;
    private final int bucketLimit;
    private final CancellationFlag cancellation;

    public ParallelAggregationWorker(ParallelAggregationState state,
                                     IndexRelation relation,
                                     Snapshot snapshot,
                                     SnapshotMode baseMode,
                                     byte[] specBytes,
                                     List<SegmentClaim> claims,
                                     int bucketLimit,
                                     CancellationFlag cancellation) throws IOException {
        this.state = state;
        this.relation = relation;
        this.snapshot = snapshot;
        this.baseMode = baseMode;
        this.spec = JsonUtil.fromJsonBytes(specBytes, AggregationSpec.class);
        this.claims = claims;
        this.bucketLimit = bucketLimit;
        this.cancellation = cancellation;
    }

    /**
     * Claim this worker's share: up to its chunk of the segments, fewer if others were quicker.
     */
    public Set<SegmentId> checkoutSegments(int workerNumber) {
        int nworkers = state.launchedWorkers();
        ChunkRange share = ChunkRange.of(state.totalSegments(), nworkers, workerNumber);
        Set<SegmentId> ids = new LinkedHashSet<>();
        while (ids.size() < share.size) {
            SegmentId id = checkoutSegment();
            if (id == null) {
                break;
            }
            ids.add(id);
        }
        return ids;
    }

    /**
     * @return the next segment from the tail, or null if none is left.
     */
    public SegmentId checkoutSegment() {
        int idx = state.checkout();
        return idx == ParallelAggregationState.NONE ? null : claims.get(idx).id;
    }

    /**
     * @return the partial result, or null if no segment was claimed.
     */
    public IntermediateResult executeAggregate(int workerNumber) throws IOException {
        Set<SegmentId> ids = checkoutSegments(workerNumber);
        if (ids.isEmpty()) {
            return null;
        }
        long start = System.currentTimeMillis();
        IntermediateResult result = new IntermediateResult();
        try (SegmentStore store = SegmentStore.open(relation, SnapshotMode.parallelWorker(baseMode, ids), snapshot, cancellation)) {
            SegmentSet set = store.load();
            SegmentCollector collector = new SegmentCollector(store, spec, bucketLimit);
            for (SegmentEntry entry : set) {
                cancellation.checkForInterrupts();
                collector.collect(entry.id(), result);
            }
        }
        logger.debug("Worker #{}: collected {} in {} ms", workerNumber, ids, System.currentTimeMillis() - start);
        return result;
    }

    /**
     * The body of a background worker. Never throws, the outcome always goes to {@code out}.
     */
    public void run(int workerNumber, BlockingQueue<WorkerMessage> out, int faultUnwrapDepth) {
        WorkerMessage message;
        try {
            // The leader publishes the launched count only after all workers started.
            while (state.launchedWorkers() == 0) {
                cancellation.checkForInterrupts();
                Thread.yield();
            }
            IntermediateResult result = executeAggregate(workerNumber);
            message = result == null
                    ? WorkerMessage.empty(workerNumber)
                    : WorkerMessage.result(workerNumber, JsonUtil.toJsonBytes(result));
        } catch (ScanCancelledException e) {
            message = WorkerMessage.cancelled(workerNumber, cancellation.isCancelled() ? cancellation.reason() : e.getMessage());
        } catch (Throwable t) {
            String fault = FaultMessages.describe(t, faultUnwrapDepth);
            logger.warn("Parallel worker #{} of {} failed: {}", workerNumber, relation, fault, t);
            message = WorkerMessage.fault(workerNumber, fault);
        }
        out.add(message);
    }
}
