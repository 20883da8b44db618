package io.mvccstore.segment.parallel;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import io.mvccstore.segment.CancellationFlag;
import io.mvccstore.segment.ScanCancelledException;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentSet;
import io.mvccstore.segment.SegmentStore;
import io.mvccstore.segment.aggregate.AggregationResult;
import io.mvccstore.segment.aggregate.AggregationSpec;
import io.mvccstore.segment.aggregate.IntermediateResult;
import io.mvccstore.segment.aggregate.SegmentCollector;
import io.mvccstore.segment.snapshot.SnapshotMode;
import io.mvccstore.util.JsonUtil;

/**
 * Runs an aggregation over the segments of a store, fanned out over background workers when it pays off.
 *
 * The leader plans the worker count, launches what the worker pool grants, publishes the launched count (itself
 * included when it participates) and collects one partial result per participant. If no worker could be launched
 * the same checkout loop runs in the calling thread alone.
 *
 * A failed or cancelled execution cancels only its own participants, the store stays usable.
 */
public class ParallelAggregation {
    private static final Logger logger = LoggerFactory.getLogger(ParallelAggregation.class);

    private final SegmentStore store;
    private final AggregationSpec spec;
    private final ParallelOptions options;
    private CancellationFlag cancellation;

    private int lastLaunched;

    public ParallelAggregation(SegmentStore store, AggregationSpec spec, ParallelOptions options) {
        this.store = Preconditions.checkNotNull(store);
        this.spec = Preconditions.checkNotNull(spec);
        this.options = options == null ? ParallelOptions.defaults() : options;
    }

    public static AggregationResult run(SegmentStore store, AggregationSpec spec, ParallelOptions options) throws IOException {
        return new ParallelAggregation(store, spec, options).execute();
    }

    /**
     * How many background workers to ask for: one per segment up to the max, one less if the leader takes a share.
     */
    public static int plannedWorkers(int nsegments, ParallelOptions options) {
        int nworkers = Math.min(options.maxWorkers, nsegments);
        if (options.leaderParticipation && nworkers > 0) {
            nworkers--;
        }
        return nworkers;
    }

    public static boolean canParallelize(int nsegments, ParallelOptions options) {
        return plannedWorkers(nsegments, options) > 0 && nsegments > 1;
    }

    /**
     * Participants of the last execution, leader included. 1 for a sequential run.
     */
    public int lastLaunched() {
        return lastLaunched;
    }

    public AggregationResult execute() throws IOException {
        return AggregationResult.finish(spec, executeIntermediate());
    }

    public IntermediateResult executeIntermediate() throws IOException {
        cancellation = new CancellationFlag(store.cancellation());
        SegmentSet set = store.load();
        if (!isSplittable(set.mode())) {
            logger.debug("Mode {} can not be split, collect in place", set.mode());
            lastLaunched = 1;
            return collectInPlace(set);
        }
        List<SegmentClaim> claims = new ArrayList<>(set.size());
        for (SegmentEntry e : set) {
            claims.add(SegmentClaim.of(e));
        }
        byte[] specBytes = JsonUtil.toJsonBytes(spec);
        if (canParallelize(claims.size(), options)) {
            IntermediateResult merged = executeParallel(set.mode(), claims, specBytes, plannedWorkers(claims.size(), options));
            if (merged != null) {
                return merged;
            }
        }
        return executeSequential(set.mode(), claims, specBytes);
    }

    /**
     * @return the merged result, or null if no worker could be launched.
     */
    private IntermediateResult executeParallel(SnapshotMode mode,
                                               List<SegmentClaim> claims,
                                               byte[] specBytes,
                                               int nworkers) throws IOException {
        logger.debug("Requesting {} parallel workers for {} segments, leader participation {}",
                nworkers, claims.size(), options.leaderParticipation);
        ParallelAggregationState state = new ParallelAggregationState(claims.size());
        BlockingQueue<WorkerMessage> messages = new LinkedBlockingQueue<>();
        List<ParallelAggregationWorker> workers = new ArrayList<>(nworkers);
        for (int i = 0; i < nworkers; i++) {
            workers.add(newWorker(state, mode, claims, specBytes));
        }
        List<Future<?>> launched = options.pool.launch(nworkers, i -> () -> workers.get(i).run(i, messages, options.faultUnwrapDepth));
        if (launched.isEmpty()) {
            logger.info("No parallel worker available for {}, fall back to sequential execution", store.relation());
            return null;
        }

        int nlaunched = launched.size();
        int leaderNumber = nlaunched;
        if (options.leaderParticipation) {
            nlaunched++;
        }
        logger.debug("Launched {} parallel workers, {} participants", launched.size(), nlaunched);
        state.setLaunchedWorkers(nlaunched);
        lastLaunched = nlaunched;

        boolean done = false;
        try {
            IntermediateResult merged = new IntermediateResult();
            if (options.leaderParticipation) {
                IntermediateResult own = newWorker(state, mode, claims, specBytes).executeAggregate(leaderNumber);
                if (own != null) {
                    merged.merge(own, options.bucketLimit);
                }
            }
            for (int received = 0; received < launched.size(); ) {
                WorkerMessage message = poll(messages);
                if (message == null) {
                    continue;
                }
                received++;
                switch (message.kind) {
                    case RESULT:
                        merged.merge(JsonUtil.fromJsonBytes(message.payload, IntermediateResult.class), options.bucketLimit);
                        break;
                    case EMPTY:
                        break;
                    case CANCELLED:
                        throw new ScanCancelledException(message.fault);
                    case FAULT:
                        throw new ParallelScanException(message.workerNumber, message.fault);
                    default:
                        throw new IllegalStateException("Unknown worker message " + message.kind);
                }
            }
            done = true;
            return merged;
        } finally {
            if (!done) {
                cancellation.cancel("parallel aggregation aborted");
            }
            awaitWorkers(launched);
        }
    }

    private IntermediateResult executeSequential(SnapshotMode mode, List<SegmentClaim> claims, byte[] specBytes) throws IOException {
        logger.debug("Executing aggregation sequentially over {} segments", claims.size());
        lastLaunched = 1;
        ParallelAggregationState state = ParallelAggregationState.sequential(claims.size());
        IntermediateResult result = newWorker(state, mode, claims, specBytes).executeAggregate(0);
        return result == null ? new IntermediateResult() : result;
    }

    private IntermediateResult collectInPlace(SegmentSet set) throws IOException {
        IntermediateResult result = new IntermediateResult();
        SegmentCollector collector = new SegmentCollector(store, spec, options.bucketLimit);
        for (SegmentEntry e : set) {
            cancellation.checkForInterrupts();
            collector.collect(e.id(), result);
        }
        return result;
    }

    private ParallelAggregationWorker newWorker(ParallelAggregationState state,
                                                SnapshotMode mode,
                                                List<SegmentClaim> claims,
                                                byte[] specBytes) throws IOException {
        return new ParallelAggregationWorker(
                state,
                store.relation(),
                store.snapshot(),
                mode,
                specBytes,
                claims,
                options.bucketLimit,
                cancellation);
    }

    private WorkerMessage poll(BlockingQueue<WorkerMessage> messages) {
        try {
            return messages.poll(200, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanCancelledException("interrupted while waiting for parallel workers");
        }
    }

    private void awaitWorkers(List<Future<?>> launched) {
        for (Future<?> f : launched) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                logger.warn("Parallel worker ended abnormally: {}",
                        FaultMessages.describe(e, options.faultUnwrapDepth));
            }
        }
    }

    private static boolean isSplittable(SnapshotMode mode) {
        switch (mode.kind()) {
            case SNAPSHOT:
            case VACUUM:
            case MERGEABLE:
                return true;
            default:
                return false;
        }
    }
}
