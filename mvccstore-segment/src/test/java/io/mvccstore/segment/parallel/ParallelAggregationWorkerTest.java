package io.mvccstore.segment.parallel;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;

import io.mvccstore.segment.CancellationFlag;
import io.mvccstore.segment.PersistedContent;
import io.mvccstore.segment.SegmentComponent;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SegmentSet;
import io.mvccstore.segment.SegmentStore;
import io.mvccstore.segment.TestIndex;
import io.mvccstore.segment.aggregate.AggregationSpec;
import io.mvccstore.segment.aggregate.IntermediateResult;
import io.mvccstore.segment.aggregate.MetricSpec;
import io.mvccstore.segment.snapshot.SnapshotMode;
import io.mvccstore.util.JsonUtil;

public class ParallelAggregationWorkerTest {
    private final AggregationSpec spec = new AggregationSpec(null, null, Collections.singletonList(MetricSpec.count("n")), 0);

    private TestIndex index;
    private SegmentStore store;
    private List<SegmentEntry> ordered;
    private List<SegmentClaim> claims;

    @Before
    public void setUp() throws Exception {
        index = new TestIndex();
        index.flushSegments(10, 50, 5, 20, 100);
        index.stageSegment(3);
        store = index.openStore();
        SegmentSet set = store.load();
        ordered = set.entries();
        claims = new ArrayList<>();
        for (SegmentEntry e : ordered) {
            claims.add(SegmentClaim.of(e));
        }
    }

    private ParallelAggregationWorker worker(ParallelAggregationState state, CancellationFlag flag) throws Exception {
        return new ParallelAggregationWorker(state, index.relation, store.snapshot(), SnapshotMode.SNAPSHOT,
                JsonUtil.toJsonBytes(spec), claims, 1000, flag);
    }

    private List<SegmentId> ids(int... positions) {
        List<SegmentId> ids = new ArrayList<>();
        for (int p : positions) {
            ids.add(ordered.get(p).id());
        }
        return ids;
    }

    @Test
    public void workersClaimTheirShareFromTheTail() throws Exception {
        List<Long> sizes = new ArrayList<>();
        for (SegmentEntry e : ordered) {
            sizes.add(e.numDocs());
        }
        Assert.assertEquals(Arrays.asList(5L, 10L, 20L, 50L, 100L, 3L), sizes);
        Assert.assertFalse(ordered.get(5).isPersisted());

        ParallelAggregationState state = new ParallelAggregationState(ordered.size());
        state.setLaunchedWorkers(3);
        CancellationFlag flag = new CancellationFlag();

        Assert.assertEquals(ids(5, 4), new ArrayList<>(worker(state, flag).checkoutSegments(0)));
        Assert.assertEquals(ids(3, 2), new ArrayList<>(worker(state, flag).checkoutSegments(1)));
        Assert.assertEquals(ids(1, 0), new ArrayList<>(worker(state, flag).checkoutSegments(2)));
        Assert.assertTrue(worker(state, flag).checkoutSegments(0).isEmpty());
        Assert.assertNull(worker(state, flag).checkoutSegment());
    }

    @Test
    public void quickWorkerCanNotTakeMoreThanItsShare() throws Exception {
        ParallelAggregationState state = new ParallelAggregationState(ordered.size());
        state.setLaunchedWorkers(4);
        ParallelAggregationWorker worker = worker(state, new CancellationFlag());
        // 6 over 4: the first two shares hold 2 segments, the last two hold 1.
        Assert.assertEquals(1, worker.checkoutSegments(3).size());
        Assert.assertEquals(2, worker.checkoutSegments(0).size());
        Assert.assertEquals(3, state.remainingSegments());
    }

    @Test
    public void workerAggregatesItsClaimedSegments() throws Exception {
        ParallelAggregationState state = new ParallelAggregationState(ordered.size());
        state.setLaunchedWorkers(3);
        CancellationFlag flag = new CancellationFlag();

        IntermediateResult first = worker(state, flag).executeAggregate(0);
        Assert.assertEquals(103, first.docCount());
        Assert.assertEquals(2, first.segmentCount());

        IntermediateResult second = worker(state, flag).executeAggregate(1);
        Assert.assertEquals(70, second.docCount());
        IntermediateResult third = worker(state, flag).executeAggregate(2);
        Assert.assertEquals(15, third.docCount());
        Assert.assertNull(worker(state, flag).executeAggregate(0));

        // Worker stores are closed, only the test's own store pins remain.
        for (SegmentEntry e : ordered) {
            Assert.assertEquals(1, index.pages.pinCount(e.pintestBlock()));
        }
    }

    @Test
    public void runSendsExactlyOneMessage() throws Exception {
        ParallelAggregationState state = ParallelAggregationState.sequential(ordered.size());
        LinkedBlockingQueue<WorkerMessage> queue = new LinkedBlockingQueue<>();

        worker(state, new CancellationFlag()).run(0, queue, 8);
        Assert.assertEquals(1, queue.size());
        WorkerMessage message = queue.poll();
        Assert.assertEquals(WorkerMessage.Kind.RESULT, message.kind);
        Assert.assertEquals(188, JsonUtil.fromJsonBytes(message.payload, IntermediateResult.class).docCount());

        worker(state, new CancellationFlag()).run(0, queue, 8);
        Assert.assertEquals(WorkerMessage.Kind.EMPTY, queue.poll().kind);
    }

    @Test
    public void cancelledWorkerReportsCancellation() throws Exception {
        ParallelAggregationState state = new ParallelAggregationState(ordered.size());
        CancellationFlag flag = new CancellationFlag();
        flag.cancel("leader gave up");
        LinkedBlockingQueue<WorkerMessage> queue = new LinkedBlockingQueue<>();

        // Never published: the worker must not spin forever.
        worker(state, flag).run(1, queue, 8);
        WorkerMessage message = queue.poll();
        Assert.assertEquals(WorkerMessage.Kind.CANCELLED, message.kind);
        Assert.assertEquals("leader gave up", message.fault);
        Assert.assertEquals(1, message.workerNumber);
        Assert.assertEquals(ordered.size(), state.remainingSegments());
    }

    @Test
    public void faultIsReported() throws Exception {
        index.corruptPage(((PersistedContent) ordered.get(4).content())
                .file(SegmentComponent.STORE).startingBlock);
        ParallelAggregationState state = ParallelAggregationState.sequential(ordered.size());
        LinkedBlockingQueue<WorkerMessage> queue = new LinkedBlockingQueue<>();

        worker(state, new CancellationFlag()).run(0, queue, 8);
        WorkerMessage message = queue.poll();
        Assert.assertEquals(WorkerMessage.Kind.FAULT, message.kind);
        Assert.assertNotNull(message.fault);
        Assert.assertFalse(message.fault.startsWith(FaultMessages.UNKNOWN));
    }
}
