package io.mvccstore.segment.storage;

import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SegmentStore;
import io.mvccstore.segment.TestIndex;

public class SegmentRecyclerTest {

    private static void drop(TestIndex index, SegmentEntry entry) throws Exception {
        long xid = index.tx.begin();
        index.catalog.markDeleted(Collections.singletonList(entry.id()), xid);
        index.tx.commit(xid);
    }

    @Test
    public void liveSegmentsStay() throws Exception {
        TestIndex index = new TestIndex();
        index.flushSegments(3, 4);
        index.stageSegment(2);
        SegmentRecycler recycler = new SegmentRecycler(index.catalog);
        Assert.assertTrue(recycler.recycle().isEmpty());
        Assert.assertEquals(3, index.catalog.readEntries().size());
    }

    @Test
    public void pinnedSegmentIsKeptUntilTheScanEnds() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry entry = index.flushSegment(5);
        SegmentRecycler recycler = new SegmentRecycler(index.catalog);

        SegmentStore store = index.openStore();
        Assert.assertEquals(1, store.load().size());
        drop(index, entry);

        Assert.assertFalse(recycler.isRecyclable(index.catalog.read().find(entry.id())));
        Assert.assertTrue(recycler.recycle().isEmpty());
        Assert.assertTrue(index.catalog.exists(entry.id()));

        store.close();
        Assert.assertEquals(Collections.singletonList(entry.id()), recycler.recycle());
        Assert.assertFalse(index.catalog.exists(entry.id()));
        Assert.assertEquals(2, index.pages.allocatedPages());
    }

    @Test
    public void segmentOfAbortedWriterIsGarbage() throws Exception {
        TestIndex index = new TestIndex();
        long xid = index.tx.begin();
        SegmentEntry entry = index.writer.flush(xid, index.tx.snapshot(xid), index.insertRows(xid, 4));
        index.tx.abort(xid);

        List<SegmentId> recycled = new SegmentRecycler(index.catalog).recycle();
        Assert.assertEquals(Collections.singletonList(entry.id()), recycled);
    }

    @Test
    public void dropIsOnlyFinalOnceNoOlderTransactionRuns() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry entry = index.flushSegment(5);
        long old = index.tx.begin();
        drop(index, entry);

        SegmentRecycler recycler = new SegmentRecycler(index.catalog);
        Assert.assertTrue(recycler.recycle().isEmpty());

        index.tx.commit(old);
        Assert.assertEquals(1, recycler.recycle().size());
    }

    @Test
    public void dropByRunningTransactionIsNotFinal() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry entry = index.flushSegment(5);
        long xid = index.tx.begin();
        index.catalog.markDeleted(Collections.singletonList(entry.id()), xid);

        SegmentRecycler recycler = new SegmentRecycler(index.catalog);
        Assert.assertTrue(recycler.recycle().isEmpty());
        index.tx.abort(xid);
        Assert.assertTrue(recycler.recycle().isEmpty());
    }

    @Test
    public void segmentsBeingMergedAreSkipped() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry entry = index.flushSegment(5);
        drop(index, entry);
        index.catalog.beginMerge(Collections.singletonList(entry.id()));

        SegmentRecycler recycler = new SegmentRecycler(index.catalog);
        Assert.assertTrue(recycler.recycle().isEmpty());
        index.catalog.endMerge(Collections.singletonList(entry.id()));
        Assert.assertEquals(1, recycler.recycle().size());
    }
}
