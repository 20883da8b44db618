package io.mvccstore.segment;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import io.mvccstore.segment.index.SegmentIndex;
import io.mvccstore.segment.index.SegmentReader;
import io.mvccstore.segment.snapshot.SnapshotMode;
import io.mvccstore.segment.snapshot.VisibilityRule;

public class SegmentStoreTest {

    @Test
    public void loadIsIdempotent() throws Exception {
        TestIndex index = new TestIndex();
        index.flushSegments(10, 50, 5);
        index.stageSegment(3);

        try (SegmentStore store = index.openStore()) {
            SegmentSet first = store.load();
            // Changes after the first load do not show up in this store.
            index.flushSegment(1);
            SegmentSet second = store.load();
            Assert.assertSame(first, second);
            Assert.assertEquals(4, second.size());
            Assert.assertEquals(4, store.pinnedBlocks());
        }
    }

    @Test
    public void loadOrdersCheapestFirstAndMemoryLast() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry mem = index.stageSegment(1);
        List<SegmentEntry> persisted = index.flushSegments(10, 50, 5, 20, 100);

        try (SegmentStore store = index.openStore()) {
            List<Long> sizes = new ArrayList<>();
            for (SegmentEntry e : store.load()) {
                sizes.add(e.numDocs());
            }
            Assert.assertEquals(Arrays.asList(5L, 10L, 20L, 50L, 100L, 1L), sizes);
            Assert.assertEquals(mem.id(), store.load().entries().get(5).id());
            Assert.assertFalse(store.load().entries().get(5).isPersisted());
            Assert.assertEquals(VisibilityRule.MVCC, store.load().rule());
            Assert.assertEquals(persisted.size() + 1, store.load().size());
        }
    }

    @Test
    public void pinsAreHeldUntilClose() throws Exception {
        TestIndex index = new TestIndex();
        List<SegmentEntry> entries = index.flushSegments(3, 4);

        SegmentStore store = index.openStore();
        store.load();
        for (SegmentEntry e : entries) {
            Assert.assertEquals(1, index.pages.pinCount(e.pintestBlock()));
            Assert.assertFalse(index.pages.tryCleanup(e.pintestBlock()));
        }
        store.close();
        store.close();
        for (SegmentEntry e : entries) {
            Assert.assertEquals(0, index.pages.pinCount(e.pintestBlock()));
            Assert.assertTrue(index.pages.tryCleanup(e.pintestBlock()));
        }
    }

    @Test
    public void segmentsOfUncommittedWritersAreInvisible() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry committed = index.flushSegment(3);
        long xid = index.tx.begin();
        SegmentEntry pending = index.writer.flush(xid, index.tx.snapshot(xid), index.insertRows(xid, 2));

        try (SegmentStore store = index.openStore()) {
            Assert.assertNotNull(store.load().get(committed.id()));
            Assert.assertNull(store.load().get(pending.id()));
            try {
                store.open(pending.id(), SegmentComponent.STORE);
                Assert.fail();
            } catch (SegmentNotFoundException e) {
                Assert.assertEquals(pending.id(), e.segmentId());
            }
            // Metadata access is not filtered by the snapshot.
            Map<SegmentId, SegmentEntry> all = store.allSegments();
            Assert.assertEquals(2, all.size());
            Assert.assertTrue(all.containsKey(pending.id()));
        }

        // The writer's own snapshot sees its segment.
        try (SegmentStore store = SegmentStore.open(index.relation, SnapshotMode.SNAPSHOT, index.tx.snapshot(xid))) {
            Assert.assertEquals(2, store.load().size());
        }
        index.tx.commit(xid);
    }

    @Test
    public void unknownSegmentIsNotFound() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry entry = index.flushSegment(2);
        try (SegmentStore store = index.openStore()) {
            try {
                store.open(SegmentId.generate(), SegmentComponent.STORE);
                Assert.fail();
            } catch (SegmentNotFoundException e) {
                Assert.assertTrue(e.getMessage().contains("Segment not found"));
            }
            // A segment without deletes has no DELETE component.
            Assert.assertFalse(store.hasComponent(entry.id(), SegmentComponent.DELETE));
            try {
                store.open(entry.id(), SegmentComponent.DELETE);
                Assert.fail();
            } catch (SegmentNotFoundException e) {
                Assert.assertEquals(entry.id(), e.segmentId());
            }
        }
    }

    @Test
    public void handlesAreCached() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry entry = index.flushSegment(5);
        try (SegmentStore store = index.openStore()) {
            SegmentFileHandle h1 = store.open(entry.id(), SegmentComponent.POSTINGS);
            SegmentFileHandle h2 = store.open(entry.id(), SegmentComponent.POSTINGS);
            Assert.assertSame(h1, h2);
            Assert.assertNotSame(h1, store.open(entry.id(), SegmentComponent.STORE));
        }
    }

    @Test
    public void persistedSegmentReadsBack() throws Exception {
        TestIndex index = new TestIndex(256, 16);
        SegmentEntry entry = index.flushSegment(40);
        try (SegmentStore store = index.openStore()) {
            SegmentIndex segment = SegmentReader.open(store, entry.id());
            Assert.assertEquals(40, segment.numDocs());
            Assert.assertEquals(0, segment.numDeleted());
            // Postings are keyed by normalized values, ints and longs meet.
            Assert.assertEquals(1, segment.postings("id", 7).length);
            Assert.assertEquals(1, segment.postings("id", 7L).length);
            Assert.assertEquals(14, segment.postings("group", "g0").length);
        }
    }

    @Test
    public void memorySegmentIsIndexedOncePerStore() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry entry = index.stageSegment(6);

        try (SegmentStore store = index.openStore()) {
            Assert.assertEquals(0, store.ephemeralBuilds());
            SegmentIndex segment = SegmentReader.open(store, entry.id());
            store.open(entry.id(), SegmentComponent.POSTINGS);
            SegmentReader.open(store, entry.id());
            Assert.assertEquals(1, store.ephemeralBuilds());
            Assert.assertEquals(6, segment.numDocs());
        }
        try (SegmentStore store = index.openStore()) {
            SegmentReader.open(store, entry.id());
            Assert.assertEquals(1, store.ephemeralBuilds());
        }
    }

    @Test
    public void memorySegmentIsIndexedAsOfItsStagingSnapshot() throws Exception {
        TestIndex index = new TestIndex();
        long xid = index.tx.begin();
        long[] rows = index.insertRows(xid, 3);
        long aborted = index.tx.begin();
        long abortedRow = index.heap.insert(aborted, TestIndex.row("id", -1L));
        index.tx.abort(aborted);
        long[] staged = Arrays.copyOf(rows, 4);
        staged[3] = abortedRow;
        SegmentEntry entry = index.writer.stage(xid, index.tx.snapshot(xid), staged);
        index.tx.commit(xid);

        // Physically removed before anyone read the segment.
        index.heap.prune(rows[2]);

        try (SegmentStore store = index.openStore()) {
            SegmentIndex segment = SegmentReader.open(store, entry.id());
            Assert.assertEquals(3, segment.numDocs());
            Assert.assertEquals(1, segment.numDeleted());
            Assert.assertTrue(segment.doc(2).tombstone);
            Assert.assertTrue(segment.isDeleted(2));
            Assert.assertEquals(rows[0], segment.doc(0).rowId);
        }
    }

    @Test
    public void materializationFailureAbortsOnlyTheRead() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry persisted = index.flushSegment(4);
        SegmentEntry mem = index.stageSegment(4);
        index.corruptPage(((MemoryContent) mem.content()).stagedRows().startingBlock);

        try (SegmentStore store = index.openStore()) {
            try {
                store.open(mem.id(), SegmentComponent.STORE);
                Assert.fail();
            } catch (SegmentMaterializationException e) {
                Assert.assertTrue(e.getCause() instanceof IOException);
            }
            Assert.assertEquals(4, SegmentReader.open(store, persisted.id()).numDocs());
            Assert.assertEquals(2, store.pinnedBlocks());
        }
        Assert.assertEquals(0, index.pages.pinCount(mem.pintestBlock()));
    }

    @Test
    public void cancelledStoreStopsMaterialization() throws Exception {
        TestIndex index = new TestIndex();
        SegmentEntry mem = index.stageSegment(4);
        CancellationFlag flag = new CancellationFlag();
        try (SegmentStore store = SegmentStore.open(index.relation, SnapshotMode.SNAPSHOT, index.snapshot(), flag)) {
            store.load();
            flag.cancel("user request");
            try {
                store.open(mem.id(), SegmentComponent.STORE);
                Assert.fail();
            } catch (ScanCancelledException e) {
                Assert.assertEquals("canceling statement: user request", e.getMessage());
            }
        }
    }
}
