package io.mvccstore.segment.storage;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.mvccstore.segment.CancellationFlag;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SegmentSet;
import io.mvccstore.segment.SegmentStore;
import io.mvccstore.segment.TestIndex;
import io.mvccstore.segment.index.SegmentIndex;
import io.mvccstore.segment.index.SegmentReader;
import io.mvccstore.segment.index.StoredDocument;

public class SegmentMergerTest {

    @Test
    public void liveDocsAreMergedIntoOneSegment() throws Exception {
        TestIndex index = new TestIndex();
        List<SegmentEntry> persisted = index.flushSegments(5, 6, 7);
        SegmentEntry staged = index.stageSegment(3);
        index.catalog.saveDeletes(persisted.get(0).id(), new int[]{0});
        // Pruned after staging, so it ends up a tombstone of the memory segment.
        index.heap.prune(index.heap.allRowIds().get(20));

        long xid = index.tx.begin();
        SegmentEntry merged = new SegmentMerger(index.catalog).merge(xid, index.tx.snapshot(xid), 2, new CancellationFlag());
        index.tx.commit(xid);

        Assert.assertNotNull(merged);
        Assert.assertTrue(merged.isPersisted());
        Assert.assertEquals(19, merged.numDocs());
        Assert.assertTrue(index.catalog.mergeList().isEmpty());
        Assert.assertTrue(index.catalog.read().find(staged.id()).isDeleted());

        try (SegmentStore store = index.openStore()) {
            SegmentSet set = store.load();
            Assert.assertEquals(1, set.size());
            SegmentIndex segment = SegmentReader.open(store, merged.id());
            Assert.assertEquals(19, segment.numDocs());
            Assert.assertEquals(0, segment.numDeleted());
            for (int docId = 0; docId < segment.numDocs(); docId++) {
                StoredDocument doc = segment.doc(docId);
                Assert.assertFalse(doc.tombstone);
                Assert.assertNotEquals(0L, ((Number) doc.field("id")).longValue());
                Assert.assertNotEquals(20L, ((Number) doc.field("id")).longValue());
            }
        }

        Assert.assertEquals(4, new SegmentRecycler(index.catalog).recycle().size());
        Assert.assertEquals(1, index.catalog.readEntries().size());
    }

    @Test
    public void hundredsOfSegmentsAreClaimedAndMergedAtOnce() throws Exception {
        TestIndex index = new TestIndex();
        int[] sizes = new int[300];
        Arrays.fill(sizes, 1);
        List<SegmentEntry> entries = index.flushSegments(sizes);
        List<SegmentId> ids = new ArrayList<>();
        for (SegmentEntry e : entries) {
            ids.add(e.id());
        }

        int pagesBefore = index.pages.allocatedPages();
        Assert.assertTrue(index.catalog.beginMerge(ids));
        Assert.assertEquals(300, index.catalog.mergeList().size());
        index.catalog.endMerge(ids);
        Assert.assertTrue(index.catalog.mergeList().isEmpty());
        Assert.assertEquals(pagesBefore, index.pages.allocatedPages());

        long xid = index.tx.begin();
        SegmentEntry merged = new SegmentMerger(index.catalog).merge(xid, index.tx.snapshot(xid), 2, new CancellationFlag());
        index.tx.commit(xid);
        Assert.assertNotNull(merged);
        Assert.assertEquals(300, merged.numDocs());
        Assert.assertTrue(index.catalog.mergeList().isEmpty());
        Assert.assertEquals(300, new SegmentRecycler(index.catalog).recycle().size());
        Assert.assertEquals(Collections.singletonList(merged.id()), index.catalog.allSegmentIds());
    }

    @Test
    public void tooFewSegments() throws Exception {
        TestIndex index = new TestIndex();
        index.flushSegments(5, 6);
        long xid = index.tx.begin();
        SegmentMerger merger = new SegmentMerger(index.catalog);
        Assert.assertNull(merger.merge(xid, index.tx.snapshot(xid), 3, new CancellationFlag()));
        index.tx.commit(xid);
        Assert.assertEquals(2, index.catalog.readEntries().size());
    }

    @Test
    public void claimedSegmentsAreNotMergedTwice() throws Exception {
        TestIndex index = new TestIndex();
        List<SegmentEntry> entries = index.flushSegments(5, 6, 7);
        index.catalog.beginMerge(Arrays.asList(entries.get(0).id(), entries.get(1).id()));

        long xid = index.tx.begin();
        Assert.assertNull(new SegmentMerger(index.catalog).merge(xid, index.tx.snapshot(xid), 2, new CancellationFlag()));
        index.tx.commit(xid);
        Assert.assertEquals(2, index.catalog.mergeList().size());
    }
}
