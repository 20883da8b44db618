package io.mvccstore.segment;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import io.mvccstore.host.IndexRelation;
import io.mvccstore.host.Snapshot;
import io.mvccstore.host.mem.MemoryHeap;
import io.mvccstore.host.mem.MemoryPageStorage;
import io.mvccstore.host.mem.MemoryTransactions;
import io.mvccstore.segment.snapshot.SnapshotMode;
import io.mvccstore.segment.storage.PageChain;
import io.mvccstore.segment.storage.SegmentCatalog;
import io.mvccstore.segment.storage.SegmentWriter;

/**
 * An index over an in-memory heap, with helpers to create segments of generated rows.
 *
 * Row i of a segment has fields {@code id} (unique over the index), {@code group} ("g0" to "g2") and
 * {@code value} (= id).
 */
public class TestIndex {
    public final MemoryTransactions tx = new MemoryTransactions();
    public final MemoryHeap heap;
    public final MemoryPageStorage pages;
    public final IndexRelation relation;
    public final SegmentCatalog catalog;
    public final SegmentWriter writer;

    private final AtomicLong nextId = new AtomicLong(0);

    public TestIndex() {
        this(8192, 64);
    }

    public TestIndex(int pageSize, int tuplesPerBlock) {
        this.heap = new MemoryHeap("test_heap", tuplesPerBlock);
        this.pages = new MemoryPageStorage(pageSize);
        this.relation = new IndexRelation("test_idx", heap, pages, tx);
        this.catalog = new SegmentCatalog(relation);
        this.writer = new SegmentWriter(catalog);
    }

    public static Map<String, Object> row(Object... kvs) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < kvs.length; i += 2) {
            row.put((String) kvs[i], kvs[i + 1]);
        }
        return row;
    }

    public Map<String, Object> nextRow() {
        long id = nextId.getAndIncrement();
        return row("id", id, "group", "g" + (id % 3), "value", id);
    }

    public long[] insertRows(long xid, int count) {
        long[] rowIds = new long[count];
        for (int i = 0; i < count; i++) {
            rowIds[i] = heap.insert(xid, nextRow());
        }
        return rowIds;
    }

    /**
     * Insert rows and flush them into a persisted segment, in one committed transaction.
     */
    public SegmentEntry flushSegment(int numRows) throws IOException {
        long xid = tx.begin();
        SegmentEntry entry = writer.flush(xid, tx.snapshot(xid), insertRows(xid, numRows));
        tx.commit(xid);
        return entry;
    }

    /**
     * Insert rows and stage them as a memory segment, in one committed transaction.
     */
    public SegmentEntry stageSegment(int numRows) throws IOException {
        long xid = tx.begin();
        SegmentEntry entry = writer.stage(xid, tx.snapshot(xid), insertRows(xid, numRows));
        tx.commit(xid);
        return entry;
    }

    public List<SegmentEntry> flushSegments(int... sizes) throws IOException {
        List<SegmentEntry> entries = new ArrayList<>();
        for (int size : sizes) {
            entries.add(flushSegment(size));
        }
        return entries;
    }

    public Snapshot snapshot() {
        return tx.snapshot();
    }

    public SegmentStore openStore() {
        return SegmentStore.open(relation, SnapshotMode.SNAPSHOT, snapshot());
    }

    /**
     * Overwrite the payload of a page with garbage, keeping its header intact.
     */
    public void corruptPage(long block) throws IOException {
        byte[] page = pages.read(block);
        ByteBuffer buffer = ByteBuffer.wrap(page);
        buffer.getLong();
        int len = buffer.getInt();
        Arrays.fill(page, PageChain.HEADER_SIZE, PageChain.HEADER_SIZE + len, (byte) '#');
        pages.write(block, page);
    }
}
