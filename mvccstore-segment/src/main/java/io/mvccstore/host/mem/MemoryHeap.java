package io.mvccstore.host.mem;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.mvccstore.host.HeapAccess;
import io.mvccstore.host.HeapTuple;
import io.mvccstore.host.RowIds;
import io.mvccstore.host.TransactionStatus;

/**
 * A heap relation kept in memory, with a per-block visibility summary.
 *
 * Any modification of a block clears its all-visible bit. The bit is only set again by
 * {@link #updateVisibilitySummary(TransactionStatus)}, the way the host's vacuum maintains its visibility map.
 */
public class MemoryHeap implements HeapAccess {
    private static final Logger log = LoggerFactory.getLogger(MemoryHeap.class);

    private final String name;
    private final int tuplesPerBlock;
    private final Map<Long, Block> blocks = new ConcurrentHashMap<>();
    private long lastBlock = -1;

    private static class Block {
        final HeapTuple[] slots;
        int used;
        volatile boolean allVisible;

        Block(int capacity) {
            this.slots = new HeapTuple[capacity];
        }
    }

    public MemoryHeap(String name, int tuplesPerBlock) {
        Preconditions.checkArgument(tuplesPerBlock > 0 && tuplesPerBlock <= RowIds.MAX_OFFSET);
        this.name = name;
        this.tuplesPerBlock = tuplesPerBlock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public HeapTuple fetch(long rowId) {
        Block block = blocks.get(RowIds.block(rowId));
        if (block == null) {
            return null;
        }
        int offset = RowIds.offset(rowId);
        synchronized (block) {
            return offset < block.slots.length ? block.slots[offset] : null;
        }
    }

    @Override
    public boolean isAllVisible(long block) {
        Block b = blocks.get(block);
        return b != null && b.allVisible;
    }

    public synchronized long insert(long xid, Map<String, Object> fields) {
        long blockNo = lastBlock;
        Block block = blockNo < 0 ? null : blocks.get(blockNo);
        if (block == null || block.used == tuplesPerBlock) {
            blockNo = ++lastBlock;
            block = new Block(tuplesPerBlock);
            blocks.put(blockNo, block);
        }
        return put(blockNo, block, xid, fields);
    }

    public synchronized void delete(long xid, long rowId) {
        HeapTuple tuple = liveTuple(rowId);
        setSlot(rowId, tuple.withXmax(xid, RowIds.INVALID, false));
    }

    /**
     * Write a new version of the row.
     *
     * @param hot keep the new version on the same block as a heap-only tuple, only honoured if there is room.
     * @return the row id of the new version.
     */
    public synchronized long update(long xid, long rowId, Map<String, Object> fields, boolean hot) {
        HeapTuple old = liveTuple(rowId);
        long blockNo = RowIds.block(rowId);
        Block block = blocks.get(blockNo);
        long newRowId;
        boolean isHot = hot && block.used < tuplesPerBlock;
        if (isHot) {
            newRowId = put(blockNo, block, xid, fields);
        } else {
            newRowId = insert(xid, fields);
        }
        setSlot(rowId, old.withXmax(xid, newRowId, isHot));
        return newRowId;
    }

    /**
     * Physically remove a slot.
     */
    public synchronized void prune(long rowId) {
        setSlot(rowId, null);
    }

    /**
     * Replace the root of a version chain by a redirect to the surviving version.
     */
    public synchronized void redirect(long rowId, long target) {
        setSlot(rowId, HeapTuple.redirect(rowId, target));
    }

    /**
     * Set the all-visible bit of every block whose tuples are all inserted by committed transactions older than
     * any running one and never deleted.
     *
     * @return the number of blocks marked.
     */
    public int updateVisibilitySummary(TransactionStatus transactions) {
        return updateVisibilitySummary(transactions, Long.MAX_VALUE);
    }

    /**
     * Like {@link #updateVisibilitySummary(TransactionStatus)}, but never trusts transactions at or above
     * {@code horizonXid} either, e.g. the xmin of the oldest snapshot still in use by a read-only statement.
     */
    public synchronized int updateVisibilitySummary(TransactionStatus transactions, long horizonXid) {
        long horizon = Math.min(transactions.oldestRunningXid(), horizonXid);
        int marked = 0;
        for (Block block : blocks.values()) {
            synchronized (block) {
                boolean allVisible = true;
                for (int i = 0; i < block.used; i++) {
                    HeapTuple t = block.slots[i];
                    if (t == null || t.isRedirect()) {
                        continue;
                    }
                    if (t.xmax() != HeapTuple.INVALID_XID
                            || !transactions.isCommitted(t.xmin())
                            || t.xmin() >= horizon) {
                        allVisible = false;
                        break;
                    }
                }
                if (allVisible && !block.allVisible) {
                    block.allVisible = true;
                    marked++;
                }
            }
        }
        log.debug("heap {}: {} blocks marked all visible", name, marked);
        return marked;
    }

    public synchronized List<Long> allRowIds() {
        List<Long> ids = new ArrayList<>();
        for (long b = 0; b <= lastBlock; b++) {
            Block block = blocks.get(b);
            synchronized (block) {
                for (int i = 0; i < block.used; i++) {
                    if (block.slots[i] != null && !block.slots[i].isRedirect()) {
                        ids.add(RowIds.encode(b, i));
                    }
                }
            }
        }
        return ids;
    }

    private long put(long blockNo, Block block, long xid, Map<String, Object> fields) {
        synchronized (block) {
            int offset = block.used++;
            long rowId = RowIds.encode(blockNo, offset);
            block.slots[offset] = new HeapTuple(rowId, xid, HeapTuple.INVALID_XID, RowIds.INVALID, false, fields);
            block.allVisible = false;
            return rowId;
        }
    }

    private HeapTuple liveTuple(long rowId) {
        HeapTuple tuple = fetch(rowId);
        Preconditions.checkState(tuple != null && !tuple.isRedirect(), "no tuple at %s", RowIds.toString(rowId));
        Preconditions.checkState(tuple.xmax() == HeapTuple.INVALID_XID, "tuple %s already deleted", RowIds.toString(rowId));
        return tuple;
    }

    private void setSlot(long rowId, HeapTuple tuple) {
        Block block = blocks.get(RowIds.block(rowId));
        Preconditions.checkState(block != null, "no block for %s", RowIds.toString(rowId));
        synchronized (block) {
            block.slots[RowIds.offset(rowId)] = tuple;
            block.allVisible = false;
        }
    }
}
