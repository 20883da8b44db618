package io.mvccstore.segment.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;

import io.mvccstore.host.IndexRelation;
import io.mvccstore.host.TransactionStatus;
import io.mvccstore.segment.FileEntry;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;

/**
 * Frees the pages of segments nobody can see anymore and removes them from the segment list.
 *
 * A segment is recyclable when it was dropped by a committed transaction older than every running one, or created
 * by an aborted transaction, and no reader holds a pin on its pintest block.
 */
public class SegmentRecycler {
    private static final Logger logger = LoggerFactory.getLogger(SegmentRecycler.class);

    private final IndexRelation relation;
    private final SegmentCatalog catalog;

    public SegmentRecycler(SegmentCatalog catalog) {
        this.relation = catalog.relation();
        this.catalog = catalog;
    }

    public boolean isRecyclable(SegmentEntry entry) {
        TransactionStatus tx = relation.transactions();
        boolean dead;
        if (tx.isAborted(entry.xmin())) {
            dead = true;
        } else {
            dead = entry.isDeleted()
                    && tx.isCommitted(entry.xmax())
                    && entry.xmax() < tx.oldestRunningXid();
        }
        return dead && relation.pages().tryCleanup(entry.pintestBlock());
    }

    /**
     * @return the ids of the recycled segments.
     */
    public List<SegmentId> recycle() throws IOException {
        List<SegmentId> recycled = new ArrayList<>();
        // Hold the write lock so that no reader can pin a segment between the check and the removal.
        Lock lock = relation.metaLock().writeLock();
        lock.lock();
        try {
            CatalogState state = catalog.read();
            for (SegmentEntry entry : state.entries) {
                if (state.mergeList.contains(entry.id()) || !isRecyclable(entry)) {
                    continue;
                }
                catalog.remove(entry.id());
                for (FileEntry f : entry.content().ownedFiles()) {
                    catalog.pageChain().free(f);
                }
                recycled.add(entry.id());
                logger.debug("Recycled {}", entry);
            }
        } finally {
            lock.unlock();
        }
        if (!recycled.isEmpty()) {
            logger.info("Recycled {} segments of {}", recycled.size(), relation);
        }
        return recycled;
    }
}
