package io.mvccstore.segment;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Write side of the segment list.
 */
public interface SegmentManager {
    boolean exists(SegmentId id) throws IOException;

    List<SegmentId> allSegmentIds() throws IOException;

    /**
     * Add a segment into the list. Its pages must be written already.
     */
    void add(SegmentEntry entry) throws IOException;

    /**
     * Mark segments as dropped by the transaction. They stay readable for older snapshots until recycled.
     */
    void markDeleted(Collection<SegmentId> ids, long xid) throws IOException;

    /**
     * Remove a segment from the list. Only the reclamation pass calls it, after freeing the pages.
     */
    void remove(SegmentId id) throws IOException;
}
