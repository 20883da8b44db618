package io.mvccstore.segment.index;

import java.io.IOException;

import io.mvccstore.segment.SegmentComponent;
import io.mvccstore.segment.SegmentFileHandle;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SegmentStore;

/**
 * Opens segments of a store as {@link SegmentIndex}.
 */
public class SegmentReader {

    /**
     * @throws io.mvccstore.segment.SegmentNotFoundException if the segment is not visible to the store.
     */
    public static SegmentIndex open(SegmentStore store, SegmentId id) throws IOException {
        SegmentFileHandle docs = store.open(id, SegmentComponent.STORE);
        SegmentFileHandle postings = store.open(id, SegmentComponent.POSTINGS);
        SegmentFileHandle deletes = store.hasComponent(id, SegmentComponent.DELETE)
                ? store.open(id, SegmentComponent.DELETE)
                : null;
        return SegmentIndex.read(id, docs, postings, deletes);
    }
}
