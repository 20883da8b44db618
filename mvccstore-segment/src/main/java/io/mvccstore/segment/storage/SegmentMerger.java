package io.mvccstore.segment.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import io.mvccstore.host.Snapshot;
import io.mvccstore.segment.CancellationFlag;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SegmentSet;
import io.mvccstore.segment.SegmentStore;
import io.mvccstore.segment.index.SegmentBuilder;
import io.mvccstore.segment.index.SegmentIndex;
import io.mvccstore.segment.index.SegmentReader;
import io.mvccstore.segment.index.StoredDocument;
import io.mvccstore.segment.snapshot.SnapshotMode;

/**
 * Merges all mergeable segments into one, dropping deleted docs. The merged segments are marked deleted by the same
 * transaction which creates the new one, so that either both changes are visible or neither.
 */
public class SegmentMerger {
    private static final Logger logger = LoggerFactory.getLogger(SegmentMerger.class);

    private final SegmentCatalog catalog;
    private final SegmentWriter writer;

    public SegmentMerger(SegmentCatalog catalog) {
        this.catalog = catalog;
        this.writer = new SegmentWriter(catalog);
    }

    /**
     * @param minSegments do nothing if fewer segments are mergeable.
     * @return the new segment, or null if nothing was merged.
     */
    public SegmentEntry merge(long xid, Snapshot snapshot, int minSegments, CancellationFlag cancellation) throws IOException {
        try (SegmentStore store = SegmentStore.open(catalog, SnapshotMode.MERGEABLE, snapshot, cancellation)) {
            SegmentSet set = store.load();
            if (set.size() < Math.max(2, minSegments)) {
                return null;
            }
            List<SegmentId> ids = new ArrayList<>(set.size());
            for (SegmentEntry e : set) {
                ids.add(e.id());
            }
            if (!catalog.beginMerge(ids)) {
                logger.info("Segments of {} are being merged by someone else", catalog.relation());
                return null;
            }
            try {
                SegmentBuilder builder = new SegmentBuilder();
                for (SegmentId id : ids) {
                    cancellation.checkForInterrupts();
                    SegmentIndex index = SegmentReader.open(store, id);
                    for (int docId = 0; docId < index.numDocs(); docId++) {
                        StoredDocument doc = index.doc(docId);
                        if (!doc.tombstone && !index.isDeleted(docId)) {
                            builder.add(doc.rowId, doc.fields);
                        }
                    }
                }
                SegmentEntry merged = writer.writePersisted(xid, builder);
                catalog.markDeleted(ids, xid);
                logger.info("Merged {} segments of {} into {}", ids.size(), catalog.relation(), merged.id().shortId());
                return merged;
            } finally {
                catalog.endMerge(ids);
            }
        }
    }
}
