package io.mvccstore.segment.index;

import com.google.common.base.Preconditions;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.mvccstore.segment.SegmentFileHandle;
import io.mvccstore.segment.SegmentId;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * The decoded, searchable form of one segment.
 */
public class SegmentIndex {
    private static final int[] NO_DOCS = new int[0];

    private final SegmentId id;
    private final List<StoredDocument> docs;
    private final Map<String, int[]> postings;
    private final IntSet deleted;

    public SegmentIndex(SegmentId id, List<StoredDocument> docs, Map<String, int[]> postings, int[] deletedDocs) {
        this.id = id;
        this.docs = Collections.unmodifiableList(docs);
        this.postings = Collections.unmodifiableMap(postings);
        this.deleted = new IntOpenHashSet(deletedDocs);
        for (int i = 0; i < docs.size(); i++) {
            Preconditions.checkState(docs.get(i).docId == i, "doc ids of segment %s are not dense at %s", id, i);
        }
    }

    /**
     * @param deletes the DELETE component, or null if the segment has none.
     */
    public static SegmentIndex read(SegmentId id,
                                    SegmentFileHandle store,
                                    SegmentFileHandle postings,
                                    SegmentFileHandle deletes) throws IOException {
        return new SegmentIndex(
                id,
                SegmentComponents.decodeStore(store.readAll()),
                SegmentComponents.decodePostings(postings.readAll()),
                deletes == null ? NO_DOCS : SegmentComponents.decodeDeletes(deletes.readAll()));
    }

    public SegmentId id() {
        return id;
    }

    public int numDocs() {
        return docs.size();
    }

    public int numDeleted() {
        return deleted.size();
    }

    public StoredDocument doc(int docId) {
        return docs.get(docId);
    }

    public boolean isDeleted(int docId) {
        return deleted.contains(docId);
    }

    /**
     * @return the sorted doc ids holding the value, deleted ones included.
     */
    public int[] postings(String field, Object value) {
        int[] docIds = postings.get(Terms.key(field, value));
        return docIds == null ? NO_DOCS : docIds;
    }

    public IntArrayList liveDocs() {
        IntArrayList live = new IntArrayList(docs.size() - deleted.size());
        for (int i = 0; i < docs.size(); i++) {
            if (!deleted.contains(i)) {
                live.add(i);
            }
        }
        return live;
    }
}
