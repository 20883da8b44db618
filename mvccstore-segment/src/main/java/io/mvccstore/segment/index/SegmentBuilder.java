package io.mvccstore.segment.index;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.mvccstore.segment.SegmentComponent;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Collects documents and encodes them into segment components. Doc ids are assigned densely in insertion order.
 */
public class SegmentBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SegmentBuilder.class);

    private final List<StoredDocument> docs = new ArrayList<>();
    private final Map<String, IntArrayList> postings = new TreeMap<>();
    private final IntArrayList deleted = new IntArrayList();
    private boolean built = false;

    public int add(long rowId, Map<String, Object> fields) {
        Preconditions.checkState(!built, "segment already built");
        int docId = docs.size();
        docs.add(new StoredDocument(docId, rowId, false, fields));
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            String key = Terms.key(field.getKey(), field.getValue());
            IntArrayList list = postings.get(key);
            if (list == null) {
                list = new IntArrayList();
                postings.put(key, list);
            }
            list.add(docId);
        }
        return docId;
    }

    public int addTombstone(long rowId) {
        Preconditions.checkState(!built, "segment already built");
        int docId = docs.size();
        docs.add(new StoredDocument(docId, rowId, true, null));
        deleted.add(docId);
        return docId;
    }

    public int numDocs() {
        return docs.size();
    }

    public int numDeleted() {
        return deleted.size();
    }

    /**
     * @return the encoded components. DELETE is only present if some doc is deleted.
     */
    public Map<SegmentComponent, byte[]> build() {
        built = true;
        Map<SegmentComponent, byte[]> components = new EnumMap<>(SegmentComponent.class);
        components.put(SegmentComponent.STORE, SegmentComponents.encodeStore(docs));
        Map<String, int[]> encoded = new TreeMap<>();
        for (Map.Entry<String, IntArrayList> e : postings.entrySet()) {
            encoded.put(e.getKey(), e.getValue().toIntArray());
        }
        components.put(SegmentComponent.POSTINGS, SegmentComponents.encodePostings(encoded));
        if (!deleted.isEmpty()) {
            components.put(SegmentComponent.DELETE, SegmentComponents.encodeDeletes(deleted.toIntArray()));
        }
        logger.debug("Built segment of {} docs, {} terms, {} deleted", docs.size(), postings.size(), deleted.size());
        return components;
    }
}
