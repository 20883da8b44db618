package io.mvccstore.segment.aggregate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SegmentNotFoundException;
import io.mvccstore.segment.SegmentStore;
import io.mvccstore.segment.index.SegmentIndex;
import io.mvccstore.segment.index.SegmentReader;
import io.mvccstore.segment.visibility.VisibilityChecker;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;

/**
 * Folds the matching, visible docs of one segment into a partial result.
 */
public class SegmentCollector {
    private static final Logger logger = LoggerFactory.getLogger(SegmentCollector.class);

    private final SegmentStore store;
    private final AggregationSpec spec;
    private final int bucketLimit;
    /** Null when the store's rule needs no row filtering. */
    private final VisibilityChecker checker;

    public SegmentCollector(SegmentStore store, AggregationSpec spec, int bucketLimit) throws IOException {
        this.store = store;
        this.spec = spec;
        this.bucketLimit = bucketLimit;
        this.checker = store.load().rule().needsFiltering() ? store.newVisibilityChecker(null) : null;
    }

    /**
     * @return false if the segment was gone, which is not an error.
     */
    public boolean collect(SegmentId id, IntermediateResult into) throws IOException {
        SegmentIndex index;
        try {
            index = SegmentReader.open(store, id);
        } catch (SegmentNotFoundException e) {
            logger.warn("Skip segment: {}", e.getMessage());
            return false;
        }
        IntArrayList matches = spec.query.search(index);
        if (checker == null) {
            for (int i = 0; i < matches.size(); i++) {
                into.collect(spec, index.doc(matches.getInt(i)), bucketLimit);
            }
        } else {
            long[] rowIds = new long[matches.size()];
            for (int i = 0; i < rowIds.length; i++) {
                rowIds[i] = index.doc(matches.getInt(i)).rowId;
            }
            LongArrayList visible = checker.filterVisible(rowIds);
            // The visible rows are a subsequence of rowIds, in the same order.
            int v = 0;
            for (int i = 0; i < rowIds.length && v < visible.size(); i++) {
                if (rowIds[i] == visible.getLong(v)) {
                    into.collect(spec, index.doc(matches.getInt(i)), bucketLimit);
                    v++;
                }
            }
        }
        into.segmentDone();
        logger.debug("Collected segment {}: {} matches", id.shortId(), matches.size());
        return true;
    }
}
