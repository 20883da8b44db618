package io.mvccstore.segment.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mvccstore.host.HeapTuple;
import io.mvccstore.host.RowIds;
import io.mvccstore.segment.visibility.VisibilityChecker;

/**
 * Turns row ids into documents, fetching the row data through a visibility checker.
 *
 * Rows not visible to the checker's snapshot are left out. Rows whose slot is physically gone become tombstones.
 */
public class RowMaterializer {
    private static final Logger logger = LoggerFactory.getLogger(RowMaterializer.class);

    public static SegmentBuilder materialize(VisibilityChecker checker, long[] rowIds) {
        SegmentBuilder builder = new SegmentBuilder();
        materialize(checker, rowIds, builder);
        return builder;
    }

    public static void materialize(VisibilityChecker checker, long[] rowIds, SegmentBuilder builder) {
        int skipped = 0;
        for (long rowId : rowIds) {
            HeapTuple tuple = checker.fetchVisible(rowId);
            if (tuple != null) {
                builder.add(rowId, tuple.fields());
            } else if (checker.wasMissing(rowId)) {
                logger.debug("Row {} is gone, index it as a tombstone", RowIds.toString(rowId));
                builder.addTombstone(rowId);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.debug("Skipped {} of {} rows not visible to {}", skipped, rowIds.length, checker.snapshot());
        }
    }
}
