package io.mvccstore.segment.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import io.mvccstore.host.HeapTuple;
import io.mvccstore.host.IndexRelation;
import io.mvccstore.host.Snapshot;
import io.mvccstore.segment.FileEntry;
import io.mvccstore.segment.MemoryContent;
import io.mvccstore.segment.PersistedContent;
import io.mvccstore.segment.SegmentComponent;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.index.RowMaterializer;
import io.mvccstore.segment.index.SegmentBuilder;
import io.mvccstore.segment.index.SegmentComponents;
import io.mvccstore.segment.snapshot.VisibilityRule;
import io.mvccstore.segment.visibility.VisibilityChecker;
import io.mvccstore.util.Try;

/**
 * Creates segments: writes their pages, then adds them to the segment list as created by the given transaction.
 */
public class SegmentWriter {
    private static final Logger logger = LoggerFactory.getLogger(SegmentWriter.class);

    private final IndexRelation relation;
    private final SegmentCatalog catalog;
    private final PageChain chain;

    public SegmentWriter(SegmentCatalog catalog) {
        this.relation = catalog.relation();
        this.catalog = catalog;
        this.chain = catalog.pageChain();
    }

    /**
     * Index the rows visible to the snapshot into a new persisted segment.
     */
    public SegmentEntry flush(long xid, Snapshot snapshot, long[] rowIds) throws IOException {
        VisibilityChecker checker = new VisibilityChecker(
                relation.heap(),
                relation.transactions(),
                snapshot,
                VisibilityRule.MVCC,
                null);
        return writePersisted(xid, RowMaterializer.materialize(checker, rowIds));
    }

    /**
     * Stage the row ids as a memory segment. Nothing is indexed until a scan opens it.
     */
    public SegmentEntry stage(long xid, Snapshot snapshot, long[] rowIds) throws IOException {
        FileEntry staged = chain.write(SegmentComponents.encodeStagedRows(rowIds));
        SegmentEntry entry = SegmentEntry.created(SegmentId.generate(), rowIds.length, xid, new MemoryContent(staged, snapshot));
        try {
            catalog.add(entry);
        } catch (IOException | RuntimeException e) {
            Try.on(() -> chain.free(staged), logger, "free staged rows of " + entry.id());
            throw e;
        }
        logger.debug("Staged {} rows into {} of {}", rowIds.length, entry.id().shortId(), relation);
        return entry;
    }

    public SegmentEntry writePersisted(long xid, SegmentBuilder builder) throws IOException {
        Map<SegmentComponent, byte[]> components = builder.build();
        Map<SegmentComponent, FileEntry> files = new EnumMap<>(SegmentComponent.class);
        List<FileEntry> written = new ArrayList<>();
        try {
            for (Map.Entry<SegmentComponent, byte[]> c : components.entrySet()) {
                FileEntry f = chain.write(c.getValue());
                written.add(f);
                files.put(c.getKey(), f);
            }
            SegmentEntry entry = new SegmentEntry(
                    SegmentId.generate(),
                    builder.numDocs(),
                    builder.numDeleted(),
                    xid,
                    HeapTuple.INVALID_XID,
                    new PersistedContent(files));
            catalog.add(entry);
            logger.debug("Flushed segment {} of {}", entry, relation);
            return entry;
        } catch (IOException | RuntimeException e) {
            for (FileEntry f : written) {
                Try.on(() -> chain.free(f), logger, "free " + f);
            }
            throw e;
        }
    }
}
