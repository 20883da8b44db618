package io.mvccstore.segment.storage;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import io.mvccstore.host.IndexRelation;
import io.mvccstore.segment.CancellationFlag;
import io.mvccstore.segment.MemoryContent;
import io.mvccstore.segment.SegmentComponent;
import io.mvccstore.segment.SegmentFileHandle;
import io.mvccstore.segment.index.RowMaterializer;
import io.mvccstore.segment.index.SegmentBuilder;
import io.mvccstore.segment.index.SegmentComponents;
import io.mvccstore.segment.snapshot.VisibilityRule;
import io.mvccstore.segment.visibility.VisibilityChecker;

/**
 * The components of a memory segment, indexed in memory from its staged rows. Never written to pages.
 */
public class EphemeralIndex {
    private final Map<SegmentComponent, byte[]> components;
    private final int numDocs;
    private final int numDeleted;

    private EphemeralIndex(Map<SegmentComponent, byte[]> components, int numDocs, int numDeleted) {
        this.components = Collections.unmodifiableMap(components);
        this.numDocs = numDocs;
        this.numDeleted = numDeleted;
    }

    /**
     * Index the staged rows as of the snapshot they were staged with.
     */
    public static EphemeralIndex build(IndexRelation relation,
                                       PageChain chain,
                                       MemoryContent content,
                                       CancellationFlag cancellation) throws IOException {
        long[] rowIds = SegmentComponents.decodeStagedRows(chain.read(content.stagedRows()));
        VisibilityChecker checker = new VisibilityChecker(
                relation.heap(),
                relation.transactions(),
                content.snapshot(),
                VisibilityRule.MVCC,
                cancellation);
        SegmentBuilder builder = RowMaterializer.materialize(checker, rowIds);
        return new EphemeralIndex(builder.build(), builder.numDocs(), builder.numDeleted());
    }

    public boolean has(SegmentComponent component) {
        return components.containsKey(component);
    }

    /**
     * @return the handle, or null if the component is absent.
     */
    public SegmentFileHandle handle(SegmentComponent component) {
        byte[] data = components.get(component);
        return data == null ? null : new ByteArrayFileHandle(data);
    }

    public int numDocs() {
        return numDocs;
    }

    public int numDeleted() {
        return numDeleted;
    }
}
