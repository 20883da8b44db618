package io.mvccstore.segment;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;

import io.mvccstore.host.IndexRelation;
import io.mvccstore.host.Snapshot;
import io.mvccstore.segment.pin.PinSet;
import io.mvccstore.segment.snapshot.Resolution;
import io.mvccstore.segment.snapshot.SnapshotMode;
import io.mvccstore.segment.snapshot.SnapshotResolver;
import io.mvccstore.segment.storage.CatalogState;
import io.mvccstore.segment.storage.EphemeralIndex;
import io.mvccstore.segment.storage.PageChainFileHandle;
import io.mvccstore.segment.storage.SegmentCatalog;
import io.mvccstore.segment.visibility.VisibilityChecker;

/**
 * The view of an index's segments for one scan, fixed by a snapshot mode and a snapshot.
 *
 * The first {@link #load()} resolves which segments are visible and pins each of them, so their pages stay put
 * until {@link #close()}. Later loads return the same set. Memory segments are indexed on first open, at most
 * once per store.
 */
public class SegmentStore implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(SegmentStore.class);

    private final IndexRelation relation;
    private final SegmentCatalog catalog;
    private final SnapshotMode mode;
    private final Snapshot snapshot;
    private final CancellationFlag cancellation;
    private final PinSet pins;

    private final Map<String, SegmentFileHandle> handles = new ConcurrentHashMap<>();
    private final Map<SegmentId, Supplier<EphemeralIndex>> ephemeral = new ConcurrentHashMap<>();
    private final AtomicInteger ephemeralBuilds = new AtomicInteger();

    private volatile SegmentSet loaded;
    private volatile boolean closed = false;

    private SegmentStore(SegmentCatalog catalog, SnapshotMode mode, Snapshot snapshot, CancellationFlag cancellation) {
        this.relation = catalog.relation();
        this.catalog = catalog;
        this.mode = Preconditions.checkNotNull(mode);
        this.snapshot = Preconditions.checkNotNull(snapshot);
        this.cancellation = cancellation == null ? new CancellationFlag() : cancellation;
        this.pins = new PinSet(relation.pages());
    }

    public static SegmentStore open(IndexRelation relation, SnapshotMode mode, Snapshot snapshot) {
        return new SegmentStore(new SegmentCatalog(relation), mode, snapshot, null);
    }

    public static SegmentStore open(IndexRelation relation, SnapshotMode mode, Snapshot snapshot, CancellationFlag cancellation) {
        return new SegmentStore(new SegmentCatalog(relation), mode, snapshot, cancellation);
    }

    public static SegmentStore open(SegmentCatalog catalog, SnapshotMode mode, Snapshot snapshot, CancellationFlag cancellation) {
        return new SegmentStore(catalog, mode, snapshot, cancellation);
    }

    public IndexRelation relation() {
        return relation;
    }

    public SnapshotMode mode() {
        return mode;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public CancellationFlag cancellation() {
        return cancellation;
    }

    /**
     * Resolve and pin the visible segments, in scheduling order. Idempotent.
     */
    public synchronized SegmentSet load() throws IOException {
        Preconditions.checkState(!closed, "store of %s is closed", relation);
        if (loaded != null) {
            return loaded;
        }
        // Pin under the read lock, so that no segment can be recycled between resolving and pinning it.
        Lock lock = relation.metaLock().readLock();
        lock.lock();
        try {
            CatalogState state = catalog.read();
            Resolution resolution = new SnapshotResolver(snapshot, relation.transactions())
                    .resolve(mode, state.entries, state.mergeList);
            List<SegmentEntry> ordered = new ArrayList<>(resolution.eligible);
            ordered.sort(SegmentCost.CHEAPEST_FIRST);
            for (SegmentEntry e : ordered) {
                pins.pin(e.pintestBlock());
            }
            loaded = new SegmentSet(mode, resolution.rule, ordered);
        } catch (IOException | RuntimeException e) {
            pins.unpinAll();
            throw e;
        } finally {
            lock.unlock();
        }
        logger.debug("Loaded {} of {}", loaded, relation);
        return loaded;
    }

    public boolean isLoaded() {
        return loaded != null;
    }

    /**
     * Every entry of the segment list regardless of the mode, dropped ones included.
     */
    public Map<SegmentId, SegmentEntry> allSegments() throws IOException {
        Map<SegmentId, SegmentEntry> all = new LinkedHashMap<>();
        for (SegmentEntry e : catalog.readEntries()) {
            all.put(e.id(), e);
        }
        return all;
    }

    public boolean hasComponent(SegmentId id, SegmentComponent component) throws IOException {
        SegmentEntry entry = entry(id);
        if (entry.isPersisted()) {
            return ((PersistedContent) entry.content()).file(component) != null;
        }
        return ephemeralIndex(entry).has(component);
    }

    /**
     * Open one component of a visible segment. Handles are cached for the life of the store.
     *
     * @throws SegmentNotFoundException        if the segment is not visible to this store or lacks the component.
     * @throws SegmentMaterializationException if a memory segment could not be indexed.
     */
    public SegmentFileHandle open(SegmentId id, SegmentComponent component) throws IOException {
        String key = component.fileName(id);
        SegmentFileHandle handle = handles.get(key);
        if (handle != null) {
            return handle;
        }
        SegmentEntry entry = entry(id);
        if (entry.isPersisted()) {
            FileEntry file = ((PersistedContent) entry.content()).file(component);
            if (file == null) {
                throw new SegmentNotFoundException(id, "no component " + component);
            }
            handle = new PageChainFileHandle(catalog.pageChain(), file);
        } else {
            handle = ephemeralIndex(entry).handle(component);
            if (handle == null) {
                throw new SegmentNotFoundException(id, "no component " + component);
            }
        }
        SegmentFileHandle old = handles.putIfAbsent(key, handle);
        return old != null ? old : handle;
    }

    /**
     * A new checker bound to this store's snapshot and visibility rule.
     */
    public VisibilityChecker newVisibilityChecker(CancellationFlag cancellation) throws IOException {
        return new VisibilityChecker(
                relation.heap(),
                relation.transactions(),
                snapshot,
                load().rule(),
                cancellation == null ? this.cancellation : cancellation);
    }

    /**
     * How many memory segments this store indexed so far.
     */
    public int ephemeralBuilds() {
        return ephemeralBuilds.get();
    }

    public int pinnedBlocks() {
        return pins.size();
    }

    /**
     * Release all pins and cached handles. Safe to call more than once.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        pins.unpinAll();
        handles.clear();
        ephemeral.clear();
    }

    private SegmentEntry entry(SegmentId id) throws IOException {
        SegmentEntry entry = load().get(id);
        if (entry == null) {
            throw new SegmentNotFoundException(id, "not visible to " + mode);
        }
        return entry;
    }

    private EphemeralIndex ephemeralIndex(SegmentEntry entry) {
        Supplier<EphemeralIndex> supplier = ephemeral.computeIfAbsent(entry.id(), id -> Suppliers.memoize(() -> build(entry)));
        return supplier.get();
    }

    private EphemeralIndex build(SegmentEntry entry) {
        try {
            EphemeralIndex index = EphemeralIndex.build(relation, catalog.pageChain(), (MemoryContent) entry.content(), cancellation);
            ephemeralBuilds.incrementAndGet();
            logger.debug("Indexed memory segment {}, {} docs", entry.id().shortId(), index.numDocs());
            return index;
        } catch (ScanCancelledException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new SegmentMaterializationException(entry.id(), e);
        }
    }
}
