package io.mvccstore.segment.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;

import io.mvccstore.host.IndexRelation;
import io.mvccstore.host.PageStorage;
import io.mvccstore.segment.FileEntry;
import io.mvccstore.segment.PersistedContent;
import io.mvccstore.segment.SegmentComponent;
import io.mvccstore.segment.SegmentEntry;
import io.mvccstore.segment.SegmentId;
import io.mvccstore.segment.SegmentManager;
import io.mvccstore.segment.index.SegmentComponents;
import io.mvccstore.util.JsonUtil;
import io.mvccstore.util.Try;

/**
 * The segment list of an index, stored as a JSON page chain referenced from the metapage. The merge list lives in
 * a chain of its own, so a merge may claim any number of segments.
 *
 * Changes are copy-on-write: a new chain is written, the metapage switched over to it and only then the old chain
 * freed, all under the write lock of {@link IndexRelation#metaLock()}. Readers take the read lock, so they never
 * see a half written list.
 */
public class SegmentCatalog implements SegmentManager {
    private static final Logger logger = LoggerFactory.getLogger(SegmentCatalog.class);
    private static final TypeReference<List<SegmentEntry>> ENTRY_LIST = new TypeReference<List<SegmentEntry>>() {};
    private static final TypeReference<List<SegmentId>> ID_LIST = new TypeReference<List<SegmentId>>() {};

    private final IndexRelation relation;
    private final PageChain chain;

    public SegmentCatalog(IndexRelation relation) {
        this.relation = relation;
        this.chain = new PageChain(relation.pages());
    }

    public IndexRelation relation() {
        return relation;
    }

    public PageChain pageChain() {
        return chain;
    }

    public CatalogState read() throws IOException {
        Lock lock = relation.metaLock().readLock();
        lock.lock();
        try {
            MetaPage meta = readMeta();
            return new CatalogState(readEntries(meta), readMergeList(meta), meta.generation);
        } finally {
            lock.unlock();
        }
    }

    public List<SegmentEntry> readEntries() throws IOException {
        return read().entries;
    }

    public Set<SegmentId> mergeList() throws IOException {
        return read().mergeList;
    }

    @Override
    public boolean exists(SegmentId id) throws IOException {
        return read().find(id) != null;
    }

    @Override
    public List<SegmentId> allSegmentIds() throws IOException {
        List<SegmentId> ids = new ArrayList<>();
        for (SegmentEntry e : readEntries()) {
            ids.add(e.id());
        }
        return ids;
    }

    @Override
    public void add(SegmentEntry entry) throws IOException {
        mutate(new Mutation() {
            @Override
            public boolean apply(List<SegmentEntry> entries, Set<SegmentId> mergeList) {
                for (SegmentEntry e : entries) {
                    Preconditions.checkState(!e.id().equals(entry.id()), "segment %s already exists", entry.id());
                }
                entries.add(entry);
                return true;
            }
        });
        logger.debug("Added segment {} to {}", entry, relation);
    }

    @Override
    public void markDeleted(Collection<SegmentId> ids, long xid) throws IOException {
        Set<SegmentId> toDelete = new HashSet<>(ids);
        mutate(new Mutation() {
            @Override
            public boolean apply(List<SegmentEntry> entries, Set<SegmentId> mergeList) {
                boolean changed = false;
                for (int i = 0; i < entries.size(); i++) {
                    SegmentEntry e = entries.get(i);
                    if (toDelete.remove(e.id())) {
                        Preconditions.checkState(!e.isDeleted(), "segment %s already deleted by %s", e.id(), e.xmax());
                        entries.set(i, e.withXmax(xid));
                        changed = true;
                    }
                }
                if (!toDelete.isEmpty()) {
                    throw new IllegalStateException("Segments not found! " + toDelete);
                }
                return changed;
            }
        });
    }

    @Override
    public void remove(SegmentId id) throws IOException {
        mutate(new Mutation() {
            @Override
            public boolean apply(List<SegmentEntry> entries, Set<SegmentId> mergeList) {
                mergeList.remove(id);
                return entries.removeIf(e -> e.id().equals(id));
            }
        });
    }

    /**
     * Record deleted documents of a persisted segment by writing a new DELETE component. The old one, if any, is
     * freed.
     *
     * @param deletedDocIds all deleted doc ids, not only the new ones.
     */
    public SegmentEntry saveDeletes(SegmentId id, int[] deletedDocIds) throws IOException {
        Lock lock = relation.metaLock().writeLock();
        lock.lock();
        try {
            MetaPage meta = readMeta();
            List<SegmentEntry> entries = new ArrayList<>(readEntries(meta));
            int idx = indexOf(entries, id);
            SegmentEntry old = entries.get(idx);
            Preconditions.checkState(old.isPersisted(), "deletes only apply to persisted segments, got %s", old);
            PersistedContent content = (PersistedContent) old.content();
            FileEntry oldDeletes = content.file(SegmentComponent.DELETE);
            FileEntry newDeletes = chain.write(SegmentComponents.encodeDeletes(deletedDocIds));
            SegmentEntry updated = old.withDeletes(deletedDocIds.length, content.withFile(SegmentComponent.DELETE, newDeletes));
            entries.set(idx, updated);
            Set<SegmentId> mergeList = readMergeList(meta);
            try {
                writeList(meta, mergeList, entries, mergeList);
            } catch (IOException | RuntimeException e) {
                Try.on(() -> chain.free(newDeletes), logger, "free unused deletes " + newDeletes);
                throw e;
            }
            if (oldDeletes != null) {
                chain.free(oldDeletes);
            }
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claim segments for a merge. Fails if any of them is claimed already.
     *
     * @return false if some segment is already in the merge list.
     */
    public boolean beginMerge(Collection<SegmentId> ids) throws IOException {
        boolean[] claimed = new boolean[1];
        mutate(new Mutation() {
            @Override
            public boolean apply(List<SegmentEntry> entries, Set<SegmentId> mergeList) {
                for (SegmentId id : ids) {
                    if (mergeList.contains(id)) {
                        return false;
                    }
                    indexOf(entries, id);
                }
                mergeList.addAll(ids);
                claimed[0] = true;
                return true;
            }
        });
        return claimed[0];
    }

    public void endMerge(Collection<SegmentId> ids) throws IOException {
        mutate(new Mutation() {
            @Override
            public boolean apply(List<SegmentEntry> entries, Set<SegmentId> mergeList) {
                return mergeList.removeAll(ids);
            }
        });
    }

    private interface Mutation {
        /**
         * Change the lists in place.
         *
         * @return whether anything changed.
         */
        boolean apply(List<SegmentEntry> entries, Set<SegmentId> mergeList);
    }

    private void mutate(Mutation mutation) throws IOException {
        Lock lock = relation.metaLock().writeLock();
        lock.lock();
        try {
            MetaPage meta = readMeta();
            List<SegmentEntry> entries = new ArrayList<>(readEntries(meta));
            Set<SegmentId> oldMergeList = readMergeList(meta);
            Set<SegmentId> mergeList = new HashSet<>(oldMergeList);
            if (mutation.apply(entries, mergeList)) {
                writeList(meta, oldMergeList, entries, mergeList);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the new lists into fresh chains, switch the metapage over and free the old chains. The merge list chain
     * is only rewritten when the merge list changed. If anything fails before the switch, the fresh chains are
     * freed again and the old state stays in place.
     */
    private void writeList(MetaPage meta,
                           Set<SegmentId> oldMergeList,
                           List<SegmentEntry> entries,
                           Set<SegmentId> mergeList) throws IOException {
        boolean mergesChanged = !mergeList.equals(oldMergeList);
        FileEntry newList = chain.write(JsonUtil.toJsonBytes(entries));
        FileEntry newMerges = null;
        MetaPage newMeta;
        try {
            if (mergesChanged && !mergeList.isEmpty()) {
                newMerges = chain.write(JsonUtil.toJsonBytes(new ArrayList<>(new TreeSet<>(mergeList))));
            }
            newMeta = meta.next(newList, mergesChanged ? newMerges : meta.merges);
            chain.writeSinglePage(PageStorage.METAPAGE_BLOCK, JsonUtil.toJsonBytes(newMeta));
        } catch (IOException | RuntimeException e) {
            Try.on(() -> chain.free(newList), logger, "free unused segment list " + newList);
            if (newMerges != null) {
                FileEntry unused = newMerges;
                Try.on(() -> chain.free(unused), logger, "free unused merge list " + unused);
            }
            throw e;
        }
        if (meta.segments != null) {
            chain.free(meta.segments);
        }
        if (mergesChanged && meta.merges != null) {
            chain.free(meta.merges);
        }
        logger.trace("{} now at {}", relation, newMeta);
    }

    private MetaPage readMeta() throws IOException {
        byte[] payload = chain.readSinglePage(PageStorage.METAPAGE_BLOCK);
        if (payload.length == 0) {
            return MetaPage.EMPTY;
        }
        return JsonUtil.fromJsonBytes(payload, MetaPage.class);
    }

    private Set<SegmentId> readMergeList(MetaPage meta) throws IOException {
        if (meta.merges == null) {
            return Collections.emptySet();
        }
        return new HashSet<>(JsonUtil.fromJsonBytes(chain.read(meta.merges), ID_LIST));
    }

    private List<SegmentEntry> readEntries(MetaPage meta) throws IOException {
        if (meta.segments == null) {
            return Collections.emptyList();
        }
        return JsonUtil.fromJsonBytes(chain.read(meta.segments), ENTRY_LIST);
    }

    private static int indexOf(List<SegmentEntry> entries, SegmentId id) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).id().equals(id)) {
                return i;
            }
        }
        throw new IllegalStateException("Segment not found! " + id);
    }
}
