package io.mvccstore.host;

import com.google.common.base.Preconditions;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * An index together with the heap it indexes and the storage it lives in.
 *
 * {@link #metaLock()} plays the part of the host's buffer lock on the metapage: the segment list is read under the
 * read lock and replaced under the write lock.
 */
public class IndexRelation {
    private final String name;
    private final HeapAccess heap;
    private final PageStorage pages;
    private final TransactionStatus transactions;
    private final ReadWriteLock metaLock = new ReentrantReadWriteLock();

    public IndexRelation(String name, HeapAccess heap, PageStorage pages, TransactionStatus transactions) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "index name required");
        this.name = name;
        this.heap = Preconditions.checkNotNull(heap);
        this.pages = Preconditions.checkNotNull(pages);
        this.transactions = Preconditions.checkNotNull(transactions);
    }

    public String name() {
        return name;
    }

    public HeapAccess heap() {
        return heap;
    }

    public PageStorage pages() {
        return pages;
    }

    public TransactionStatus transactions() {
        return transactions;
    }

    public ReadWriteLock metaLock() {
        return metaLock;
    }

    @Override
    public String toString() {
        return name + " on " + heap.name();
    }
}
