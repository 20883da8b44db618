package io.mvccstore.host.mem;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;

import io.mvccstore.host.HeapTuple;
import io.mvccstore.host.Snapshot;
import io.mvccstore.host.TransactionStatus;

/**
 * Transaction id assignment and commit log kept in memory.
 */
public class MemoryTransactions implements TransactionStatus {
    private static final Logger log = LoggerFactory.getLogger(MemoryTransactions.class);
    // Ids below this are reserved, like the host does for bootstrap and frozen transactions.
    public static final long FIRST_NORMAL_XID = 3;

    private final AtomicLong nextXid = new AtomicLong(FIRST_NORMAL_XID);
    private final ConcurrentSkipListSet<Long> running = new ConcurrentSkipListSet<>();
    private final Set<Long> committed = ConcurrentHashMap.newKeySet();
    private final Set<Long> aborted = ConcurrentHashMap.newKeySet();

    public synchronized long begin() {
        long xid = nextXid.getAndIncrement();
        running.add(xid);
        log.debug("begin xid {}", xid);
        return xid;
    }

    public synchronized void commit(long xid) {
        Preconditions.checkState(running.remove(xid), "transaction %s is not running", xid);
        committed.add(xid);
        log.debug("commit xid {}", xid);
    }

    public synchronized void abort(long xid) {
        Preconditions.checkState(running.remove(xid), "transaction %s is not running", xid);
        aborted.add(xid);
        log.debug("abort xid {}", xid);
    }

    /**
     * Take a snapshot on behalf of a transaction, or of a read-only statement when the xid is
     * {@link HeapTuple#INVALID_XID}.
     */
    public synchronized Snapshot snapshot(long currentXid) {
        long xmax = nextXid.get();
        long xmin = running.isEmpty() ? xmax : running.first();
        long[] inProgress = running.stream()
                .mapToLong(Long::longValue)
                .filter(x -> x != currentXid)
                .toArray();
        return new Snapshot(xmin, xmax, inProgress, currentXid);
    }

    public Snapshot snapshot() {
        return snapshot(HeapTuple.INVALID_XID);
    }

    /**
     * Begin, run and commit a transaction in one go.
     */
    public long runInTransaction(TransactionBody body) throws Exception {
        long xid = begin();
        boolean done = false;
        try {
            body.run(xid);
            done = true;
        } finally {
            if (done) {
                commit(xid);
            } else {
                abort(xid);
            }
        }
        return xid;
    }

    @Override
    public boolean isCommitted(long xid) {
        return committed.contains(xid);
    }

    @Override
    public boolean isAborted(long xid) {
        return aborted.contains(xid);
    }

    @Override
    public synchronized long oldestRunningXid() {
        return running.isEmpty() ? nextXid.get() : running.first();
    }

    @FunctionalInterface
    public interface TransactionBody {
        void run(long xid) throws Exception;
    }
}
