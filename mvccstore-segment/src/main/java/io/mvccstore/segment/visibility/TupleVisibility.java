package io.mvccstore.segment.visibility;

import io.mvccstore.host.HeapTuple;
import io.mvccstore.host.Snapshot;
import io.mvccstore.host.TransactionStatus;
import io.mvccstore.segment.snapshot.VisibilityRule;

/**
 * Evaluates transaction metadata against a snapshot.
 */
public class TupleVisibility {

    /**
     * Whether the effects of a transaction are visible to the snapshot: it is the snapshot's own transaction, or it
     * committed before the snapshot was taken.
     */
    public static boolean xidVisible(long xid, Snapshot snapshot, TransactionStatus transactions) {
        if (xid == HeapTuple.INVALID_XID) {
            return false;
        }
        if (xid == snapshot.currentXid()) {
            return true;
        }
        if (snapshot.isRunning(xid)) {
            return false;
        }
        return transactions.isCommitted(xid);
    }

    /**
     * Inserted by a visible transaction and not deleted by one.
     */
    public static boolean satisfiesMvcc(long xmin, long xmax, Snapshot snapshot, TransactionStatus transactions) {
        if (!xidVisible(xmin, snapshot, transactions)) {
            return false;
        }
        return xmax == HeapTuple.INVALID_XID || !xidVisible(xmax, snapshot, transactions);
    }

    public static boolean satisfies(HeapTuple tuple, VisibilityRule rule, Snapshot snapshot, TransactionStatus transactions) {
        if (tuple.isRedirect()) {
            return false;
        }
        if (rule == VisibilityRule.ANY) {
            return true;
        }
        return satisfiesMvcc(tuple.xmin(), tuple.xmax(), snapshot, transactions);
    }
}
