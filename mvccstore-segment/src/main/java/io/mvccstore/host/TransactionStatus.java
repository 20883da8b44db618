package io.mvccstore.host;

/**
 * Commit log lookups.
 */
public interface TransactionStatus {

    boolean isCommitted(long xid);

    boolean isAborted(long xid);

    /**
     * The oldest transaction id which may still be running. Everything older is either committed or aborted.
     */
    long oldestRunningXid();
}
