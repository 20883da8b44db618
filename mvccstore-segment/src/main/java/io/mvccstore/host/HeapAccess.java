package io.mvccstore.host;

/**
 * Read access to the heap relation an index is built on.
 */
public interface HeapAccess {

    String name();

    /**
     * Fetch the slot at the row id.
     *
     * @return the tuple, or null if the slot is physically absent, e.g. pruned away.
     */
    HeapTuple fetch(long rowId);

    /**
     * The visibility summary: true if every tuple on the block is visible to all transactions.
     * A false answer carries no information.
     */
    boolean isAllVisible(long block);
}
