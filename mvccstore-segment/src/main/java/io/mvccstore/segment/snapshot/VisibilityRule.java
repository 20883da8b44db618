package io.mvccstore.segment.snapshot;

/**
 * How rows found in the eligible segments are filtered.
 */
public enum VisibilityRule {
    /**
     * Only row versions visible to the bound snapshot.
     */
    MVCC,
    /**
     * Every row version that physically exists, dead ones included. No filtering at all.
     */
    ANY;

    public boolean needsFiltering() {
        return this == MVCC;
    }
}
