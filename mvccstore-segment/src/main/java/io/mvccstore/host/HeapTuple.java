package io.mvccstore.host;

import java.util.Collections;
import java.util.Map;

/**
 * One physical row version of the heap.
 *
 * A slot may also be a redirect left behind by pruning, in which case it carries no data and only
 * points at the slot where the live part of the version chain continues.
 */
public class HeapTuple {
    public static final long INVALID_XID = 0;

    private final long rowId;
    private final long xmin;
    private final long xmax;
    private final long nextVersion;
    private final boolean hotUpdated;
    private final boolean redirect;
    private final Map<String, Object> fields;

    public HeapTuple(long rowId, long xmin, long xmax, long nextVersion, boolean hotUpdated, Map<String, Object> fields) {
        this(rowId, xmin, xmax, nextVersion, hotUpdated, false, fields);
    }

    private HeapTuple(long rowId, long xmin, long xmax, long nextVersion, boolean hotUpdated, boolean redirect, Map<String, Object> fields) {
        this.rowId = rowId;
        this.xmin = xmin;
        this.xmax = xmax;
        this.nextVersion = nextVersion;
        this.hotUpdated = hotUpdated;
        this.redirect = redirect;
        this.fields = fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(fields);
    }

    public static HeapTuple redirect(long rowId, long target) {
        return new HeapTuple(rowId, INVALID_XID, INVALID_XID, target, false, true, null);
    }

    public long rowId() {
        return rowId;
    }

    /**
     * The inserting transaction.
     */
    public long xmin() {
        return xmin;
    }

    /**
     * The deleting or updating transaction, {@link #INVALID_XID} if none.
     */
    public long xmax() {
        return xmax;
    }

    /**
     * The next version in the chain, {@link RowIds#INVALID} if this is the newest one.
     */
    public long nextVersion() {
        return nextVersion;
    }

    /**
     * Whether the next version is a heap-only tuple reachable only through this one.
     */
    public boolean isHotUpdated() {
        return hotUpdated;
    }

    public boolean isRedirect() {
        return redirect;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public HeapTuple withXmax(long xmax, long nextVersion, boolean hotUpdated) {
        return new HeapTuple(rowId, xmin, xmax, nextVersion, hotUpdated, redirect, fields);
    }

    @Override
    public String toString() {
        return "HeapTuple{" +
                "rowId=" + RowIds.toString(rowId) +
                ", xmin=" + xmin +
                ", xmax=" + xmax +
                ", next=" + (nextVersion == RowIds.INVALID ? "-" : RowIds.toString(nextVersion)) +
                (redirect ? ", redirect" : "") +
                '}';
    }
}
