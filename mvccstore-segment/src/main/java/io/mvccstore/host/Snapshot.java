package io.mvccstore.host;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * A point-in-time transactional view.
 *
 * Transactions with id below {@link #xmin()} were finished when the snapshot was taken, those at or above
 * {@link #xmax()} had not started, and {@link #inProgress()} lists the ones in between which were still running.
 * Changes made by {@link #currentXid()} itself are always visible.
 */
public class Snapshot {
    private final long xmin;
    private final long xmax;
    private final long[] inProgress;
    private final long currentXid;

    @JsonCreator
    public Snapshot(@JsonProperty("xmin") long xmin,
                    @JsonProperty("xmax") long xmax,
                    @JsonProperty("inProgress") long[] inProgress,
                    @JsonProperty("currentXid") long currentXid) {
        this.xmin = xmin;
        this.xmax = xmax;
        this.inProgress = inProgress == null ? new long[0] : inProgress.clone();
        this.currentXid = currentXid;
        Arrays.sort(this.inProgress);
    }

    @JsonProperty("xmin")
    public long xmin() {
        return xmin;
    }

    @JsonProperty("xmax")
    public long xmax() {
        return xmax;
    }

    @JsonProperty("inProgress")
    public long[] inProgress() {
        return inProgress.clone();
    }

    @JsonProperty("currentXid")
    public long currentXid() {
        return currentXid;
    }

    /**
     * Whether the transaction was still running, or not yet started, from this snapshot's point of view.
     */
    public boolean isRunning(long xid) {
        if (xid >= xmax) {
            return true;
        }
        if (xid < xmin) {
            return false;
        }
        return Arrays.binarySearch(inProgress, xid) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Snapshot snapshot = (Snapshot) o;
        return xmin == snapshot.xmin
                && xmax == snapshot.xmax
                && currentXid == snapshot.currentXid
                && Arrays.equals(inProgress, snapshot.inProgress);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(xmin);
        result = 31 * result + Long.hashCode(xmax);
        result = 31 * result + Long.hashCode(currentXid);
        result = 31 * result + Arrays.hashCode(inProgress);
        return result;
    }

    @Override
    public String toString() {
        return "Snapshot{" +
                "xmin=" + xmin +
                ", xmax=" + xmax +
                ", inProgress=" + Arrays.toString(inProgress) +
                ", currentXid=" + currentXid +
                '}';
    }
}
