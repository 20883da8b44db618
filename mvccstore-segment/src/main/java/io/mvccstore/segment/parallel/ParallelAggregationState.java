package io.mvccstore.segment.parallel;

import com.google.common.base.Preconditions;

/**
 * Coordination state shared by the leader and all workers of one parallel scan. Every access goes through the
 * spin lock.
 *
 * The remaining segment count only ever decreases.
 */
public class ParallelAggregationState {
    public static final int NONE = -1;

    private final SpinLock lock = new SpinLock();
    private final int totalSegments;
    private int launchedWorkers;
    private int remainingSegments;

    public ParallelAggregationState(int totalSegments) {
        this(totalSegments, 0);
    }

    private ParallelAggregationState(int totalSegments, int launchedWorkers) {
        Preconditions.checkArgument(totalSegments >= 0);
        this.totalSegments = totalSegments;
        this.launchedWorkers = launchedWorkers;
        this.remainingSegments = totalSegments;
    }

    /**
     * State for running the whole checkout loop in the calling thread.
     */
    public static ParallelAggregationState sequential(int totalSegments) {
        return new ParallelAggregationState(totalSegments, 1);
    }

    public int totalSegments() {
        return totalSegments;
    }

    public void setLaunchedWorkers(int launched) {
        Preconditions.checkArgument(launched > 0, "launched worker count must be positive, got %s", launched);
        try (SpinLock.Guard ignored = lock.acquire()) {
            launchedWorkers = launched;
        }
    }

    /**
     * @return 0 until the leader has published the count.
     */
    public int launchedWorkers() {
        try (SpinLock.Guard ignored = lock.acquire()) {
            return launchedWorkers;
        }
    }

    public int remainingSegments() {
        try (SpinLock.Guard ignored = lock.acquire()) {
            return remainingSegments;
        }
    }

    /**
     * Claim the next segment, walking from the tail of the list to the head.
     *
     * @return the index of the claimed segment, or {@link #NONE} if all are claimed.
     */
    public int checkout() {
        try (SpinLock.Guard ignored = lock.acquire()) {
            if (remainingSegments == 0) {
                return NONE;
            }
            remainingSegments--;
            return remainingSegments;
        }
    }
}
