package io.mvccstore.segment.parallel;

import com.google.common.base.Preconditions;

import io.mvccstore.segment.SystemConfig;

/**
 * Per scan settings of a parallel aggregation. Defaults come from {@link SystemConfig}.
 */
public final class ParallelOptions {
    public final int maxWorkers;
    public final boolean leaderParticipation;
    public final int bucketLimit;
    public final int faultUnwrapDepth;
    public final WorkerPool pool;

    private ParallelOptions(int maxWorkers, boolean leaderParticipation, int bucketLimit, int faultUnwrapDepth, WorkerPool pool) {
        Preconditions.checkArgument(maxWorkers >= 0, "negative max workers");
        this.maxWorkers = maxWorkers;
        this.leaderParticipation = leaderParticipation;
        this.bucketLimit = bucketLimit;
        this.faultUnwrapDepth = faultUnwrapDepth;
        this.pool = Preconditions.checkNotNull(pool);
    }

    public static ParallelOptions defaults() {
        return new ParallelOptions(
                SystemConfig.PARALLEL_MAX_WORKERS.getInt(),
                SystemConfig.PARALLEL_LEADER_PARTICIPATION.getBool(),
                SystemConfig.AGG_BUCKET_LIMIT.getInt(),
                SystemConfig.FAULT_UNWRAP_DEPTH.getInt(),
                WorkerPool.shared());
    }

    public ParallelOptions withMaxWorkers(int maxWorkers) {
        return new ParallelOptions(maxWorkers, leaderParticipation, bucketLimit, faultUnwrapDepth, pool);
    }

    public ParallelOptions withLeaderParticipation(boolean leaderParticipation) {
        return new ParallelOptions(maxWorkers, leaderParticipation, bucketLimit, faultUnwrapDepth, pool);
    }

    public ParallelOptions withBucketLimit(int bucketLimit) {
        return new ParallelOptions(maxWorkers, leaderParticipation, bucketLimit, faultUnwrapDepth, pool);
    }

    public ParallelOptions withPool(WorkerPool pool) {
        return new ParallelOptions(maxWorkers, leaderParticipation, bucketLimit, faultUnwrapDepth, pool);
    }

    @Override
    public String toString() {
        return "ParallelOptions{" +
                "maxWorkers=" + maxWorkers +
                ", leaderParticipation=" + leaderParticipation +
                ", bucketLimit=" + bucketLimit +
                '}';
    }
}
