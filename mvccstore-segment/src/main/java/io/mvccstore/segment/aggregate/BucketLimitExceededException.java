package io.mvccstore.segment.aggregate;

/**
 * A grouped aggregation produced more groups than allowed.
 */
public class BucketLimitExceededException extends RuntimeException {
    public BucketLimitExceededException(int limit) {
        super(String.format("Aborting aggregation because bucket limit %s was exceeded", limit));
    }
}
