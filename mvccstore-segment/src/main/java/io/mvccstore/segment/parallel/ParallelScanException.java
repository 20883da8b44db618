package io.mvccstore.segment.parallel;

/**
 * A worker of a parallel scan failed. The scan is aborted, the process goes on.
 */
public class ParallelScanException extends RuntimeException {
    private final int workerNumber;

    public ParallelScanException(int workerNumber, String fault) {
        super(String.format("parallel worker #%s failed: %s", workerNumber, fault));
        this.workerNumber = workerNumber;
    }

    public int workerNumber() {
        return workerNumber;
    }
}
