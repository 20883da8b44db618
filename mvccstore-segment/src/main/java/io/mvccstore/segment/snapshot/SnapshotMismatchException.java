package io.mvccstore.segment.snapshot;

/**
 * A snapshot mode asked for a view which the index metadata can not provide, e.g. a worker subset naming a segment
 * its base mode does not see. A programming error.
 */
public class SnapshotMismatchException extends IllegalStateException {
    public SnapshotMismatchException(String message) {
        super(message);
    }
}
