package io.mvccstore.segment;

/**
 * Building the in-memory index of a memory segment failed. Aborts the scan, the store stays usable.
 */
public class SegmentMaterializationException extends RuntimeException {
    public SegmentMaterializationException(SegmentId segmentId, Throwable cause) {
        super(String.format("Failed to index memory segment %s", segmentId), cause);
    }
}
