package io.mvccstore.segment;

/**
 * A segment, or one of its components, referenced by stale metadata is gone. Normal while a concurrent
 * reclamation runs.
 */
public class SegmentNotFoundException extends RuntimeException {
    private final SegmentId segmentId;

    public SegmentNotFoundException(SegmentId segmentId, String message) {
        super(String.format("Segment not found! [segment: %s] %s", segmentId, message));
        this.segmentId = segmentId;
    }

    public SegmentId segmentId() {
        return segmentId;
    }
}
