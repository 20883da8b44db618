package io.mvccstore.segment.parallel;

/**
 * What a worker sends back to the leader. Every launched worker sends exactly one.
 */
final class WorkerMessage {
    enum Kind {
        /** A serialized partial result. */
        RESULT,
        /** The worker claimed no segment. */
        EMPTY,
        FAULT,
        CANCELLED
    }

    final int workerNumber;
    final Kind kind;
    final byte[] payload;
    final String fault;

    private WorkerMessage(int workerNumber, Kind kind, byte[] payload, String fault) {
        this.workerNumber = workerNumber;
        this.kind = kind;
        this.payload = payload;
        this.fault = fault;
    }

    static WorkerMessage result(int workerNumber, byte[] payload) {
        return new WorkerMessage(workerNumber, Kind.RESULT, payload, null);
    }

    static WorkerMessage empty(int workerNumber) {
        return new WorkerMessage(workerNumber, Kind.EMPTY, null, null);
    }

    static WorkerMessage fault(int workerNumber, String fault) {
        return new WorkerMessage(workerNumber, Kind.FAULT, null, fault);
    }

    static WorkerMessage cancelled(int workerNumber, String reason) {
        return new WorkerMessage(workerNumber, Kind.CANCELLED, null, reason);
    }
}
