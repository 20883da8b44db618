package io.mvccstore.segment;

public class ScanCancelledException extends RuntimeException {
    public ScanCancelledException(String reason) {
        super("canceling statement: " + reason);
    }
}
