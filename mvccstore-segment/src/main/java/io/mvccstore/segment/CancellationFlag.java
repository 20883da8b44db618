package io.mvccstore.segment;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation of one scan. Nothing is ever interrupted forcibly, every long running loop calls
 * {@link #checkForInterrupts()} at bounded intervals instead.
 *
 * A flag may have a parent: cancelling the parent cancels the child, but not the other way round.
 */
public class CancellationFlag {
    private final CancellationFlag parent;
    private final AtomicReference<String> reason = new AtomicReference<>();

    public CancellationFlag() {
        this(null);
    }

    public CancellationFlag(CancellationFlag parent) {
        this.parent = parent;
    }

    /**
     * Request cancellation. Only the first reason is kept.
     */
    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason() != null;
    }

    public String reason() {
        String why = reason.get();
        if (why == null && parent != null) {
            return parent.reason();
        }
        return why;
    }

    /**
     * @throws ScanCancelledException if the scan was cancelled or the current thread interrupted.
     */
    public void checkForInterrupts() {
        String why = reason();
        if (why != null) {
            throw new ScanCancelledException(why);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new ScanCancelledException("thread interrupted");
        }
    }
}
