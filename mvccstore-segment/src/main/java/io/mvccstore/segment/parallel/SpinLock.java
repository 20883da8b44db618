package io.mvccstore.segment.parallel;

import java.util.concurrent.atomic.AtomicBoolean;

import io.mvccstore.segment.SystemConfig;

/**
 * A busy-waiting lock for critical sections of a few instructions, like a counter decrement.
 * <pre>
 *     try (SpinLock.Guard ignored = lock.acquire()) {
 *         ...
 *     }
 * </pre>
 * Not reentrant.
 */
public class SpinLock {
    private final AtomicBoolean locked = new AtomicBoolean(false);
    private final boolean yield;
    private final Guard guard = new Guard();

    public SpinLock() {
        this(SystemConfig.SPIN_WAIT_YIELD.getBool());
    }

    public SpinLock(boolean yield) {
        this.yield = yield;
    }

    public Guard acquire() {
        while (!locked.compareAndSet(false, true)) {
            if (yield) {
                Thread.yield();
            }
        }
        return guard;
    }

    public boolean isLocked() {
        return locked.get();
    }

    public class Guard implements AutoCloseable {
        private Guard() {}

        @Override
        public void close() {
            locked.set(false);
        }
    }
}
