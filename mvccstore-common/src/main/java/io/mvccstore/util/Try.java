package io.mvccstore.util;

import org.slf4j.Logger;

import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;

/**
 * Run release code which must not abort the caller, e.g. unpinning a block or freeing pages
 * while a scan unwinds. Failures are logged, never rethrown.
 */
public class Try {
    private static final int CAUSE_DEPTH = 4;

    /**
     * @return true if {@code f} completed normally.
     */
    public static boolean on(F0 f, Logger logger, String... msg) {
        try {
            f.f();
            return true;
        } catch (Throwable t) {
            logError(logger, t, msg);
            return false;
        }
    }

    private static void logError(Logger logger, Throwable t, String... msg) {
        if (logger == null) {
            return;
        }
        String logStr = msg.length > 0 ? msg[0] : "release failed";
        if (causedByInterrupt(t)) {
            logger.debug(logStr, t);
        } else {
            logger.error(logStr, t);
        }
    }

    static boolean causedByInterrupt(Throwable t) {
        // A cancelled scan interrupts its threads, the resulting failures are expected.
        Throwable cur = t;
        for (int i = 0; cur != null && i < CAUSE_DEPTH; i++) {
            if (cur instanceof InterruptedIOException
                    || cur instanceof ClosedByInterruptException
                    || cur instanceof InterruptedException) {
                return true;
            }
            cur = cur.getCause();
        }
        return false;
    }

    @FunctionalInterface
    public static interface F0 {
        void f() throws Throwable;
    }
}
