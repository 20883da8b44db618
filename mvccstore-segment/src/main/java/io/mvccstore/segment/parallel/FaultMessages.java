package io.mvccstore.segment.parallel;

import org.apache.commons.lang.StringUtils;

import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Finds a displayable message in a worker fault, looking through wrapper exceptions at most a bounded number of
 * levels deep.
 */
public class FaultMessages {
    public static final String UNKNOWN = "unknown fault";

    public static String describe(Throwable fault, int maxDepth) {
        Throwable t = fault;
        for (int depth = 0; t != null && depth < maxDepth; depth++) {
            if (isWrapper(t) && t.getCause() != null) {
                t = t.getCause();
                continue;
            }
            if (!StringUtils.isBlank(t.getMessage())) {
                return t.getClass().getSimpleName() + ": " + t.getMessage();
            }
            if (t.getCause() == null || t.getCause() == t) {
                break;
            }
            t = t.getCause();
        }
        return fault == null ? UNKNOWN : UNKNOWN + " (" + fault.getClass().getName() + ")";
    }

    static boolean isWrapper(Throwable t) {
        return t instanceof ExecutionException
                || t instanceof CompletionException
                || t instanceof InvocationTargetException
                || t instanceof UndeclaredThrowableException
                || t instanceof UncheckedIOException;
    }
}
