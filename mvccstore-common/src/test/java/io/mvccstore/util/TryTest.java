package io.mvccstore.util;

import org.junit.Assert;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.atomic.AtomicInteger;

public class TryTest {
    private static final Logger logger = LoggerFactory.getLogger(TryTest.class);

    @Test
    public void failureDoesNotEscape() {
        AtomicInteger calls = new AtomicInteger();
        Assert.assertFalse(Try.on(() -> {
            calls.incrementAndGet();
            throw new IOException("expected in test");
        }, logger, "cleanup failed"));
        Assert.assertEquals(1, calls.get());
        Assert.assertFalse(Try.on(() -> {
            throw new IllegalStateException("no logger");
        }, null));
        Assert.assertTrue(Try.on(calls::incrementAndGet, logger));
        Assert.assertEquals(2, calls.get());
    }

    @Test
    public void interruptsAreRecognizedThroughCauses() {
        Assert.assertTrue(Try.causedByInterrupt(new InterruptedException()));
        Assert.assertTrue(Try.causedByInterrupt(new RuntimeException(new InterruptedIOException())));
        Assert.assertFalse(Try.causedByInterrupt(new IOException("disk")));

        Throwable deep = new InterruptedException();
        for (int i = 0; i < 5; i++) {
            deep = new RuntimeException(deep);
        }
        Assert.assertFalse(Try.causedByInterrupt(deep));
    }
}
