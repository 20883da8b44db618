package io.mvccstore.segment.pin;

import org.junit.Assert;
import org.junit.Test;

import io.mvccstore.host.mem.MemoryPageStorage;

public class PinSetTest {

    @Test
    public void pinningTwiceHoldsOnePin() throws Exception {
        MemoryPageStorage pages = new MemoryPageStorage(128);
        long block = pages.allocate();
        PinSet pins = new PinSet(pages);

        Assert.assertTrue(pins.pin(block));
        Assert.assertFalse(pins.pin(block));
        Assert.assertEquals(1, pins.size());
        Assert.assertEquals(1, pages.pinCount(block));
        Assert.assertFalse(pages.tryCleanup(block));

        Assert.assertTrue(pins.unpin(block));
        Assert.assertFalse(pins.isPinned(block));
        Assert.assertEquals(0, pages.pinCount(block));
        Assert.assertTrue(pages.tryCleanup(block));
        Assert.assertFalse(pins.unpin(block));
    }

    @Test
    public void setsPinIndependently() throws Exception {
        MemoryPageStorage pages = new MemoryPageStorage(128);
        long a = pages.allocate();
        long b = pages.allocate();
        PinSet p1 = new PinSet(pages);
        PinSet p2 = new PinSet(pages);
        p1.pin(a);
        p1.pin(b);
        p2.pin(a);
        Assert.assertEquals(2, pages.pinCount(a));

        p1.unpinAll();
        Assert.assertEquals(0, p1.size());
        Assert.assertEquals(1, pages.pinCount(a));
        Assert.assertEquals(0, pages.pinCount(b));
        Assert.assertTrue(p2.blocks().contains(a));

        p2.unpinAll();
        Assert.assertTrue(pages.tryCleanup(a));
    }
}
