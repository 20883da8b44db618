package io.mvccstore.segment;

import org.junit.Assert;
import org.junit.Test;

public class CancellationFlagTest {

    @Test
    public void firstReasonIsKept() {
        CancellationFlag flag = new CancellationFlag();
        Assert.assertFalse(flag.isCancelled());
        flag.checkForInterrupts();
        flag.cancel("first");
        flag.cancel("second");
        Assert.assertEquals("first", flag.reason());
        try {
            flag.checkForInterrupts();
            Assert.fail();
        } catch (ScanCancelledException e) {
            Assert.assertEquals("canceling statement: first", e.getMessage());
        }
    }

    @Test
    public void childFollowsParentButNotTheOtherWay() {
        CancellationFlag parent = new CancellationFlag();
        CancellationFlag child = new CancellationFlag(parent);
        child.cancel("child only");
        Assert.assertTrue(child.isCancelled());
        Assert.assertFalse(parent.isCancelled());

        CancellationFlag sibling = new CancellationFlag(parent);
        parent.cancel("everyone");
        Assert.assertEquals("everyone", sibling.reason());
        Assert.assertEquals("child only", child.reason());
    }

    @Test
    public void interruptedThreadStops() {
        CancellationFlag flag = new CancellationFlag();
        Thread.currentThread().interrupt();
        try {
            flag.checkForInterrupts();
            Assert.fail();
        } catch (ScanCancelledException e) {
            Assert.assertTrue(e.getMessage().contains("interrupted"));
        } finally {
            Thread.interrupted();
        }
    }
}
