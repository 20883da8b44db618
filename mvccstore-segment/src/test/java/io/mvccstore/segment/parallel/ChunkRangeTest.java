package io.mvccstore.segment.parallel;

import org.junit.Assert;
import org.junit.Test;

public class ChunkRangeTest {

    @Test
    public void partsCoverTheWholeRange() {
        for (int total = 0; total < 40; total++) {
            for (int parts = 1; parts < 9; parts++) {
                int expectedStart = 0;
                int min = Integer.MAX_VALUE;
                int max = 0;
                for (int i = 0; i < parts; i++) {
                    ChunkRange r = ChunkRange.of(total, parts, i);
                    Assert.assertEquals(expectedStart, r.start);
                    expectedStart = r.end();
                    min = Math.min(min, r.size);
                    max = Math.max(max, r.size);
                }
                Assert.assertEquals(total, expectedStart);
                Assert.assertTrue(max - min <= 1);
            }
        }
    }

    @Test
    public void firstPartsTakeTheRemainder() {
        Assert.assertEquals(3, ChunkRange.of(10, 4, 0).size);
        Assert.assertEquals(3, ChunkRange.of(10, 4, 1).size);
        Assert.assertEquals(2, ChunkRange.of(10, 4, 2).size);
        Assert.assertEquals("[8, 10)", ChunkRange.of(10, 4, 3).toString());
        Assert.assertEquals(0, ChunkRange.of(2, 3, 2).size);
    }

    @Test(expected = IllegalArgumentException.class)
    public void indexOutOfRange() {
        ChunkRange.of(10, 3, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void noParts() {
        ChunkRange.of(10, 0, 0);
    }
}
