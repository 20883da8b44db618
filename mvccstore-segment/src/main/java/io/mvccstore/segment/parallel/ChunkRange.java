package io.mvccstore.segment.parallel;

import com.google.common.base.Preconditions;

/**
 * A contiguous share of {@code total} items split as evenly as possible over {@code parts}. The first
 * {@code total % parts} parts get one extra item.
 */
public final class ChunkRange {
    public final int start;
    public final int size;

    private ChunkRange(int start, int size) {
        this.start = start;
        this.size = size;
    }

    public static ChunkRange of(int total, int parts, int index) {
        Preconditions.checkArgument(total >= 0 && parts > 0, "bad split of %s over %s", total, parts);
        Preconditions.checkArgument(index >= 0 && index < parts, "part %s out of %s", index, parts);
        int base = total / parts;
        int rem = total % parts;
        int start = index * base + Math.min(index, rem);
        return new ChunkRange(start, base + (index < rem ? 1 : 0));
    }

    public int end() {
        return start + size;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end() + ")";
    }
}
