package io.mvccstore.host;

import com.google.common.base.Preconditions;

/**
 * A row identifier packs the heap block number and the line offset inside that block into one long.
 * <pre>
 *     | 32 bits block | 16 bits offset |
 * </pre>
 */
public class RowIds {
    public static final long INVALID = -1L;
    public static final int MAX_OFFSET = 0xFFFF;

    public static long encode(long block, int offset) {
        Preconditions.checkArgument(block >= 0 && block <= 0xFFFF_FFFFL, "illegal block %s", block);
        Preconditions.checkArgument(offset >= 0 && offset <= MAX_OFFSET, "illegal offset %s", offset);
        return (block << 16) | offset;
    }

    public static long block(long rowId) {
        return rowId >>> 16;
    }

    public static int offset(long rowId) {
        return (int) (rowId & MAX_OFFSET);
    }

    public static String toString(long rowId) {
        return "(" + block(rowId) + "," + offset(rowId) + ")";
    }
}
