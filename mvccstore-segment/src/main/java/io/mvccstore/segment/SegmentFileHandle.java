package io.mvccstore.segment;

import java.io.IOException;

/**
 * Read access to one component of one segment.
 *
 * Handles are cached by the store which opened them and may be shared by several readers of that store.
 */
public interface SegmentFileHandle {

    long length();

    byte[] read(long offset, int len) throws IOException;

    default byte[] readAll() throws IOException {
        return read(0, (int) length());
    }
}
