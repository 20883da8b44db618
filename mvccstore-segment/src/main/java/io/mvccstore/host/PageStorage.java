package io.mvccstore.host;

import java.io.IOException;

/**
 * Block addressed storage of fixed-size pages, owned by the host database.
 */
public interface PageStorage {
    /**
     * The block holding the index header. It exists from creation on and is never freed.
     */
    long METAPAGE_BLOCK = 0;

    int pageSize();

    /**
     * Allocate a zeroed page, reusing a freed one if any.
     */
    long allocate() throws IOException;

    byte[] read(long block) throws IOException;

    void write(long block, byte[] page) throws IOException;

    /**
     * Hand the block back to the free space map.
     */
    void free(long block) throws IOException;

    BufferPin pin(long block);

    /**
     * Try to take the cleanup lock on a block, which only succeeds if nobody holds a pin on it.
     * The lock is released before returning, the answer is only a point-in-time observation.
     */
    boolean tryCleanup(long block);
}
