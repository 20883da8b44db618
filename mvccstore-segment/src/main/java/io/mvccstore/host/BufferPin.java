package io.mvccstore.host;

import java.io.Closeable;

/**
 * A held pin on one block. The block can not be cleanup-locked, and so not be reclaimed, until it is closed.
 */
public interface BufferPin extends Closeable {

    long block();

    /**
     * Release the pin. Releasing twice has no further effect.
     */
    @Override
    void close();
}
