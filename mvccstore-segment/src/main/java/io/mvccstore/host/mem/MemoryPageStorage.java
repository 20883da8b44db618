package io.mvccstore.host.mem;

import com.google.common.base.Preconditions;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import io.mvccstore.host.BufferPin;
import io.mvccstore.host.PageStorage;

/**
 * Pages kept in memory, with pin counting.
 */
public class MemoryPageStorage implements PageStorage {
    private final int pageSize;
    private final Map<Long, byte[]> pages = new ConcurrentHashMap<>();
    private final Map<Long, AtomicInteger> pins = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<Long> freeBlocks = new ConcurrentLinkedDeque<>();
    private final AtomicLong nextBlock = new AtomicLong(METAPAGE_BLOCK + 1);

    public MemoryPageStorage(int pageSize) {
        Preconditions.checkArgument(pageSize >= 64, "page size too small: %s", pageSize);
        this.pageSize = pageSize;
        pages.put(METAPAGE_BLOCK, new byte[pageSize]);
    }

    @Override
    public int pageSize() {
        return pageSize;
    }

    @Override
    public long allocate() {
        Long block = freeBlocks.pollFirst();
        if (block == null) {
            block = nextBlock.getAndIncrement();
        }
        pages.put(block, new byte[pageSize]);
        return block;
    }

    @Override
    public byte[] read(long block) throws IOException {
        byte[] page = pages.get(block);
        if (page == null) {
            throw new IOException("block " + block + " is not allocated");
        }
        return page.clone();
    }

    @Override
    public void write(long block, byte[] page) throws IOException {
        Preconditions.checkArgument(page.length == pageSize, "page of %s bytes, expected %s", page.length, pageSize);
        if (!pages.containsKey(block)) {
            throw new IOException("block " + block + " is not allocated");
        }
        pages.put(block, page.clone());
    }

    @Override
    public void free(long block) throws IOException {
        Preconditions.checkArgument(block != METAPAGE_BLOCK, "the metapage can not be freed");
        if (pages.remove(block) == null) {
            throw new IOException("block " + block + " is not allocated");
        }
        freeBlocks.addLast(block);
    }

    @Override
    public BufferPin pin(long block) {
        AtomicInteger count = pins.computeIfAbsent(block, b -> new AtomicInteger());
        count.incrementAndGet();
        AtomicBoolean released = new AtomicBoolean(false);
        return new BufferPin() {
            @Override
            public long block() {
                return block;
            }

            @Override
            public void close() {
                if (released.compareAndSet(false, true)) {
                    count.decrementAndGet();
                }
            }
        };
    }

    @Override
    public boolean tryCleanup(long block) {
        AtomicInteger count = pins.get(block);
        return count == null || count.get() == 0;
    }

    public int pinCount(long block) {
        AtomicInteger count = pins.get(block);
        return count == null ? 0 : count.get();
    }

    public boolean isAllocated(long block) {
        return pages.containsKey(block);
    }

    public int allocatedPages() {
        return pages.size();
    }
}
