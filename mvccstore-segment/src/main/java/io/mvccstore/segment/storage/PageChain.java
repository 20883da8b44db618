package io.mvccstore.segment.storage;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import io.mvccstore.host.PageStorage;
import io.mvccstore.segment.FileEntry;
import io.mvccstore.util.Try;

/**
 * Stores a byte sequence as a linked list of pages.
 * <pre>
 *     | 8 bytes next block, -1 at the end | 4 bytes payload length | payload ... |
 * </pre>
 * Every chain has at least one page, even an empty one, so that its starting block can be pinned.
 */
public class PageChain {
    private static final Logger logger = LoggerFactory.getLogger(PageChain.class);

    public static final int HEADER_SIZE = 12;
    public static final long END = -1;

    private final PageStorage pages;
    private final int payloadCapacity;

    public PageChain(PageStorage pages) {
        this.pages = pages;
        this.payloadCapacity = pages.pageSize() - HEADER_SIZE;
        Preconditions.checkState(payloadCapacity > 0);
    }

    public int payloadCapacity() {
        return payloadCapacity;
    }

    public FileEntry write(byte[] data) throws IOException {
        int pageCount = Math.max(1, (data.length + payloadCapacity - 1) / payloadCapacity);
        long[] blocks = new long[pageCount];
        int allocated = 0;
        try {
            for (; allocated < pageCount; allocated++) {
                blocks[allocated] = pages.allocate();
            }
            for (int i = 0; i < pageCount; i++) {
                int from = i * payloadCapacity;
                int len = Math.min(payloadCapacity, data.length - from);
                long next = i + 1 < pageCount ? blocks[i + 1] : END;
                pages.write(blocks[i], encodePage(next, data, from, len));
            }
        } catch (IOException | RuntimeException e) {
            for (int i = 0; i < allocated; i++) {
                long block = blocks[i];
                Try.on(() -> pages.free(block), logger, "free block " + block);
            }
            throw e;
        }
        return new FileEntry(blocks[0], data.length);
    }

    public byte[] read(FileEntry entry) throws IOException {
        Preconditions.checkArgument(entry.totalBytes <= Integer.MAX_VALUE, "file too large: %s", entry);
        byte[] data = new byte[(int) entry.totalBytes];
        int pos = 0;
        long block = entry.startingBlock;
        while (block != END && pos < data.length) {
            ByteBuffer page = ByteBuffer.wrap(pages.read(block));
            long next = page.getLong();
            int len = page.getInt();
            checkLength(block, len, data.length - pos);
            page.get(data, pos, len);
            pos += len;
            block = next;
        }
        if (pos != data.length) {
            throw new IOException(String.format("truncated page chain at %s, read %s bytes", entry, pos));
        }
        return data;
    }

    /**
     * The blocks of the chain, in order.
     */
    public List<Long> blocks(FileEntry entry) throws IOException {
        List<Long> blocks = new ArrayList<>();
        long block = entry.startingBlock;
        while (block != END) {
            blocks.add(block);
            ByteBuffer page = ByteBuffer.wrap(pages.read(block));
            block = page.getLong();
        }
        return blocks;
    }

    /**
     * Read a range from the chain whose blocks are already known.
     */
    public byte[] read(List<Long> blocks, long offset, int len) throws IOException {
        byte[] data = new byte[len];
        int pos = 0;
        int pageIdx = (int) (offset / payloadCapacity);
        int inPage = (int) (offset % payloadCapacity);
        while (pos < len) {
            if (pageIdx >= blocks.size()) {
                throw new IOException(String.format("read beyond end of page chain, offset %s, len %s", offset, len));
            }
            long block = blocks.get(pageIdx);
            ByteBuffer page = ByteBuffer.wrap(pages.read(block));
            page.getLong();
            int pageLen = page.getInt();
            checkLength(block, pageLen, payloadCapacity);
            int n = Math.min(pageLen - inPage, len - pos);
            if (n <= 0) {
                throw new IOException(String.format("read beyond end of page chain, offset %s, len %s", offset, len));
            }
            System.arraycopy(page.array(), HEADER_SIZE + inPage, data, pos, n);
            pos += n;
            pageIdx++;
            inPage = 0;
        }
        return data;
    }

    public void free(FileEntry entry) throws IOException {
        for (long block : blocks(entry)) {
            pages.free(block);
        }
    }

    /**
     * Write a payload which must fit into one page, e.g. the metapage.
     */
    public void writeSinglePage(long block, byte[] payload) throws IOException {
        Preconditions.checkArgument(payload.length <= payloadCapacity,
                "payload of %s bytes does not fit into a page", payload.length);
        pages.write(block, encodePage(END, payload, 0, payload.length));
    }

    public byte[] readSinglePage(long block) throws IOException {
        ByteBuffer page = ByteBuffer.wrap(pages.read(block));
        page.getLong();
        int len = page.getInt();
        checkLength(block, len, payloadCapacity);
        byte[] payload = new byte[len];
        page.get(payload);
        return payload;
    }

    private byte[] encodePage(long next, byte[] data, int from, int len) {
        ByteBuffer page = ByteBuffer.allocate(pages.pageSize());
        page.putLong(next);
        page.putInt(len);
        page.put(data, from, len);
        return page.array();
    }

    private static void checkLength(long block, int len, int max) throws IOException {
        if (len < 0 || len > max) {
            throw new IOException(String.format("corrupt page %s, payload length %s", block, len));
        }
    }
}
