package io.mvccstore.segment.storage;

import java.io.IOException;
import java.util.List;

import io.mvccstore.segment.FileEntry;
import io.mvccstore.segment.SegmentFileHandle;

/**
 * A handle on a component stored as a page chain. The block list is walked once, on first read.
 */
public class PageChainFileHandle implements SegmentFileHandle {
    private final PageChain chain;
    private final FileEntry entry;
    private volatile List<Long> blocks;

    public PageChainFileHandle(PageChain chain, FileEntry entry) {
        this.chain = chain;
        this.entry = entry;
    }

    @Override
    public long length() {
        return entry.totalBytes;
    }

    @Override
    public byte[] read(long offset, int len) throws IOException {
        if (offset < 0 || len < 0 || offset + len > entry.totalBytes) {
            throw new IOException(String.format("range [%s, %s) out of file %s", offset, offset + len, entry));
        }
        if (len == 0) {
            return new byte[0];
        }
        List<Long> bs = blocks;
        if (bs == null) {
            bs = chain.blocks(entry);
            blocks = bs;
        }
        return chain.read(bs, offset, len);
    }

    @Override
    public String toString() {
        return "PageChainFileHandle{" + entry + '}';
    }
}
