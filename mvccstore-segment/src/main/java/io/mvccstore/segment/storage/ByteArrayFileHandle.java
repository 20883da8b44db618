package io.mvccstore.segment.storage;

import java.io.IOException;
import java.util.Arrays;

import io.mvccstore.segment.SegmentFileHandle;

public class ByteArrayFileHandle implements SegmentFileHandle {
    private final byte[] data;

    public ByteArrayFileHandle(byte[] data) {
        this.data = data;
    }

    @Override
    public long length() {
        return data.length;
    }

    @Override
    public byte[] read(long offset, int len) throws IOException {
        if (offset < 0 || len < 0 || offset + len > data.length) {
            throw new IOException(String.format("range [%s, %s) out of %s bytes", offset, offset + len, data.length));
        }
        return Arrays.copyOfRange(data, (int) offset, (int) offset + len);
    }
}
