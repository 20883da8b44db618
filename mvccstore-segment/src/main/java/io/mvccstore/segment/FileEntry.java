package io.mvccstore.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Locates a file stored as a chain of pages.
 */
public final class FileEntry {
    @JsonProperty("startingBlock")
    public final long startingBlock;
    @JsonProperty("totalBytes")
    public final long totalBytes;

    @JsonCreator
    public FileEntry(@JsonProperty("startingBlock") long startingBlock,
                     @JsonProperty("totalBytes") long totalBytes) {
        this.startingBlock = startingBlock;
        this.totalBytes = totalBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileEntry)) return false;
        FileEntry that = (FileEntry) o;
        return startingBlock == that.startingBlock && totalBytes == that.totalBytes;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(startingBlock) + Long.hashCode(totalBytes);
    }

    @Override
    public String toString() {
        return "FileEntry{" +
                "startingBlock=" + startingBlock +
                ", totalBytes=" + totalBytes +
                '}';
    }
}
