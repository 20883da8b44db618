package io.mvccstore.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.mvccstore.host.Snapshot;

/**
 * A segment which is only a list of staged row ids. It has to be indexed on demand before it can be searched.
 *
 * Indexing happens as of {@link #snapshot()}, the snapshot of the transaction which staged the rows, not as of the
 * reader's snapshot.
 */
public class MemoryContent extends SegmentContent {
    @JsonProperty("stagedRows")
    private final FileEntry stagedRows;
    @JsonProperty("snapshot")
    private final Snapshot snapshot;

    @JsonCreator
    public MemoryContent(@JsonProperty("stagedRows") FileEntry stagedRows,
                         @JsonProperty("snapshot") Snapshot snapshot) {
        this.stagedRows = Preconditions.checkNotNull(stagedRows);
        this.snapshot = Preconditions.checkNotNull(snapshot);
    }

    public FileEntry stagedRows() {
        return stagedRows;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    @Override
    public boolean isPersisted() {
        return false;
    }

    @Override
    public long pintestBlock() {
        return stagedRows.startingBlock;
    }

    @Override
    public List<FileEntry> ownedFiles() {
        return Collections.singletonList(stagedRows);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryContent)) return false;
        MemoryContent that = (MemoryContent) o;
        return stagedRows.equals(that.stagedRows) && snapshot.equals(that.snapshot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stagedRows, snapshot);
    }

    @Override
    public String toString() {
        return "Memory{" + stagedRows + '}';
    }
}
