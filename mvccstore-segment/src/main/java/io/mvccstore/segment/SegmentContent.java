package io.mvccstore.segment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Where the data of a segment lives: flushed to pages, or still only a staged set of rows.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PersistedContent.class, name = "persisted"),
        @JsonSubTypes.Type(value = MemoryContent.class, name = "memory")})
public abstract class SegmentContent {

    @JsonIgnore
    public abstract boolean isPersisted();

    /**
     * The block a reader pins to keep this segment's pages from being reclaimed.
     */
    @JsonIgnore
    public abstract long pintestBlock();

    /**
     * All page chains owned by this content, freed together when the segment is recycled.
     */
    @JsonIgnore
    public abstract List<FileEntry> ownedFiles();
}
