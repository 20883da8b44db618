package io.mvccstore.segment.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.mvccstore.segment.FileEntry;

/**
 * The index header kept in the metapage. It points at the page chains holding the segment list and the merge
 * list, so its own size does not grow with the index.
 */
public final class MetaPage {
    public static final MetaPage EMPTY = new MetaPage(null, null, 0);

    /** Null while the index has no segment list yet. */
    @JsonProperty("segments")
    public final FileEntry segments;
    /** Segments claimed by merges in flight. Null when no merge runs. */
    @JsonProperty("merges")
    public final FileEntry merges;
    /** Bumped on every change of the lists. */
    @JsonProperty("generation")
    public final long generation;

    @JsonCreator
    public MetaPage(@JsonProperty("segments") FileEntry segments,
                    @JsonProperty("merges") FileEntry merges,
                    @JsonProperty("generation") long generation) {
        this.segments = segments;
        this.merges = merges;
        this.generation = generation;
    }

    public MetaPage next(FileEntry segments, FileEntry merges) {
        return new MetaPage(segments, merges, generation + 1);
    }

    @Override
    public String toString() {
        return "MetaPage{" +
                "segments=" + segments +
                ", merges=" + merges +
                ", generation=" + generation +
                '}';
    }
}
