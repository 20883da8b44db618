package io.mvccstore.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A segment whose components are all flushed to page chains.
 */
public class PersistedContent extends SegmentContent {
    @JsonProperty("files")
    private final Map<SegmentComponent, FileEntry> files;

    @JsonCreator
    public PersistedContent(@JsonProperty("files") Map<SegmentComponent, FileEntry> files) {
        Preconditions.checkArgument(files != null && !files.isEmpty(), "persisted segment without files");
        this.files = Collections.unmodifiableMap(new EnumMap<>(files));
    }

    public Map<SegmentComponent, FileEntry> files() {
        return files;
    }

    /**
     * @return the file, or null if the segment does not have this component.
     */
    public FileEntry file(SegmentComponent component) {
        return files.get(component);
    }

    public PersistedContent withFile(SegmentComponent component, FileEntry entry) {
        EnumMap<SegmentComponent, FileEntry> newFiles = new EnumMap<>(files);
        newFiles.put(component, entry);
        return new PersistedContent(newFiles);
    }

    @Override
    public boolean isPersisted() {
        return true;
    }

    @Override
    public long pintestBlock() {
        // The map is ordered by component, the first one is always written first.
        return files.values().iterator().next().startingBlock;
    }

    @Override
    public List<FileEntry> ownedFiles() {
        return new ArrayList<>(files.values());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PersistedContent && files.equals(((PersistedContent) o).files));
    }

    @Override
    public int hashCode() {
        return files.hashCode();
    }

    @Override
    public String toString() {
        return "Persisted" + files;
    }
}
