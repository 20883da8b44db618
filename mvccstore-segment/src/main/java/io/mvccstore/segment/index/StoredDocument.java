package io.mvccstore.segment.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;

import io.mvccstore.host.RowIds;

/**
 * One document of a segment: the row it was built from and the indexed fields.
 *
 * A tombstone stands for a row which was physically gone when the segment was built. It keeps its doc id so that
 * doc ids stay dense, but carries no fields and is recorded as deleted.
 */
public final class StoredDocument {
    @JsonProperty("docId")
    public final int docId;
    @JsonProperty("rowId")
    public final long rowId;
    @JsonProperty("tombstone")
    public final boolean tombstone;
    @JsonProperty("fields")
    public final Map<String, Object> fields;

    @JsonCreator
    public StoredDocument(@JsonProperty("docId") int docId,
                          @JsonProperty("rowId") long rowId,
                          @JsonProperty("tombstone") boolean tombstone,
                          @JsonProperty("fields") Map<String, Object> fields) {
        this.docId = docId;
        this.rowId = rowId;
        this.tombstone = tombstone;
        this.fields = fields == null ? Collections.<String, Object>emptyMap() : Collections.unmodifiableMap(fields);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    @Override
    public String toString() {
        return "StoredDocument{" +
                "docId=" + docId +
                ", rowId=" + RowIds.toString(rowId) +
                (tombstone ? ", tombstone" : ", fields=" + fields) +
                '}';
    }
}
