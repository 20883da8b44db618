package io.mvccstore.segment;

/**
 * The logical files a segment is made of.
 */
public enum SegmentComponent {
    /**
     * Stored documents, with the row id each one was built from.
     */
    STORE("store"),
    /**
     * Term to document id lists.
     */
    POSTINGS("idx"),
    /**
     * Ids of the documents deleted after the segment was written. Optional.
     */
    DELETE("del");

    public final String extension;

    SegmentComponent(String extension) {
        this.extension = extension;
    }

    public String fileName(SegmentId id) {
        return id.id() + "." + extension;
    }
}
