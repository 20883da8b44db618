package io.mvccstore.segment.query;

import io.mvccstore.segment.index.SegmentIndex;
import it.unimi.dsi.fastutil.ints.IntArrayList;

public class AllQuery extends SearchQuery {

    @Override
    public IntArrayList search(SegmentIndex index) {
        return index.liveDocs();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AllQuery;
    }

    @Override
    public int hashCode() {
        return AllQuery.class.hashCode();
    }

    @Override
    public String toString() {
        return "all";
    }
}
