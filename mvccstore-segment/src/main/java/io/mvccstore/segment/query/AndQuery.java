package io.mvccstore.segment.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.apache.commons.lang.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.mvccstore.segment.index.SegmentIndex;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Docs matching all clauses. No clause at all matches every doc.
 */
public class AndQuery extends SearchQuery {
    @JsonProperty("clauses")
    public final List<SearchQuery> clauses;

    @JsonCreator
    public AndQuery(@JsonProperty("clauses") List<SearchQuery> clauses) {
        this.clauses = clauses == null ? Collections.<SearchQuery>emptyList() : Collections.unmodifiableList(clauses);
    }

    public static AndQuery of(SearchQuery... clauses) {
        return new AndQuery(Arrays.asList(clauses));
    }

    @Override
    public IntArrayList search(SegmentIndex index) {
        if (clauses.isEmpty()) {
            return index.liveDocs();
        }
        IntArrayList result = clauses.get(0).search(index);
        for (int i = 1; i < clauses.size() && !result.isEmpty(); i++) {
            result = intersect(result, clauses.get(i).search(index));
        }
        return result;
    }

    private static IntArrayList intersect(IntArrayList a, IntArrayList b) {
        IntArrayList out = new IntArrayList(Math.min(a.size(), b.size()));
        int i = 0, j = 0;
        while (i < a.size() && j < b.size()) {
            int x = a.getInt(i), y = b.getInt(j);
            if (x == y) {
                out.add(x);
                i++;
                j++;
            } else if (x < y) {
                i++;
            } else {
                j++;
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "(" + StringUtils.join(clauses, " AND ") + ")";
    }
}
