package io.mvccstore.segment.index;

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import io.mvccstore.util.JsonUtil;

/**
 * Encoding of the segment components.
 * <ul>
 * <li>STORE: the documents, ordered by doc id.</li>
 * <li>POSTINGS: term key to the sorted doc ids holding it.</li>
 * <li>DELETE: the sorted ids of deleted docs.</li>
 * </ul>
 * The staged rows of a memory segment are a plain array of row ids.
 */
public class SegmentComponents {
    private static final TypeReference<List<StoredDocument>> DOC_LIST = new TypeReference<List<StoredDocument>>() {};
    private static final TypeReference<Map<String, int[]>> POSTINGS = new TypeReference<Map<String, int[]>>() {};

    public static byte[] encodeStore(List<StoredDocument> docs) {
        return JsonUtil.toJsonBytes(docs);
    }

    public static List<StoredDocument> decodeStore(byte[] bytes) throws IOException {
        return JsonUtil.fromJsonBytes(bytes, DOC_LIST);
    }

    public static byte[] encodePostings(Map<String, int[]> postings) {
        return JsonUtil.toJsonBytes(postings);
    }

    public static Map<String, int[]> decodePostings(byte[] bytes) throws IOException {
        return JsonUtil.fromJsonBytes(bytes, POSTINGS);
    }

    public static byte[] encodeDeletes(int[] docIds) {
        return JsonUtil.toJsonBytes(docIds);
    }

    public static int[] decodeDeletes(byte[] bytes) throws IOException {
        return JsonUtil.fromJsonBytes(bytes, int[].class);
    }

    public static byte[] encodeStagedRows(long[] rowIds) {
        return JsonUtil.toJsonBytes(rowIds);
    }

    public static long[] decodeStagedRows(byte[] bytes) throws IOException {
        return JsonUtil.fromJsonBytes(bytes, long[].class);
    }
}
