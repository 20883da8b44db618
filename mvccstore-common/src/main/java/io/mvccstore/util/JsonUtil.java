package io.mvccstore.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Json encoding shared by the metapage, the segment components and the parallel worker messages.
 *
 * The mapper is configured once and never mutated afterwards, so it is safe to share between threads.
 */
public class JsonUtil {
    public static final ObjectMapper jsonMapper = new ObjectMapper();
    public static final ObjectMapper jsonMapperPretty = new ObjectMapper();

    static {
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        jsonMapper.configure(SerializationFeature.INDENT_OUTPUT, false);
        // Marker types such as the match-all query carry nothing but their type id.
        jsonMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        jsonMapperPretty.configure(SerializationFeature.INDENT_OUTPUT, true);
        jsonMapperPretty.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public static String toJson(Object v) {
        try {
            return jsonMapper.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJsonPretty(Object v) {
        try {
            return jsonMapperPretty.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] toJsonBytes(Object v) {
        try {
            return jsonMapper.writeValueAsBytes(v);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return jsonMapper.readValue(json, clazz);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Decode bytes produced by {@link #toJsonBytes(Object)}.
     * Unlike the string variants this one declares the failure, callers reading from storage should handle it.
     */
    public static <T> T fromJsonBytes(byte[] bytes, Class<T> clazz) throws IOException {
        return jsonMapper.readValue(bytes, clazz);
    }

    public static <T> T fromJsonBytes(byte[] bytes, TypeReference<T> ref) throws IOException {
        return jsonMapper.readValue(bytes, ref);
    }
}
