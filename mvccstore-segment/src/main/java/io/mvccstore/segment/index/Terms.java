package io.mvccstore.segment.index;

/**
 * Normalizes field values into postings keys, so that e.g. an int and a long of the same value, or a double
 * holding an integral value, hit the same postings list.
 */
public class Terms {
    private static final char SEPARATOR = '\u0000';

    public static String key(String field, Object value) {
        return field + SEPARATOR + normalize(value);
    }

    public static String normalize(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return Long.toString(((Number) value).longValue());
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p53) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return value.toString();
    }

    /**
     * Compare two field values, numerically if both are numbers, else by their normalized text.
     * A null value sorts first.
     */
    public static int compare(Object v1, Object v2) {
        if (v1 == null || v2 == null) {
            return v1 == null ? (v2 == null ? 0 : -1) : 1;
        }
        if (v1 instanceof Number && v2 instanceof Number) {
            return Double.compare(((Number) v1).doubleValue(), ((Number) v2).doubleValue());
        }
        return normalize(v1).compareTo(normalize(v2));
    }
}
