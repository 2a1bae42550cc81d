package com.mimecast.outpost.expr;

import java.util.List;

/**
 * Value conversions shared by expression nodes.
 */
public final class Values {

    private Values() {
        throw new IllegalStateException("Static class");
    }

    static boolean isTruthy(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (value instanceof Long) {
            return (Long) value != 0;
        } else if (value instanceof String) {
            return !((String) value).isEmpty();
        } else if (value instanceof List) {
            return !((List<?>) value).isEmpty();
        }
        return false;
    }

    /**
     * Converts to a number, strings holding an integer included.
     *
     * @param value Value.
     * @return Long or null when not numeric.
     */
    static Long toLong(Object value) {
        if (value instanceof Long) {
            return (Long) value;
        } else if (value instanceof Boolean) {
            return (Boolean) value ? 1L : 0L;
        } else if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Converts to text, lists are joined with commas.
     *
     * @param value Value.
     * @return String, empty for null.
     */
    public static String toString(Object value) {
        if (value == null) {
            return "";
        } else if (value instanceof List) {
            StringBuilder sb = new StringBuilder();
            for (Object item : (List<?>) value) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(toString(item));
            }
            return sb.toString();
        }
        return value.toString();
    }

    static boolean isEqual(Object left, Object right) {
        if (left instanceof Long || right instanceof Long) {
            Long l = toLong(left);
            Long r = toLong(right);
            if (l != null && r != null) {
                return l.equals(r);
            }
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return isTruthy(left) == isTruthy(right);
        }
        return toString(left).equals(toString(right));
    }
}
