package com.familygraph.graph;

/**
 * Reads an entity id from a request field. Accepts JSON numbers and numeric strings.
 */
public final class Ids {

    private Ids() {
    }

    public static Long parse(Object value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.valueOf(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(field + " must be a numeric id: " + text);
            }
        }
        throw new ValidationException(field + " must be a numeric id");
    }
}
