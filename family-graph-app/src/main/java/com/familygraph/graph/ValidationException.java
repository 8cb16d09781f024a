package com.familygraph.graph;

/**
 * Rejected input: missing or malformed field, bad date, negative depth, self edge,
 * unknown relationship type. Raised before anything is written.
 */
public class ValidationException extends FamilyGraphException {

    public ValidationException(String message) {
        super(message);
    }
}
