package com.familygraph.graph;

/**
 * Base of every error the graph reports to its callers.
 */
public abstract class FamilyGraphException extends RuntimeException {

    protected FamilyGraphException(String message) {
        super(message);
    }

    protected FamilyGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
