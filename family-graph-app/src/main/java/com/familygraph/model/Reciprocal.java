package com.familygraph.model;

/**
 * The semantic inverse of a relationship type and how it was found.
 */
public record Reciprocal(RelationshipType type, Resolution resolution) {

    public enum Resolution {
        /** The type is a key of the reciprocity table. */
        DIRECT,
        /** The type only appears as a table value with a single key. */
        REVERSE,
        /** The type only appears as a value of several keys; an override picked the inverse. */
        OVERRIDE,
        /** No inverse is defined; {@link #type()} is the input unchanged. */
        UNDEFINED
    }

    public boolean defined() {
        return resolution != Resolution.UNDEFINED;
    }
}
