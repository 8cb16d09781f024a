package com.familygraph.model;

import java.util.List;

/**
 * Full copy of a graph at one committed version, as handed to persistence.
 */
public record GraphSnapshot(
    long version,
    List<Person> people,
    List<Relationship> relationships
) {
    public GraphSnapshot {
        people = List.copyOf(people);
        relationships = List.copyOf(relationships);
    }

    public static GraphSnapshot empty() {
        return new GraphSnapshot(0, List.of(), List.of());
    }
}
