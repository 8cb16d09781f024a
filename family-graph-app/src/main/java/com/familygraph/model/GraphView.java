package com.familygraph.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Node/link projection consumed by the visualisation client.
 */
public record GraphView(List<Node> nodes, List<Link> links) {

    public static final String PARENT_CHILD = "parent_child";

    public record Node(
        Long id,
        String label,
        String fullName,
        String gender,
        LocalDate birthDate,
        LocalDate deathDate,
        String lifespan
    ) {
        public static Node of(Person person) {
            return new Node(
                person.id(),
                person.displayName(),
                person.fullName(),
                person.gender(),
                person.birthDate(),
                person.deathDate(),
                person.lifespan()
            );
        }
    }

    /** {@code relationshipIds} lists every stored edge folded into this link. */
    public record Link(Long source, Long target, String type, List<Long> relationshipIds) {}
}
