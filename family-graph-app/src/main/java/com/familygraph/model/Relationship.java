package com.familygraph.model;

import java.time.LocalDate;

/**
 * A typed directed edge: person1 is the {@code type} of person2.
 */
public record Relationship(
    Long id,
    Long person1Id,
    Long person2Id,
    RelationshipType type,
    LocalDate startDate,
    LocalDate endDate,
    String notes
) {
    /** The other endpoint, or null when the person is not on this edge. */
    public Long otherPerson(Long personId) {
        if (person1Id.equals(personId)) return person2Id;
        if (person2Id.equals(personId)) return person1Id;
        return null;
    }

    public Relationship withPeople(Long newPerson1Id, Long newPerson2Id) {
        return new Relationship(id, newPerson1Id, newPerson2Id, type, startDate, endDate, notes);
    }
}
