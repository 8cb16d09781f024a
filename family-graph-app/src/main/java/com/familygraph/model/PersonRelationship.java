package com.familygraph.model;

/**
 * A stored relationship read from one person's side: "this person is the {@code role}
 * of {@code other}". When the person is person2 the role is the reciprocal type.
 */
public record PersonRelationship(
    Relationship relationship,
    Long otherPersonId,
    RelationshipType role,
    boolean roleDefined
) {}
