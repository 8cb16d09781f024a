package com.familygraph.graph;

import com.familygraph.model.RelationshipType;

/**
 * An edge with the same (person1, person2, type) triple already exists.
 */
public class DuplicateEdgeException extends FamilyGraphException {

    private final Long existingId;

    public DuplicateEdgeException(Long person1Id, Long person2Id, RelationshipType type, Long existingId) {
        super("Relationship '" + type.label() + "' from " + person1Id + " to " + person2Id
            + " already exists (id " + existingId + ")");
        this.existingId = existingId;
    }

    public Long getExistingId() {
        return existingId;
    }
}
