package com.familygraph.graph;

import com.familygraph.model.Person;
import com.familygraph.model.Relationship;

/**
 * Store-level mutation primitives handed to {@link FamilyGraph#write}. They keep the
 * indexes in step but do not re-check invariants: callers validate first, then write.
 */
public interface GraphWriter extends GraphReader {

    Long nextPersonId();

    Long nextRelationshipId();

    void putPerson(Person person);

    /** Removes the person only; edges must already be gone. */
    void removePerson(Long id);

    /** Inserts or replaces by id. */
    void putRelationship(Relationship relationship);

    void removeRelationship(Long id);
}
