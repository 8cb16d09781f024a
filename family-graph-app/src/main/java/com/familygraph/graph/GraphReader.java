package com.familygraph.graph;

import com.familygraph.model.Person;
import com.familygraph.model.Relationship;
import com.familygraph.model.RelationshipType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to a {@link FamilyGraph}, valid only inside {@link FamilyGraph#read} or
 * {@link FamilyGraph#write}. Collections are live views and must not escape the callback.
 */
public interface GraphReader {

    Optional<Person> person(Long id);

    /** All people in insertion order. */
    Collection<Person> people();

    int personCount();

    Optional<Relationship> relationship(Long id);

    /** Every edge touching the person, from the adjacency index. */
    List<Relationship> relationshipsOf(Long personId);

    Collection<Relationship> relationships();

    int relationshipCount();

    Optional<Relationship> findEdge(Long person1Id, Long person2Id, RelationshipType type);

    /**
     * Parents of the person: person1 of PARENT edges where they are person2, and
     * person2 of edges whose reciprocal is PARENT (CHILD edges) where they are person1.
     */
    List<Long> parentsOf(Long personId);

    /** Mirror of {@link #parentsOf}. */
    List<Long> childrenOf(Long personId);

    ReciprocityResolver reciprocity();

    default Person requirePerson(Long id) {
        return person(id).orElseThrow(() -> NotFoundException.person(id));
    }
}
