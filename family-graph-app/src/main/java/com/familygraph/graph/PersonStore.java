package com.familygraph.graph;

import com.familygraph.model.Person;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the Person records of one graph, keyed by id in insertion order.
 */
class PersonStore {

    private final Map<Long, Person> people = new LinkedHashMap<>();
    private long lastId;

    Optional<Person> get(Long id) {
        return Optional.ofNullable(people.get(id));
    }

    boolean contains(Long id) {
        return id != null && people.containsKey(id);
    }

    Collection<Person> all() {
        return Collections.unmodifiableCollection(people.values());
    }

    int size() {
        return people.size();
    }

    Long nextId() {
        return ++lastId;
    }

    void put(Person person) {
        people.put(person.id(), person);
        lastId = Math.max(lastId, person.id());
    }

    void remove(Long id) {
        people.remove(id);
    }
}
